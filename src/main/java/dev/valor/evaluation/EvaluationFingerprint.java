package dev.valor.evaluation;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.valor.evaluation.metrics.EvaluationParameters;
import dev.valor.evaluation.metrics.LabelMapping;
import dev.valor.query.LogicTreeLinearizer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Deterministic SHA-256 over the semantic content of an {@link EvaluationRequest}: sorted model
 * names, the compiled datum filter, the evaluation parameters and the task type.
 *
 * <p>The filter contributes its compiled form, so two documents that compile to the same predicates
 * share a fingerprint. Compiling also rejects invalid filters before any job exists.
 */
public final class EvaluationFingerprint {

  private EvaluationFingerprint() {
    // utility class
  }

  /**
   * Computes the fingerprint of a request.
   *
   * @param request the evaluation request
   * @return lowercase hex SHA-256
   * @throws dev.valor.filter.FilterCompilationException if the datum filter does not compile
   */
  public static String of(EvaluationRequest request) {
    return sha256(canonicalForm(request));
  }

  /** Canonical JSON text hashed by {@link #of}. */
  static String canonicalForm(EvaluationRequest request) {
    JsonNodeFactory json = JsonNodeFactory.instance;
    ObjectNode root = json.objectNode();
    ArrayNode models = root.putArray("models");
    request.modelNames().stream().sorted().forEach(models::add);
    if (request.datumFilter() == null) {
      root.putNull("filter");
    } else {
      root.set(
          "filter", LogicTreeLinearizer.linearize(request.datumFilter(), "").canonicalJson());
    }
    root.set("parameters", parameters(request.parameters()));
    root.put("taskType", request.parameters().taskType().value());
    return root.toString();
  }

  private static ObjectNode parameters(EvaluationParameters parameters) {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    ArrayNode compute = node.putArray("iouThresholdsToCompute");
    if (parameters.iouThresholdsToCompute() != null) {
      parameters.iouThresholdsToCompute().stream().sorted().forEach(compute::add);
    }
    ArrayNode ret = node.putArray("iouThresholdsToReturn");
    if (parameters.iouThresholdsToReturn() != null) {
      parameters.iouThresholdsToReturn().stream().sorted().forEach(ret::add);
    }
    List<LabelMapping> mappings = new ArrayList<>(parameters.labelMap());
    mappings.sort(
        Comparator.comparing((LabelMapping m) -> m.label().key())
            .thenComparing(m -> m.label().value())
            .thenComparing(m -> m.grouper().key())
            .thenComparing(m -> m.grouper().value()));
    ArrayNode labelMap = node.putArray("labelMap");
    for (LabelMapping mapping : mappings) {
      ArrayNode entry = labelMap.addArray();
      entry.addArray().add(mapping.label().key()).add(mapping.label().value());
      entry.addArray().add(mapping.grouper().key()).add(mapping.grouper().value());
    }
    return node;
  }

  private static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
