package dev.valor.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.valor.filter.Comparison;
import dev.valor.filter.FilterExpression;
import dev.valor.filter.FilterOperator;
import dev.valor.filter.FilterType;
import dev.valor.filter.Junction;
import dev.valor.filter.Negation;
import dev.valor.filter.NullCheck;
import dev.valor.filter.Symbol;
import dev.valor.filter.SymbolName;
import dev.valor.filter.TypeMismatchException;
import dev.valor.filter.Value;
import java.util.List;
import org.junit.jupiter.api.Test;

class LogicTreeLinearizerTest {

  private static Comparison datasetIs(String name) {
    return new Comparison(
        FilterOperator.EQ,
        Symbol.of(SymbolName.DATASET_NAME, FilterType.STRING),
        Value.of(FilterType.STRING, name));
  }

  private static NullCheck hasBox() {
    return new NullCheck(
        FilterOperator.IS_NOT_NULL, Symbol.of(SymbolName.ANNOTATION_BOX, FilterType.BOX));
  }

  @Test
  void singleLeafBecomesIndexZero() {
    LinearizedFilter linearized = LogicTreeLinearizer.linearize(datasetIs("ds1"), "");

    assertThat(linearized.skeleton()).isEqualTo(new Skeleton.Leaf(0));
    assertThat(linearized.predicateSets()).hasSize(1);
    assertThat(linearized.predicateSets().get(0).name()).isEqualTo("ps0");
  }

  @Test
  void leavesAreNumberedDepthFirst() {
    FilterExpression filter =
        new Junction(
            FilterOperator.AND,
            List.of(
                datasetIs("a"),
                new Negation(
                    new Junction(FilterOperator.OR, List.of(hasBox(), datasetIs("b")))),
                datasetIs("c")));

    LinearizedFilter linearized = LogicTreeLinearizer.linearize(filter, "");

    assertThat(linearized.skeleton().toJson().toString())
        .isEqualTo("{\"and\":[0,{\"not\":{\"or\":[1,2]}},3]}");
    assertThat(linearized.predicateSets())
        .extracting(PredicateSet::name)
        .containsExactly("ps0", "ps1", "ps2", "ps3");
    assertThat(linearized.predicateSets().get(3).params()).containsEntry("ps3_0", "c");
  }

  @Test
  void duplicateLeavesAreCompiledPerOccurrence() {
    FilterExpression filter =
        new Junction(FilterOperator.OR, List.of(datasetIs("a"), datasetIs("a")));

    LinearizedFilter linearized = LogicTreeLinearizer.linearize(filter, "");

    assertThat(linearized.predicateSets()).hasSize(2);
  }

  @Test
  void namespacePrefixesPredicateAndParameterNames() {
    LinearizedFilter linearized = LogicTreeLinearizer.linearize(datasetIs("a"), "gt_");

    PredicateSet set = linearized.predicateSets().get(0);
    assertThat(set.name()).isEqualTo("gt_ps0");
    assertThat(set.params()).containsOnlyKeys("gt_ps0_0");
  }

  @Test
  void canonicalJsonIsStableAcrossCompilations() {
    FilterExpression filter =
        new Junction(FilterOperator.XOR, List.of(datasetIs("a"), hasBox()));

    String first = LogicTreeLinearizer.linearize(filter, "").canonicalJson().toString();
    String second = LogicTreeLinearizer.linearize(filter, "").canonicalJson().toString();

    assertThat(first).isEqualTo(second).contains("\"skeleton\":{\"xor\":[0,1]}");
  }

  @Test
  void compileErrorInAnyLeafFailsTheWholeFilter() {
    FilterExpression filter =
        new Junction(
            FilterOperator.AND,
            List.of(
                datasetIs("a"),
                new Comparison(
                    FilterOperator.EQ,
                    Symbol.of(SymbolName.DATUM_UID, FilterType.STRING),
                    Value.of(3L))));

    assertThatThrownBy(() -> LogicTreeLinearizer.linearize(filter, ""))
        .isInstanceOf(TypeMismatchException.class);
  }
}
