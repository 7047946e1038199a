package dev.valor.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.valor.filter.AttributeModifier;
import dev.valor.filter.FilterOperator;
import dev.valor.filter.FilterType;
import dev.valor.filter.KeyAccessException;
import dev.valor.filter.MalformedFilterException;
import dev.valor.filter.OperatorCategory;
import dev.valor.filter.OwnerEntity;
import dev.valor.filter.Symbol;
import dev.valor.filter.SymbolName;
import dev.valor.filter.TypeMismatchException;
import dev.valor.filter.UnsupportedOperatorException;
import dev.valor.filter.Value;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class PredicateCompilerTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final Symbol DATASET_NAME = Symbol.of(SymbolName.DATASET_NAME, FilterType.STRING);
  private static final Symbol BOX = Symbol.of(SymbolName.ANNOTATION_BOX, FilterType.BOX);

  private static Value json(FilterType type, String text) throws Exception {
    return new Value(type, MAPPER.readTree(text));
  }

  @Test
  void stringEqualityBindsTheLiteral() {
    PredicateSet set =
        PredicateCompiler.compileLeaf(
            FilterOperator.EQ, DATASET_NAME, Value.of(FilterType.STRING, "ds1"), "ps0");

    assertThat(set.name()).isEqualTo("ps0");
    assertThat(set.owner()).isEqualTo(OwnerEntity.DATASET);
    assertThat(set.sql())
        .isEqualTo("SELECT datasets.id AS id FROM datasets WHERE datasets.name = :ps0_0");
    assertThat(set.params()).containsExactly(entry("ps0_0", "ds1"));
  }

  @Test
  void compilationIsDeterministic() {
    Symbol height = new Symbol(SymbolName.DATUM_METADATA, "height", null, FilterType.INTEGER);

    PredicateSet first =
        PredicateCompiler.compileLeaf(FilterOperator.GE, height, Value.of(10L), "ps3");
    PredicateSet second =
        PredicateCompiler.compileLeaf(FilterOperator.GE, height, Value.of(10L), "ps3");

    assertThat(first).isEqualTo(second);
  }

  @Test
  void integerValueAgainstStringSymbolIsTypeMismatch() {
    assertThatThrownBy(
            () -> PredicateCompiler.compileLeaf(FilterOperator.EQ, DATASET_NAME, Value.of(5L), "p"))
        .isInstanceOf(TypeMismatchException.class)
        .hasMessageContaining("integer");
  }

  @Test
  void declaredDtypeMustMatchColumnType() {
    Symbol wrong = Symbol.of(SymbolName.DATASET_NAME, FilterType.INTEGER);

    assertThatThrownBy(
            () -> PredicateCompiler.compileLeaf(FilterOperator.EQ, wrong, Value.of(5L), "p"))
        .isInstanceOf(TypeMismatchException.class);
  }

  @Test
  void orderingOperatorOnStringIsUnsupported() {
    assertThatThrownBy(
            () ->
                PredicateCompiler.compileLeaf(
                    FilterOperator.GT, DATASET_NAME, Value.of(FilterType.STRING, "a"), "p"))
        .isInstanceOf(UnsupportedOperatorException.class)
        .isInstanceOfSatisfying(
            UnsupportedOperatorException.class,
            e -> assertThat(e.errorType()).isEqualTo("UnsupportedOperatorError"));
  }

  @Test
  void isNullIsUnsupportedOnNonNullableSymbol() {
    assertThatThrownBy(
            () -> PredicateCompiler.compileLeaf(FilterOperator.IS_NULL, DATASET_NAME, null, "p"))
        .isInstanceOf(UnsupportedOperatorException.class);
  }

  @Test
  void keyOnNonDictionaryIsKeyAccessError() {
    Symbol keyed = new Symbol(SymbolName.DATASET_NAME, "x", null, FilterType.STRING);

    assertThatThrownBy(
            () ->
                PredicateCompiler.compileLeaf(
                    FilterOperator.EQ, keyed, Value.of(FilterType.STRING, "a"), "p"))
        .isInstanceOf(KeyAccessException.class)
        .isInstanceOfSatisfying(
            KeyAccessException.class, e -> assertThat(e.errorType()).isEqualTo("KeyAccessError"));
  }

  @Test
  void keyedMetadataSymbolIsNullableAndTypeGuarded() {
    Symbol height = new Symbol(SymbolName.DATUM_METADATA, "height", null, FilterType.INTEGER);

    assertThat(PredicateCompiler.effectiveCategories(height))
        .containsExactlyInAnyOrder(
            OperatorCategory.NULLABLE, OperatorCategory.EQUATABLE, OperatorCategory.QUANTIFIABLE);

    PredicateSet set =
        PredicateCompiler.compileLeaf(FilterOperator.IS_NOT_NULL, height, null, "ps1");
    assertThat(set.sql())
        .isEqualTo(
            "SELECT datums.id AS id FROM datums WHERE "
                + "(CASE WHEN jsonb_typeof(datums.meta -> :ps1_0) = 'number' "
                + "THEN safe_float8(datums.meta ->> :ps1_0) END) IS NOT NULL");
    assertThat(set.params()).containsEntry("ps1_0", "height");
  }

  @Test
  void temporalAndGeometricMetadataReadsGoThroughSafeCasts() {
    Symbol captured = new Symbol(SymbolName.DATUM_METADATA, "captured", null, FilterType.DATETIME);
    Symbol roi = new Symbol(SymbolName.DATUM_METADATA, "roi", null, FilterType.POLYGON);

    String datetimeSql =
        PredicateCompiler.compileLeaf(FilterOperator.IS_NULL, captured, null, "ps2").sql();
    String geometrySql =
        PredicateCompiler.compileLeaf(FilterOperator.IS_NULL, roi, null, "ps3").sql();

    assertThat(datetimeSql)
        .contains("THEN safe_timestamptz(datums.meta ->> :ps2_0) END")
        .doesNotContain("AS timestamptz");
    assertThat(geometrySql)
        .contains("THEN safe_geometry(datums.meta -> :ps3_0) END")
        .doesNotContain("ST_GeomFromGeoJSON");
  }

  @Test
  void hostileStringsOnlyReachBindParameters() {
    String hostile = "x'; DROP TABLE datasets; --";
    Symbol keyed = new Symbol(SymbolName.DATASET_METADATA, hostile, null, FilterType.STRING);

    PredicateSet set =
        PredicateCompiler.compileLeaf(
            FilterOperator.EQ, keyed, Value.of(FilterType.STRING, hostile), "ps0");

    assertThat(set.sql()).doesNotContain("DROP").doesNotContain(hostile);
    assertThat(set.params()).containsValue(hostile).hasSize(2);
  }

  @Test
  void spatialOperatorsMapToCoverage() throws Exception {
    Value window = json(FilterType.BOX, "[[[0,0],[10,0],[10,10],[0,10],[0,0]]]");

    String inside = PredicateCompiler.compileLeaf(FilterOperator.INSIDE, BOX, window, "p").sql();
    String contains =
        PredicateCompiler.compileLeaf(FilterOperator.CONTAINS, BOX, window, "p").sql();
    String outside =
        PredicateCompiler.compileLeaf(FilterOperator.OUTSIDE, BOX, window, "p").sql();

    assertThat(inside).endsWith("ST_Covers(ST_GeomFromGeoJSON(:p_0), annotations.box)");
    assertThat(contains).endsWith("ST_Covers(annotations.box, ST_GeomFromGeoJSON(:p_0))");
    assertThat(outside).endsWith("NOT ST_Covers(ST_GeomFromGeoJSON(:p_0), annotations.box)");
  }

  @Test
  void geometryLiteralIsBoundAsGeoJson() throws Exception {
    Value window = json(FilterType.BOX, "[[[0,0],[4,0],[4,2],[0,2],[0,0]]]");

    PredicateSet set = PredicateCompiler.compileLeaf(FilterOperator.INTERSECTS, BOX, window, "p");

    assertThat(set.params().get("p_0"))
        .isEqualTo("{\"type\":\"Polygon\",\"coordinates\":[[[0,0],[4,0],[4,2],[0,2],[0,0]]]}");
  }

  @Test
  void spatialOperatorOnRasterConvertsToPolygon() throws Exception {
    Symbol raster = Symbol.of(SymbolName.ANNOTATION_RASTER, FilterType.RASTER);
    Value point = json(FilterType.POINT, "[1,1]");

    assertThatThrownBy(
            () -> PredicateCompiler.compileLeaf(FilterOperator.INTERSECTS, raster, point, "p"))
        .isInstanceOf(TypeMismatchException.class);

    Symbol other = Symbol.of(SymbolName.ANNOTATION_RASTER, FilterType.RASTER);
    String sql =
        PredicateCompiler.compileLeaf(FilterOperator.INTERSECTS, raster, other, "p").sql();
    assertThat(sql)
        .endsWith("ST_Intersects(ST_Polygon(annotations.raster), ST_Polygon(annotations.raster))");
  }

  @Test
  void areaModifierComparesWithNumbers() {
    Symbol area =
        new Symbol(SymbolName.ANNOTATION_RASTER, null, AttributeModifier.AREA, FilterType.RASTER);

    PredicateSet set = PredicateCompiler.compileLeaf(FilterOperator.GT, area, Value.of(100L), "p");

    assertThat(set.sql()).endsWith("ST_Count(annotations.raster) > :p_0");
    assertThat(set.params()).containsEntry("p_0", 100L);
  }

  @Test
  void areaModifierRejectsNonGeometricSymbol() {
    Symbol area =
        new Symbol(SymbolName.DATASET_NAME, null, AttributeModifier.AREA, FilterType.STRING);

    assertThatThrownBy(
            () -> PredicateCompiler.compileLeaf(FilterOperator.GT, area, Value.of(1L), "p"))
        .isInstanceOf(UnsupportedOperatorException.class);
  }

  @Test
  void labelEqualityMatchesKeyAndValue() throws Exception {
    Symbol labels = Symbol.of(SymbolName.ANNOTATION_LABELS, FilterType.LABEL);
    Value dog = json(FilterType.LABEL, "{\"key\":\"class\",\"value\":\"dog\"}");

    PredicateSet set = PredicateCompiler.compileLeaf(FilterOperator.EQ, labels, dog, "ps2");

    assertThat(set.owner()).isEqualTo(OwnerEntity.LABEL);
    assertThat(set.sql())
        .isEqualTo(
            "SELECT labels.id AS id FROM labels WHERE "
                + "(labels.key = :ps2_0 AND labels.value = :ps2_1)");
    assertThat(set.params()).containsEntry("ps2_0", "class").containsEntry("ps2_1", "dog");
  }

  @Test
  void symbolsOfDifferentEntitiesCannotBeCompared() {
    Symbol uid = Symbol.of(SymbolName.DATUM_UID, FilterType.STRING);

    assertThatThrownBy(
            () -> PredicateCompiler.compileLeaf(FilterOperator.EQ, DATASET_NAME, uid, "p"))
        .isInstanceOf(MalformedFilterException.class);
  }

  @Test
  void dateLiteralIsBoundAsLocalDate() throws Exception {
    Symbol created = new Symbol(SymbolName.DATUM_METADATA, "captured", null, FilterType.DATE);

    PredicateSet set =
        PredicateCompiler.compileLeaf(
            FilterOperator.LT, created, Value.of(FilterType.DATE, "2024-01-31"), "p");

    assertThat(set.params()).containsEntry("p_1", LocalDate.of(2024, 1, 31));
  }

  @Test
  void taskTypeIsNormalized() {
    Symbol taskType = Symbol.of(SymbolName.ANNOTATION_TASK_TYPE, FilterType.TASK_TYPE);

    PredicateSet set =
        PredicateCompiler.compileLeaf(
            FilterOperator.EQ, taskType, Value.of(FilterType.TASK_TYPE, "Classification"), "p");

    assertThat(set.params()).containsEntry("p_0", "classification");
  }
}
