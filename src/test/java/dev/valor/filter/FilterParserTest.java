package dev.valor.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.Test;

class FilterParserTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static JsonNode json(String text) throws Exception {
    return MAPPER.readTree(text.replace('\'', '"'));
  }

  @Test
  void nullDocumentMeansNoFilter() {
    assertThat(FilterParser.parse(null)).isNull();
    assertThat(FilterParser.parse(NullNode.getInstance())).isNull();
  }

  @Test
  void parsesComparisonWithValue() throws Exception {
    FilterExpression expression =
        FilterParser.parse(
            json(
                "{'op':'eq','lhs':{'name':'dataset.name','dtype':'string'},"
                    + "'rhs':{'type':'string','value':'ds1'}}"));

    assertThat(expression).isInstanceOf(Comparison.class);
    Comparison comparison = (Comparison) expression;
    assertThat(comparison.op()).isEqualTo(FilterOperator.EQ);
    assertThat(comparison.lhs()).isEqualTo(Symbol.of(SymbolName.DATASET_NAME, FilterType.STRING));
    assertThat(comparison.rhs()).isEqualTo(Value.of(FilterType.STRING, "ds1"));
  }

  @Test
  void parsesKeyAndAttributeOnSymbol() throws Exception {
    Comparison comparison =
        (Comparison)
            FilterParser.parse(
                json(
                    "{'op':'gt','lhs':{'name':'annotation.metadata','key':'region',"
                        + "'attribute':'area','dtype':'polygon'},"
                        + "'rhs':{'type':'float','value':10.5}}"));

    assertThat(comparison.lhs().key()).isEqualTo("region");
    assertThat(comparison.lhs().attribute()).isEqualTo(AttributeModifier.AREA);
    assertThat(comparison.lhs().dtype()).isEqualTo(FilterType.POLYGON);
  }

  @Test
  void rhsWithNameIsParsedAsSymbol() throws Exception {
    Comparison comparison =
        (Comparison)
            FilterParser.parse(
                json(
                    "{'op':'intersects','lhs':{'name':'annotation.box','dtype':'box'},"
                        + "'rhs':{'name':'annotation.polygon','dtype':'polygon'}}"));

    assertThat(comparison.rhs()).isInstanceOf(Symbol.class);
  }

  @Test
  void parsesNestedLogic() throws Exception {
    FilterExpression expression =
        FilterParser.parse(
            json(
                "{'op':'and','args':["
                    + "{'op':'isnull','arg':{'name':'annotation.box','dtype':'box'}},"
                    + "{'op':'not','arg':{'op':'eq','lhs':{'name':'datum.uid','dtype':'string'},"
                    + "'rhs':{'type':'string','value':'uid1'}}}]}"));

    assertThat(expression).isInstanceOf(Junction.class);
    Junction junction = (Junction) expression;
    assertThat(junction.args()).hasSize(2);
    assertThat(junction.args().get(0)).isInstanceOf(NullCheck.class);
    assertThat(junction.args().get(1)).isInstanceOf(Negation.class);
  }

  @Test
  void toJsonParsesBackToSameTree() throws Exception {
    FilterExpression expression =
        FilterParser.parse(
            json(
                "{'op':'or','args':["
                    + "{'op':'eq','lhs':{'name':'annotation.labels','dtype':'label'},"
                    + "'rhs':{'type':'label','value':{'key':'class','value':'dog'}}},"
                    + "{'op':'le','lhs':{'name':'datum.metadata','key':'height','dtype':'integer'},"
                    + "'rhs':{'type':'integer','value':5}}]}"));

    assertThat(FilterParser.parse(expression.toJson())).isEqualTo(expression);
  }

  @Test
  void missingOperatorIsStructuralError() throws Exception {
    assertThatThrownBy(() -> FilterParser.parse(json("{'args':[]}")))
        .isInstanceOf(MalformedFilterException.class)
        .hasMessageContaining("'op'");
  }

  @Test
  void unknownOperatorIsStructuralError() throws Exception {
    assertThatThrownBy(() -> FilterParser.parse(json("{'op':'like','arg':{}}")))
        .isInstanceOfSatisfying(
            MalformedFilterException.class,
            e -> assertThat(e.errorType()).isEqualTo("StructuralError"));
  }

  @Test
  void notGivenListIsStructuralError() throws Exception {
    assertThatThrownBy(
            () ->
                FilterParser.parse(
                    json(
                        "{'op':'not','arg':[{'op':'isnull','arg':"
                            + "{'name':'annotation.box','dtype':'box'}}]}")))
        .isInstanceOf(MalformedFilterException.class)
        .hasMessageContaining("not a list");
  }

  @Test
  void binaryOperatorGivenArgIsStructuralError() throws Exception {
    assertThatThrownBy(
            () ->
                FilterParser.parse(
                    json("{'op':'eq','arg':{'name':'dataset.name','dtype':'string'}}")))
        .isInstanceOf(MalformedFilterException.class)
        .hasMessageContaining("binary");
  }

  @Test
  void emptyJunctionIsStructuralError() throws Exception {
    assertThatThrownBy(() -> FilterParser.parse(json("{'op':'and','args':[]}")))
        .isInstanceOf(MalformedFilterException.class)
        .hasMessageContaining("at least one");
  }

  @Test
  void unknownSymbolIsSymbolError() throws Exception {
    assertThatThrownBy(
            () ->
                FilterParser.parse(
                    json("{'op':'isnull','arg':{'name':'datum.colour','dtype':'string'}}")))
        .isInstanceOfSatisfying(
            UnknownSymbolException.class,
            e -> assertThat(e.errorType()).isEqualTo("SymbolError"));
  }

  @Test
  void unknownDtypeIsStructuralError() throws Exception {
    assertThatThrownBy(
            () ->
                FilterParser.parse(
                    json("{'op':'isnull','arg':{'name':'datum.uid','dtype':'uuid'}}")))
        .isInstanceOf(MalformedFilterException.class);
  }

  @Test
  void valueFailingItsValidatorIsRejected() throws Exception {
    assertThatThrownBy(
            () ->
                FilterParser.parse(
                    json(
                        "{'op':'eq','lhs':{'name':'datum.metadata','key':'n','dtype':'integer'},"
                            + "'rhs':{'type':'integer','value':3.5}}")))
        .isInstanceOf(MalformedFilterException.class)
        .hasMessageContaining("integer");
  }
}
