package bio.terra.influxql.query.filtervariable;

import bio.terra.influxql.query.FilterVariable;
import bio.terra.influxql.query.InfluxQlExpression;
import bio.terra.influxql.utils.InfluxQlQuoting;
import org.stringtemplate.v4.ST;

/**
 * A comparison of a field against a value. The field is quoted like any identifier and the value
 * is single-quoted unless it contains a function call such as {@code now()}.
 */
public record BinaryFilterVariable(String field, String operator, Object value)
    implements FilterVariable {
  private static final String SUBSTITUTION_TEMPLATE = "<field> <operator> <value>";

  public BinaryFilterVariable(String field, BinaryOperator operator, Object value) {
    this(field, operator.renderInfluxQL(), value);
  }

  @Override
  public String renderInfluxQL() {
    return new ST(SUBSTITUTION_TEMPLATE)
        .add("field", InfluxQlQuoting.quoteIdentifier(field))
        .add("operator", operator)
        .add("value", InfluxQlQuoting.quoteValue(value))
        .render();
  }

  public enum BinaryOperator implements InfluxQlExpression {
    EQUALS("="),
    NOT_EQUALS("!="),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN_OR_EQUAL(">=");

    private final String influxQL;

    BinaryOperator(String influxQL) {
      this.influxQL = influxQL;
    }

    @Override
    public String renderInfluxQL() {
      return influxQL;
    }
  }
}
