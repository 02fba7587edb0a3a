package bio.terra.influxql.query;

import bio.terra.influxql.utils.InfluxQlQuoting;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.stringtemplate.v4.ST;

/** A selected column or function expression, or a group-by term. */
public class FieldVariable implements InfluxQlExpression {
  private static final String ALIAS_TEMPLATE = "<field> as <alias>";

  private final String expression;
  private final String alias;

  public FieldVariable(String expression) {
    this(expression, null);
  }

  public FieldVariable(String expression, String alias) {
    this.expression = expression;
    this.alias = StringUtils.isEmpty(alias) ? null : alias;
  }

  @Override
  public String renderInfluxQL() {
    String influxQL = InfluxQlQuoting.quoteIdentifier(expression);

    if (alias != null) {
      return new ST(ALIAS_TEMPLATE)
          .add("field", influxQL)
          .add("alias", InfluxQlQuoting.quoteAlias(alias))
          .render();
    }

    return influxQL;
  }

  public String getExpression() {
    return expression;
  }

  public String getAlias() {
    return alias == null ? "" : alias;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldVariable that)) {
      return false;
    }
    return Objects.equals(expression, that.expression) && Objects.equals(alias, that.alias);
  }

  @Override
  public int hashCode() {
    return Objects.hash(expression, alias);
  }
}
