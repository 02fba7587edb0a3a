package bio.terra.influxql.query;

public record OrderByVariable(FieldVariable fieldVariable, OrderByDirection direction)
    implements InfluxQlExpression {

  public OrderByVariable(FieldVariable fieldVariable) {
    this(fieldVariable, OrderByDirection.ASCENDING);
  }

  @Override
  public String renderInfluxQL() {
    return fieldVariable.renderInfluxQL() + " " + direction.renderInfluxQL();
  }
}
