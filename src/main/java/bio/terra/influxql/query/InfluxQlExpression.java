package bio.terra.influxql.query;

public interface InfluxQlExpression {
  String renderInfluxQL();
}
