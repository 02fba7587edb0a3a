package bio.terra.influxql.query;

public enum OrderByDirection implements InfluxQlExpression {
  ASCENDING("ASC"),
  DESCENDING("DESC");

  private final String influxQL;

  OrderByDirection(String influxQL) {
    this.influxQL = influxQL;
  }

  public static OrderByDirection fromAscending(boolean ascending) {
    return ascending ? ASCENDING : DESCENDING;
  }

  @Override
  public String renderInfluxQL() {
    return influxQL;
  }
}
