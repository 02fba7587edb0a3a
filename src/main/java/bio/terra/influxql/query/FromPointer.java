package bio.terra.influxql.query;

/** Target of the FROM clause: a measurement or a nested query. */
public interface FromPointer extends InfluxQlExpression {

  /** False when there is nothing to select from, in which case no FROM clause is rendered. */
  boolean isPresent();
}
