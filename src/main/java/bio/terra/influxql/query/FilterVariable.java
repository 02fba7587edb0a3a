package bio.terra.influxql.query;

/** A single condition of the WHERE clause. Conditions are joined with AND. */
public interface FilterVariable extends InfluxQlExpression {}
