package bio.terra.influxql.query.filtervariable;

import bio.terra.influxql.query.FilterVariable;

/** A condition written by the caller. It is rendered exactly as given. */
public record RawFilterVariable(String influxQL) implements FilterVariable {

  @Override
  public String renderInfluxQL() {
    return influxQL;
  }
}
