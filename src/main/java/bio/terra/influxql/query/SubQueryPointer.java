package bio.terra.influxql.query;

public record SubQueryPointer(Query query) implements FromPointer {

  @Override
  public String renderInfluxQL() {
    return "(" + query.renderInfluxQL() + ")";
  }

  @Override
  public boolean isPresent() {
    return true;
  }
}
