package bio.terra.influxql.query;

import org.stringtemplate.v4.ST;

/**
 * Policy for filling intervals with no data in a {@code GROUP BY time(...)} query. The number is
 * only used by {@link FillType#NUMBER}.
 */
public record FillVariable(FillType type, int number) implements InfluxQlExpression {

  public FillVariable(FillType type) {
    this(type, 0);
  }

  public static FillVariable forNumber(int number) {
    return new FillVariable(FillType.NUMBER, number);
  }

  @Override
  public String renderInfluxQL() {
    if (type == FillType.NUMBER) {
      return new ST("FILL(<type>, <number>)")
          .add("type", type.renderInfluxQL())
          .add("number", number)
          .render();
    }
    return new ST("FILL(<type>)").add("type", type.renderInfluxQL()).render();
  }

  public enum FillType implements InfluxQlExpression {
    NULL("null"),
    PREVIOUS("previous"),
    NUMBER("number"),
    NONE("none"),
    LINEAR("linear");

    private final String influxQL;

    FillType(String influxQL) {
      this.influxQL = influxQL;
    }

    @Override
    public String renderInfluxQL() {
      return influxQL;
    }
  }
}
