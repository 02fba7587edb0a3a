package bio.terra.influxql.query;

import bio.terra.influxql.query.FillVariable.FillType;
import bio.terra.influxql.query.filtervariable.BinaryFilterVariable;
import bio.terra.influxql.query.filtervariable.BinaryFilterVariable.BinaryOperator;
import bio.terra.influxql.query.filtervariable.RawFilterVariable;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fluent builder that accumulates the clauses of an InfluxQL query.
 *
 * <p>Methods may be called in any order; every mutator returns this builder so calls can be
 * chained. {@link #render()} can be called any number of times and never changes the builder.
 *
 * <pre>{@code
 * String influxQL =
 *     new QueryBuilder()
 *         .addSelect("mean(value)", "avg")
 *         .setFrom("telegraf", "autogen", "cpu")
 *         .addWhere("time", ">", "now()-1h")
 *         .addGroupByTime("10m")
 *         .setFillNone()
 *         .render();
 * }</pre>
 *
 * <p>Instances are not thread-safe. Use {@link #build()} to get an immutable {@link Query} that can
 * be shared.
 */
public class QueryBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(QueryBuilder.class);

  private final List<FieldVariable> select = new ArrayList<>();
  private FromPointer from;
  private final List<FilterVariable> where = new ArrayList<>();
  private final List<FieldVariable> groupBy = new ArrayList<>();
  private final List<OrderByVariable> orderBy = new ArrayList<>();
  private FillVariable fill;
  private Integer limit;
  private Integer seriesLimit;

  public QueryBuilder addSelect(String column) {
    return addSelect(column, null);
  }

  /** Select a column or function expression. An empty or null alias means no alias. */
  public QueryBuilder addSelect(String column, String alias) {
    select.add(new FieldVariable(column, alias));
    return this;
  }

  public QueryBuilder setFrom(String measurement) {
    return setFrom(MeasurementPointer.fromMeasurement(measurement));
  }

  public QueryBuilder setFrom(String database, String retentionPolicy, String measurement) {
    return setFrom(new MeasurementPointer(database, retentionPolicy, measurement));
  }

  public QueryBuilder setFromSubQuery(Query subQuery) {
    return setFrom(new SubQueryPointer(subQuery));
  }

  /** Select from the current state of another builder. Later changes to it are not seen here. */
  public QueryBuilder setFromSubQuery(QueryBuilder subQuery) {
    return setFromSubQuery(subQuery.build());
  }

  private QueryBuilder setFrom(FromPointer fromPointer) {
    if (from != null) {
      LOGGER.debug("Replacing FROM {} with {}", from, fromPointer);
    }
    from = fromPointer;
    return this;
  }

  public QueryBuilder addWhere(String field, String symbol, Object value) {
    where.add(new BinaryFilterVariable(field, symbol, value));
    return this;
  }

  public QueryBuilder addWhere(String field, BinaryOperator operator, Object value) {
    where.add(new BinaryFilterVariable(field, operator, value));
    return this;
  }

  public QueryBuilder addWhereRaw(String influxQL) {
    where.add(new RawFilterVariable(influxQL));
    return this;
  }

  public QueryBuilder addGroupBy(String expression) {
    groupBy.add(new FieldVariable(expression));
    return this;
  }

  /** Group by time buckets of the given duration, e.g. {@code 10m}. */
  public QueryBuilder addGroupByTime(String duration) {
    return addGroupBy("time(" + duration + ")");
  }

  public QueryBuilder addOrderBy(String field, boolean ascending) {
    return addOrderBy(field, OrderByDirection.fromAscending(ascending));
  }

  public QueryBuilder addOrderBy(String field, OrderByDirection direction) {
    orderBy.add(new OrderByVariable(new FieldVariable(field), direction));
    return this;
  }

  public QueryBuilder setFillNull() {
    return setFill(FillType.NULL);
  }

  public QueryBuilder setFillPrevious() {
    return setFill(FillType.PREVIOUS);
  }

  public QueryBuilder setFillNumber(int number) {
    return setFill(FillVariable.forNumber(number));
  }

  public QueryBuilder setFillNone() {
    return setFill(FillType.NONE);
  }

  public QueryBuilder setFillLinear() {
    return setFill(FillType.LINEAR);
  }

  /** Use {@link #setFillNumber(int)} to fill with a number. */
  public QueryBuilder setFill(FillType type) {
    return setFill(new FillVariable(type));
  }

  private QueryBuilder setFill(FillVariable fillVariable) {
    if (fill != null) {
      LOGGER.debug("Replacing {} with {}", fill.renderInfluxQL(), fillVariable.renderInfluxQL());
    }
    fill = fillVariable;
    return this;
  }

  public QueryBuilder setLimit(int limit) {
    this.limit = limit;
    return this;
  }

  public QueryBuilder setSeriesLimit(int seriesLimit) {
    this.seriesLimit = seriesLimit;
    return this;
  }

  public Query build() {
    return new Query.Builder()
        .select(select)
        .from(from)
        .where(where)
        .groupBy(groupBy)
        .orderBy(orderBy)
        .fill(fill)
        .limit(limit)
        .seriesLimit(seriesLimit)
        .build();
  }

  public String render() {
    return build().renderInfluxQL();
  }

  @Override
  public String toString() {
    return render();
  }
}
