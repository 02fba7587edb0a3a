package bio.terra.influxql.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import org.stringtemplate.v4.ST;

/**
 * An immutable InfluxQL query. Clauses are always rendered in the order SELECT, FROM, WHERE, GROUP
 * BY, ORDER BY, FILL, LIMIT, SLIMIT, and a clause with nothing in it is left out entirely. An empty
 * query renders as an empty string.
 */
public record Query(
    List<FieldVariable> select,
    @Nullable FromPointer from,
    List<FilterVariable> where,
    List<FieldVariable> groupBy,
    List<OrderByVariable> orderBy,
    @Nullable FillVariable fill,
    @Nullable Integer limit,
    @Nullable Integer seriesLimit)
    implements InfluxQlExpression {

  public Query {
    select = List.copyOf(Objects.requireNonNullElse(select, List.of()));
    where = List.copyOf(Objects.requireNonNullElse(where, List.of()));
    groupBy = List.copyOf(Objects.requireNonNullElse(groupBy, List.of()));
    orderBy = List.copyOf(Objects.requireNonNullElse(orderBy, List.of()));
  }

  @Override
  public String renderInfluxQL() {
    List<String> clauses = new ArrayList<>();

    // render each SELECT FieldVariable and join them into a single string
    if (!select.isEmpty()) {
      clauses.add(
          new ST("SELECT <selectInfluxQL>")
              .add("selectInfluxQL", joinRendered(select, ", "))
              .render());
    }

    if (from != null && from.isPresent()) {
      clauses.add(
          new ST("FROM <fromInfluxQL>").add("fromInfluxQL", from.renderInfluxQL()).render());
    }

    if (!where.isEmpty()) {
      clauses.add(
          new ST("WHERE <whereInfluxQL>")
              .add("whereInfluxQL", joinRendered(where, " AND "))
              .render());
    }

    if (!groupBy.isEmpty()) {
      clauses.add(
          new ST("GROUP BY <groupByInfluxQL>")
              .add("groupByInfluxQL", joinRendered(groupBy, ", "))
              .render());
    }

    if (!orderBy.isEmpty()) {
      clauses.add(
          new ST("ORDER BY <orderByInfluxQL>")
              .add("orderByInfluxQL", joinRendered(orderBy, ", "))
              .render());
    }

    if (fill != null) {
      clauses.add(fill.renderInfluxQL());
    }

    if (limit != null) {
      clauses.add("LIMIT " + limit);
    }

    if (seriesLimit != null) {
      clauses.add("SLIMIT " + seriesLimit);
    }

    return String.join(" ", clauses);
  }

  private static String joinRendered(
      List<? extends InfluxQlExpression> expressions, String delimiter) {
    return expressions.stream()
        .map(InfluxQlExpression::renderInfluxQL)
        .collect(Collectors.joining(delimiter));
  }

  public static class Builder {
    private List<FieldVariable> select;
    private FromPointer from;
    private List<FilterVariable> where;
    private List<FieldVariable> groupBy;
    private List<OrderByVariable> orderBy;
    private FillVariable fill;
    private Integer limit;
    private Integer seriesLimit;

    public Builder select(List<FieldVariable> select) {
      this.select = select;
      return this;
    }

    public Builder from(FromPointer from) {
      this.from = from;
      return this;
    }

    public Builder where(List<FilterVariable> where) {
      this.where = where;
      return this;
    }

    public Builder groupBy(List<FieldVariable> groupBy) {
      this.groupBy = groupBy;
      return this;
    }

    public Builder orderBy(List<OrderByVariable> orderBy) {
      this.orderBy = orderBy;
      return this;
    }

    public Builder fill(FillVariable fill) {
      this.fill = fill;
      return this;
    }

    public Builder limit(Integer limit) {
      this.limit = limit;
      return this;
    }

    public Builder seriesLimit(Integer seriesLimit) {
      this.seriesLimit = seriesLimit;
      return this;
    }

    public Query build() {
      return new Query(select, from, where, groupBy, orderBy, fill, limit, seriesLimit);
    }
  }
}
