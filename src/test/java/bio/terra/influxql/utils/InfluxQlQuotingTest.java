package bio.terra.influxql.utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import bio.terra.influxql.category.Unit;
import java.math.BigDecimal;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@Tag(Unit.TAG)
class InfluxQlQuotingTest {

  @ParameterizedTest
  @ValueSource(strings = {"col1", "host", "usage_idle", "CPU", "a b"})
  void quoteIdentifierWrapsBareIdentifiers(String identifier) {
    assertThat(InfluxQlQuoting.quoteIdentifier(identifier), is("\"" + identifier + "\""));
  }

  @Test
  void quoteIdentifierIsIdempotent() {
    assertThat(InfluxQlQuoting.quoteIdentifier("\"col1\""), is("\"col1\""));
    assertThat(
        InfluxQlQuoting.quoteIdentifier(InfluxQlQuoting.quoteIdentifier("col1")), is("\"col1\""));
  }

  @Test
  void quoteIdentifierStripsOnlyOneQuotePair() {
    assertThat(InfluxQlQuoting.quoteIdentifier("\"\"col1\"\""), is("\"\"col1\"\""));
  }

  @ParameterizedTest
  @CsvSource({
    "func1(col1),func1(\"col1\")",
    "mean(usage_idle),mean(\"usage_idle\")",
    "f(x),f(\"x\")"
  })
  void quoteIdentifierQuotesFunctionArgument(String token, String expected) {
    assertThat(InfluxQlQuoting.quoteIdentifier(token), is(expected));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "sum(max(col1))",
        "percentile(col1, 95)",
        "count(*)",
        "derivative(mean(value), 1s)",
        "mean(\"col1\")"
      })
  void quoteIdentifierLeavesOtherFunctionsAlone(String token) {
    assertThat(InfluxQlQuoting.quoteIdentifier(token), is(token));
  }

  @Test
  void quoteIdentifierPassesTimeThrough() {
    assertThat(InfluxQlQuoting.quoteIdentifier("time"), is("time"));
    assertThat(InfluxQlQuoting.quoteIdentifier("time(10m)"), is("time(10m)"));
    assertThat(InfluxQlQuoting.quoteIdentifier("time(\"10m\")"), is("time(10m)"));
    assertThat(InfluxQlQuoting.quoteIdentifier("timestamp"), is("timestamp"));
  }

  @Test
  void quoteIdentifierTimePrefixIsCaseSensitive() {
    assertThat(InfluxQlQuoting.quoteIdentifier("Time"), is("\"Time\""));
  }

  @Test
  void quoteIdentifierHandlesNull() {
    assertThat(InfluxQlQuoting.quoteIdentifier(null), is("\"\""));
  }

  @Test
  void quoteValue() {
    assertThat(InfluxQlQuoting.quoteValue(1), is("'1'"));
    assertThat(InfluxQlQuoting.quoteValue(-42L), is("'-42'"));
    assertThat(InfluxQlQuoting.quoteValue("server01"), is("'server01'"));
    assertThat(InfluxQlQuoting.quoteValue(true), is("'true'"));
    assertThat(InfluxQlQuoting.quoteValue(null), is("'null'"));
  }

  @Test
  void quoteValueLeavesFunctionExpressionsAlone() {
    assertThat(InfluxQlQuoting.quoteValue("NOW()-7d"), is("NOW()-7d"));
    assertThat(InfluxQlQuoting.quoteValue("now() - 1h"), is("now() - 1h"));
  }

  @Test
  void formatValue() {
    assertThat(InfluxQlQuoting.formatValue(2.0), is("2"));
    assertThat(InfluxQlQuoting.formatValue(2.5f), is("2.5"));
    assertThat(InfluxQlQuoting.formatValue(0.0000001), is("0.0000001"));
    assertThat(InfluxQlQuoting.formatValue(Double.NaN), is("NaN"));
    assertThat(InfluxQlQuoting.formatValue(new BigDecimal("1E+3")), is("1000"));
  }

  @Test
  void quoteAlias() {
    assertThat(InfluxQlQuoting.quoteAlias("mean(col1)"), is("\"mean(col1)\""));
  }

  @Test
  void containsFunctionCall() {
    assertThat(InfluxQlQuoting.containsFunctionCall("NOW()-7d"), is(true));
    assertThat(InfluxQlQuoting.containsFunctionCall("col1"), is(false));
    assertThat(InfluxQlQuoting.containsFunctionCall("(col1)"), is(false));
    assertThat(InfluxQlQuoting.containsFunctionCall(null), is(false));
  }
}
