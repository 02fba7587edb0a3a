package bio.terra.influxql.utils;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quoting rules for InfluxQL tokens.
 *
 * <p>Identifiers (columns, group-by terms, order-by fields, where fields) are double-quoted unless
 * they are a time expression or a function call. Comparison values are single-quoted unless they
 * contain a function call, so expressions like {@code NOW()-7d} can be compared against as-is.
 */
public final class InfluxQlQuoting {
  private static final Logger LOGGER = LoggerFactory.getLogger(InfluxQlQuoting.class);

  private InfluxQlQuoting() {}

  private static final String TIME_PREFIX = "time";
  private static final String DOUBLE_QUOTE = "\"";
  private static final String SINGLE_QUOTE = "'";

  // A single function call wrapping a single bare identifier, e.g. mean(value).
  private static final Pattern SIMPLE_FUNCTION_CALL =
      Pattern.compile("^([a-zA-Z0-9_]+)\\(([a-zA-Z0-9_]+)\\)$");

  // Anything that looks like a function call somewhere in the token, e.g. NOW()-7d.
  private static final Pattern CONTAINS_FUNCTION_CALL = Pattern.compile("[a-zA-Z0-9_]+\\(.*?\\)");

  /**
   * Render a column, group-by term, order-by field or where field.
   *
   * <ol>
   *   <li>Tokens starting with {@code time} have any double quotes removed and are otherwise left
   *       alone, so {@code time(10m)} survives.
   *   <li>{@code func(col)} becomes {@code func("col")}.
   *   <li>Any other function-call-like expression is left unmodified.
   *   <li>Everything else is a bare identifier and is wrapped in double quotes. One pair of
   *       existing surrounding quotes is removed first so quoting is idempotent.
   * </ol>
   */
  public static String quoteIdentifier(String token) {
    String value = StringUtils.defaultString(token);

    if (value.startsWith(TIME_PREFIX)) {
      return StringUtils.remove(value, DOUBLE_QUOTE);
    }

    Matcher simpleCall = SIMPLE_FUNCTION_CALL.matcher(value);
    if (simpleCall.matches()) {
      String quoted = "%s(\"%s\")".formatted(simpleCall.group(1), simpleCall.group(2));
      LOGGER.debug("Quoted function argument: {} -> {}", value, quoted);
      return quoted;
    }

    if (containsFunctionCall(value)) {
      LOGGER.debug("Leaving function expression unquoted: {}", value);
      return value;
    }

    return DOUBLE_QUOTE
        + StringUtils.removeEnd(StringUtils.removeStart(value, DOUBLE_QUOTE), DOUBLE_QUOTE)
        + DOUBLE_QUOTE;
  }

  /** Render a comparison value, single-quoting it unless it contains a function call. */
  public static String quoteValue(Object value) {
    String text = formatValue(value);
    if (containsFunctionCall(text)) {
      return text;
    }
    return SINGLE_QUOTE + text + SINGLE_QUOTE;
  }

  /** Wrap an alias in double quotes verbatim. Aliases are never classified. */
  public static String quoteAlias(String alias) {
    return DOUBLE_QUOTE + alias + DOUBLE_QUOTE;
  }

  public static boolean containsFunctionCall(String token) {
    return token != null && CONTAINS_FUNCTION_CALL.matcher(token).find();
  }

  /**
   * Text form of a comparison value. Floating point values are written in plain decimal without
   * trailing zeros, so {@code 2.0} renders as {@code 2} and {@code 1e-7} as {@code 0.0000001}.
   */
  static String formatValue(Object value) {
    if ((value instanceof Double || value instanceof Float)
        && Double.isFinite(((Number) value).doubleValue())) {
      return BigDecimal.valueOf(((Number) value).doubleValue())
          .stripTrailingZeros()
          .toPlainString();
    }
    if (value instanceof BigDecimal bigDecimal) {
      return bigDecimal.toPlainString();
    }
    return String.valueOf(value);
  }
}
