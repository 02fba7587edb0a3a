package bio.terra.influxql.query;

import bio.terra.influxql.utils.InfluxQlQuoting;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.commons.lang3.StringUtils;

/**
 * A fully or partially qualified measurement. Each of the database, retention policy and
 * measurement may be empty, in which case it is left out along with its separating dot.
 */
public record MeasurementPointer(String database, String retentionPolicy, String measurement)
    implements FromPointer {

  public static MeasurementPointer fromMeasurement(String measurement) {
    return new MeasurementPointer(null, null, measurement);
  }

  @Override
  public String renderInfluxQL() {
    return Stream.of(database, retentionPolicy, measurement)
        .filter(StringUtils::isNotEmpty)
        .map(InfluxQlQuoting::quoteIdentifier)
        .collect(Collectors.joining("."));
  }

  @Override
  public boolean isPresent() {
    return StringUtils.isNotEmpty(database)
        || StringUtils.isNotEmpty(retentionPolicy)
        || StringUtils.isNotEmpty(measurement);
  }
}
