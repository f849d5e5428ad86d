package io.github.granulefilter.metadata;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses SENSING_TIME values such as {@code 2021-03-01T00:12:00.024Z}.
 */
public final class SensingTimes {

  private SensingTimes() {
  }

  /**
   * Parse an ISO-8601 timestamp. A value without an offset is taken as UTC.
   *
   * @param text the timestamp text
   * @return the instant
   * @throws DateTimeParseException if the text is not an ISO-8601 date-time
   */
  public static Instant parse(final String text) {
    final String value = text.trim();
    try {
      return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    } catch (DateTimeParseException e) {
      return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
          .toInstant(ZoneOffset.UTC);
    }
  }
}
