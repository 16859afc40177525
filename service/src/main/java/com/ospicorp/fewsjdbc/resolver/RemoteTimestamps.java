package com.ospicorp.fewsjdbc.resolver;

import com.ospicorp.fewsjdbc.error.MalformedTimestampException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Date;

/**
 * Parses the compact timestamps of the time series table: four digits of year, two of month,
 * then the day and time either as {@code ddTHH:mm:ss} or as {@code ddHHmmss}. Values a
 * transport already decoded are accepted too: a {@link Date} is read in the JVM default zone,
 * where XML-RPC libraries decode it, and an {@link Instant} in UTC.
 */
final class RemoteTimestamps {
  private static final DateTimeFormatter ADJUSTED =
      DateTimeFormatter.ofPattern("uuuu-MM-dd['T'][' ']HH[':']mm[':']ss")
          .withResolverStyle(ResolverStyle.STRICT);

  private RemoteTimestamps() {
  }

  static LocalDateTime parse(Object raw) {
    if (raw instanceof LocalDateTime dateTime) {
      return dateTime;
    }
    if (raw instanceof Date date) {
      return LocalDateTime.ofInstant(Instant.ofEpochMilli(date.getTime()),
          ZoneId.systemDefault());
    }
    if (raw instanceof Instant instant) {
      return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
    String text = raw == null ? "" : raw.toString().trim();
    if (text.length() < 7) {
      throw new MalformedTimestampException(text, null);
    }
    String adjusted = text.substring(0, 4) + '-' + text.substring(4, 6) + '-' + text.substring(6);
    try {
      return LocalDateTime.parse(adjusted, ADJUSTED);
    } catch (DateTimeParseException ex) {
      throw new MalformedTimestampException(text, ex);
    }
  }
}
