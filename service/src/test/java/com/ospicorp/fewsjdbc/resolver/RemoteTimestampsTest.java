package com.ospicorp.fewsjdbc.resolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.fewsjdbc.error.MalformedTimestampException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;
import org.junit.jupiter.api.Test;

class RemoteTimestampsTest {

  @Test
  void compactDigits() {
    assertThat(RemoteTimestamps.parse("20080115130000"))
        .isEqualTo(LocalDateTime.of(2008, 1, 15, 13, 0, 0));
  }

  @Test
  void xmlRpcStyleTail() {
    assertThat(RemoteTimestamps.parse("20071231T23:59:30"))
        .isEqualTo(LocalDateTime.of(2007, 12, 31, 23, 59, 30));
  }

  @Test
  void decodedDateUsesLocalWallClock() {
    LocalDateTime wallClock = LocalDateTime.of(2008, 1, 15, 13, 0, 0);
    Date decoded = Date.from(wallClock.atZone(ZoneId.systemDefault()).toInstant());

    assertThat(RemoteTimestamps.parse(decoded)).isEqualTo(wallClock);
  }

  @Test
  void decodedSqlTimestampIsAccepted() {
    LocalDateTime wallClock = LocalDateTime.of(2008, 1, 15, 13, 0, 30);

    assertThat(RemoteTimestamps.parse(java.sql.Timestamp.valueOf(wallClock)))
        .isEqualTo(wallClock);
  }

  @Test
  void instantIsReadAsUtc() {
    assertThat(RemoteTimestamps.parse(Instant.parse("2008-01-15T13:00:00Z")))
        .isEqualTo(LocalDateTime.of(2008, 1, 15, 13, 0, 0));
  }

  @Test
  void localDateTimePassesThrough() {
    LocalDateTime value = LocalDateTime.of(2007, 12, 31, 23, 59, 30);

    assertThat(RemoteTimestamps.parse(value)).isSameAs(value);
  }

  @Test
  void invalidCalendarDateIsMalformed() {
    assertThatThrownBy(() -> RemoteTimestamps.parse("20080230120000"))
        .isInstanceOf(MalformedTimestampException.class);
  }

  @Test
  void shortOrMissingValueIsMalformed() {
    assertThatThrownBy(() -> RemoteTimestamps.parse("2008"))
        .isInstanceOf(MalformedTimestampException.class);
    assertThatThrownBy(() -> RemoteTimestamps.parse(null))
        .isInstanceOf(MalformedTimestampException.class);
  }
}
