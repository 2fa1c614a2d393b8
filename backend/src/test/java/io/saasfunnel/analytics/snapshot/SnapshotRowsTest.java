package io.saasfunnel.analytics.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.saasfunnel.analytics.exception.SchemaMismatchException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SnapshotRowsTest {

  @Test
  void timestampAcceptsDateOnlyAndBothSeparators() {
    assertThat(SnapshotRows.timestamp("2025-03-04")).isEqualTo(LocalDateTime.of(2025, 3, 4, 0, 0));
    assertThat(SnapshotRows.timestamp("2025-03-04 05:06"))
        .isEqualTo(LocalDateTime.of(2025, 3, 4, 5, 6));
    assertThat(SnapshotRows.timestamp("2025-03-04T05:06:07"))
        .isEqualTo(LocalDateTime.of(2025, 3, 4, 5, 6, 7));
  }

  @Test
  void timestampNormalizesOffsetsToUtc() {
    assertThat(SnapshotRows.timestamp("2025-01-01T10:00:00Z"))
        .isEqualTo(LocalDateTime.of(2025, 1, 1, 10, 0));
    assertThat(SnapshotRows.timestamp("2025-01-01 10:00:00+00:00"))
        .isEqualTo(LocalDateTime.of(2025, 1, 1, 10, 0));
    assertThat(SnapshotRows.timestamp("2025-01-01T12:30:00.250+02:00"))
        .isEqualTo(LocalDateTime.of(2025, 1, 1, 10, 30, 0, 250_000_000));
  }

  @Test
  void timestampCoercesJdbcTypes() {
    var expected = LocalDateTime.of(2025, 3, 4, 5, 6);
    assertThat(SnapshotRows.timestamp(Timestamp.from(Instant.parse("2025-03-04T05:06:00Z"))))
        .isEqualTo(expected);
    assertThat(SnapshotRows.timestamp(LocalDate.of(2025, 3, 4)))
        .isEqualTo(LocalDateTime.of(2025, 3, 4, 0, 0));
    var offset = OffsetDateTime.of(2025, 3, 4, 7, 6, 0, 0, ZoneOffset.ofHours(2));
    assertThat(SnapshotRows.timestamp(offset)).isEqualTo(expected);
  }

  @Test
  void unparseableOrBlankTimestampBecomesNull() {
    assertThat(SnapshotRows.timestamp("yesterday")).isNull();
    assertThat(SnapshotRows.timestamp("  ")).isNull();
    assertThat(SnapshotRows.timestamp(null)).isNull();
  }

  @Test
  void idsExportedAsDecimalsAreAccepted() {
    var user = SnapshotRows.user(row("user_id", "3.0", "signup_date", "", "plan_id", "2"), 1);

    assertThat(user.userId()).isEqualTo(3L);
    assertThat(user.planId()).isEqualTo(2L);
    assertThat(user.sourceId()).isNull();
    assertThat(user.signupDate()).isNull();
  }

  @Test
  void negativePriceIsRejected() {
    var plan = row("plan_id", "1", "plan_name", "Basic", "price", "-5");

    assertThatThrownBy(() -> SnapshotRows.plan(plan, 4))
        .isInstanceOfSatisfying(
            SchemaMismatchException.class,
            ex -> assertThat(ex.getColumn()).isEqualTo("price"));
  }

  @Test
  void blankEventTypeIsRejected() {
    var event = row("user_id", "1", "event_type", " ", "event_date", "2025-01-01");

    assertThatThrownBy(() -> SnapshotRows.event(event, 1))
        .isInstanceOf(SchemaMismatchException.class);
  }

  @Test
  void requireColumnsReportsFirstMissingColumn() {
    assertThatThrownBy(() -> SnapshotTable.PLANS.requireColumns(List.of("PLAN_ID")))
        .isInstanceOfSatisfying(
            SchemaMismatchException.class,
            ex -> {
              assertThat(ex.getTable()).isEqualTo("Plans");
              assertThat(ex.getColumn()).isEqualTo("plan_name");
            });
  }

  private static Map<String, Object> row(Object... keysAndValues) {
    var row = new HashMap<String, Object>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      row.put((String) keysAndValues[i], keysAndValues[i + 1]);
    }
    return row;
  }
}
