package io.saasfunnel.analytics.cohort;

import io.saasfunnel.analytics.exception.InvalidArgumentException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Granularity used to group users into signup cohorts. */
public enum CohortBucket {
  /** Calendar week starting on Monday. */
  WEEK("week"),
  /** Calendar month. */
  MONTH("month");

  private final String value;

  CohortBucket(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** Start of the bucket containing {@code timestamp}. */
  public LocalDate startOf(LocalDateTime timestamp) {
    var date = timestamp.toLocalDate();
    return switch (this) {
      case WEEK -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
      case MONTH -> date.withDayOfMonth(1);
    };
  }

  public static CohortBucket fromValue(String value) {
    if (value != null) {
      var normalized = value.trim().toLowerCase(Locale.ROOT);
      for (CohortBucket bucket : values()) {
        if (bucket.value.equals(normalized)) {
          return bucket;
        }
      }
    }
    throw new InvalidArgumentException(
        "cohort bucket",
        value,
        "expected one of "
            + Arrays.stream(values()).map(CohortBucket::value).collect(Collectors.joining(", ")));
  }
}
