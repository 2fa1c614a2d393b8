package io.saasfunnel.analytics.cohort;

import java.time.LocalDate;
import java.util.List;

/**
 * Retention matrix: one row per signup cohort (ascending), one column per week since signup
 * (ascending, always starting at 0).
 *
 * @param bucket cohort granularity the rows were built with
 * @param periods column headers, weeks since signup
 * @param rows cohort rows, each aligned with {@code periods}
 */
public record CohortMatrix(CohortBucket bucket, List<Integer> periods, List<CohortRow> rows) {

  public CohortMatrix {
    periods = List.copyOf(periods);
    rows = List.copyOf(rows);
  }

  /** A matrix with no cohorts, returned when no event could be aligned to a user. */
  public static CohortMatrix empty(CohortBucket bucket) {
    return new CohortMatrix(bucket, List.of(), List.of());
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * One cohort.
   *
   * @param cohortStart first day of the cohort's week or month
   * @param cohortSize distinct users who signed up in the cohort; the column 0 count
   * @param activeUsers distinct active users per period, aligned with the matrix periods
   * @param retentionPct {@code activeUsers / cohortSize * 100} per period, 100 in column 0
   */
  public record CohortRow(
      LocalDate cohortStart, long cohortSize, List<Long> activeUsers, List<Double> retentionPct) {

    public CohortRow {
      activeUsers = List.copyOf(activeUsers);
      retentionPct = List.copyOf(retentionPct);
    }
  }
}
