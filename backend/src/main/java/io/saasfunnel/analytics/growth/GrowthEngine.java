package io.saasfunnel.analytics.growth;

import io.saasfunnel.analytics.exception.InvalidArgumentException;
import io.saasfunnel.analytics.snapshot.Event;
import io.saasfunnel.analytics.table.Ratios;
import io.saasfunnel.analytics.table.Table;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Buckets one metric into calendar weeks over a trailing window and computes week-over-week change.
 *
 * <p>The series runs from the first to the last observed week with no gaps; a week without
 * matching events is reported with value 0. Percent change is computed on the filled series:
 *
 * <ul>
 *   <li>first week: 0
 *   <li>previous week non-zero: {@code (v[i] - v[i-1]) / v[i-1] * 100}
 *   <li>previous week zero: 0 when still zero, 100 on a rebound
 * </ul>
 */
public final class GrowthEngine {

  static final double REBOUND_PCT = 100.0;

  private GrowthEngine() {}

  public static WeeklyGrowthSeries computeWeeklyGrowth(
      List<Event> events, GrowthMetric metric, int windowWeeks, LocalDateTime now) {
    requirePositiveWindow(windowWeeks);
    var windowStart = now.minusWeeks(windowWeeks);

    var weekly =
        Table.of(events)
            .filter(e -> e.eventDate() != null)
            .filter(e -> !e.eventDate().isBefore(windowStart) && !e.eventDate().isAfter(now))
            .filter(metric::matches)
            .countDistinct(e -> weekStart(e.eventDate().toLocalDate()), Event::userId);

    if (weekly.isEmpty()) {
      return WeeklyGrowthSeries.empty(metric.name());
    }

    var first = Collections.min(weekly.keySet());
    var last = Collections.max(weekly.keySet());

    var points = new ArrayList<WeeklyGrowthPoint>();
    long previous = 0;
    for (var week = first; !week.isAfter(last); week = week.plusWeeks(1)) {
      long value = weekly.getOrDefault(week, 0L);
      double change;
      if (points.isEmpty()) {
        change = 0.0;
      } else if (previous == 0) {
        change = value == 0 ? 0.0 : REBOUND_PCT;
      } else {
        change = Ratios.percent(value - previous, previous, 0.0);
      }
      points.add(new WeeklyGrowthPoint(week, value, change));
      previous = value;
    }
    return new WeeklyGrowthSeries(metric.name(), points);
  }

  public static void requirePositiveWindow(int windowWeeks) {
    if (windowWeeks <= 0) {
      throw new InvalidArgumentException("growth window", windowWeeks, "must be positive");
    }
  }

  static LocalDate weekStart(LocalDate date) {
    return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
  }
}
