package io.saasfunnel.analytics.growth;

import java.time.LocalDateTime;
import java.util.List;

/** Contiguous weekly series, one point per calendar week with no gaps. */
public record WeeklyGrowthSeries(String metric, List<WeeklyGrowthPoint> points) {

  public WeeklyGrowthSeries {
    points = List.copyOf(points);
  }

  public static WeeklyGrowthSeries empty(String metric) {
    return new WeeklyGrowthSeries(metric, List.of());
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  /** Points whose week starts at or after {@code cutoff}. Percent changes are kept as computed. */
  public WeeklyGrowthSeries since(LocalDateTime cutoff) {
    return new WeeklyGrowthSeries(
        metric,
        points.stream().filter(p -> !p.weekStart().atStartOfDay().isBefore(cutoff)).toList());
  }
}
