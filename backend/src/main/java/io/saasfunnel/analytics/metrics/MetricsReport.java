package io.saasfunnel.analytics.metrics;

import io.saasfunnel.analytics.cohort.CohortMatrix;
import io.saasfunnel.analytics.funnel.FunnelTable;
import io.saasfunnel.analytics.growth.WeeklyGrowthSeries;
import io.saasfunnel.analytics.revenue.RevenueSummary;
import io.saasfunnel.analytics.segment.PlanMetricsRow;
import io.saasfunnel.analytics.segment.SourceMetricsRow;
import java.time.LocalDateTime;
import java.util.List;

/** The six results of one run, computed against a single snapshot at {@code asOf}. */
public record MetricsReport(
    LocalDateTime asOf,
    FunnelTable funnel,
    RevenueSummary revenue,
    CohortMatrix cohort,
    WeeklyGrowthSeries weeklyGrowth,
    List<PlanMetricsRow> planMetrics,
    List<SourceMetricsRow> sourceMetrics) {

  public MetricsReport {
    planMetrics = List.copyOf(planMetrics);
    sourceMetrics = List.copyOf(sourceMetrics);
  }

  public MetricsReport withFunnel(FunnelTable funnel) {
    return new MetricsReport(
        asOf, funnel, revenue, cohort, weeklyGrowth, planMetrics, sourceMetrics);
  }

  public MetricsReport withWeeklyGrowth(WeeklyGrowthSeries weeklyGrowth) {
    return new MetricsReport(
        asOf, funnel, revenue, cohort, weeklyGrowth, planMetrics, sourceMetrics);
  }
}
