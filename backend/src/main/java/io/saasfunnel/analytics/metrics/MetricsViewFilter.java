package io.saasfunnel.analytics.metrics;

import java.util.Collection;

/**
 * Display filtering applied to a computed report. Nothing is recomputed: funnel percentages and
 * growth percent changes keep the values the engines produced on the full data.
 */
public final class MetricsViewFilter {

  private MetricsViewFilter() {}

  /**
   * @param report the computed report
   * @param lookbackDays growth weeks starting before {@code asOf - lookbackDays} are hidden
   * @param eventTypes funnel stages to keep; an empty collection keeps every stage
   */
  public static MetricsReport apply(
      MetricsReport report, int lookbackDays, Collection<String> eventTypes) {
    var filtered = report;
    if (!eventTypes.isEmpty()) {
      filtered = filtered.withFunnel(report.funnel().retainStages(eventTypes));
    }
    var cutoff = report.asOf().minusDays(lookbackDays);
    return filtered.withWeeklyGrowth(report.weeklyGrowth().since(cutoff));
  }
}
