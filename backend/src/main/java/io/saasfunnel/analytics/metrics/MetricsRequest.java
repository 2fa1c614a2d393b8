package io.saasfunnel.analytics.metrics;

import java.util.List;

/**
 * Caller-facing request parameters, before validation.
 *
 * @param lookbackDays display window for the weekly growth series, applied after computation
 * @param eventTypes funnel stages to display, empty for all
 * @param cohortBucket {@code week} or {@code month}
 * @param growthMetric growth metric name, e.g. {@code signups} or {@code active_users}
 * @param growthWeeks trailing window of the growth computation, in weeks
 */
public record MetricsRequest(
    int lookbackDays,
    List<String> eventTypes,
    String cohortBucket,
    String growthMetric,
    int growthWeeks) {

  public static final int DEFAULT_LOOKBACK_DAYS = 30;
  public static final int DEFAULT_GROWTH_WEEKS = 12;

  public MetricsRequest {
    eventTypes = eventTypes == null ? List.of() : List.copyOf(eventTypes);
  }

  public static MetricsRequest defaults() {
    return new MetricsRequest(
        DEFAULT_LOOKBACK_DAYS, List.of(), "week", "signups", DEFAULT_GROWTH_WEEKS);
  }
}
