package io.saasfunnel.analytics.metrics;

import io.saasfunnel.analytics.cohort.CohortBucket;
import io.saasfunnel.analytics.growth.GrowthEngine;
import io.saasfunnel.analytics.growth.GrowthMetric;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Engine parameters for one run. Construction fails on invalid values, so a run never starts with
 * parameters an engine would reject.
 *
 * @param stages funnel stages in order
 * @param paidEventType event type marking a paying user
 * @param cohortBucket cohort granularity
 * @param growthMetric metric counted by the weekly growth series
 * @param growthWeeks trailing window of the growth series, in weeks
 * @param asOf reference instant for revenue churn and the growth window; null means now
 */
public record MetricsParameters(
    List<String> stages,
    String paidEventType,
    CohortBucket cohortBucket,
    GrowthMetric growthMetric,
    int growthWeeks,
    LocalDateTime asOf) {

  public MetricsParameters {
    stages = List.copyOf(stages);
    Objects.requireNonNull(paidEventType, "paidEventType");
    Objects.requireNonNull(cohortBucket, "cohortBucket");
    Objects.requireNonNull(growthMetric, "growthMetric");
    GrowthEngine.requirePositiveWindow(growthWeeks);
  }

  /** The resolved values that change engine output; used as the report cache key. */
  EngineKey engineKey() {
    return new EngineKey(cohortBucket, growthMetric.name(), growthWeeks);
  }

  record EngineKey(CohortBucket cohortBucket, String growthMetric, int growthWeeks) {}
}
