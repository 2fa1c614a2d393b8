package io.saasfunnel.analytics.metrics;

import io.saasfunnel.analytics.cohort.CohortEngine;
import io.saasfunnel.analytics.funnel.FunnelEngine;
import io.saasfunnel.analytics.growth.GrowthEngine;
import io.saasfunnel.analytics.revenue.RevenueEngine;
import io.saasfunnel.analytics.segment.SegmentEngine;
import io.saasfunnel.analytics.snapshot.InputSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs the six metric engines against one snapshot and bundles their results.
 *
 * <p>Engines only read the immutable snapshot, so they are submitted to the executor together and
 * joined without any locking. The reference instant is resolved once, before submission, so the
 * revenue and growth engines agree on "now".
 */
@Component
public class MetricsRunner {

  private final Executor executor;
  private final MetricsObserver observer;
  private final Clock clock;

  public MetricsRunner(
      @Qualifier("metricsExecutor") Executor executor, MetricsObserver observer, Clock clock) {
    this.executor = executor;
    this.observer = observer;
    this.clock = clock;
  }

  public MetricsReport run(InputSnapshot snapshot, MetricsParameters parameters) {
    LocalDateTime asOf = parameters.asOf() != null ? parameters.asOf() : LocalDateTime.now(clock);

    var funnel =
        submit("funnel", () -> FunnelEngine.computeFunnel(snapshot.events(), parameters.stages()));
    var revenue =
        submit(
            "revenue",
            () ->
                RevenueEngine.computeRevenue(
                    snapshot.users(),
                    snapshot.events(),
                    snapshot.plans(),
                    parameters.paidEventType(),
                    asOf));
    var cohort =
        submit(
            "cohort",
            () ->
                CohortEngine.computeCohortRetention(
                    snapshot.users(), snapshot.events(), parameters.cohortBucket()));
    var growth =
        submit(
            "weekly growth",
            () ->
                GrowthEngine.computeWeeklyGrowth(
                    snapshot.events(), parameters.growthMetric(), parameters.growthWeeks(), asOf));
    var plans =
        submit(
            "plan",
            () ->
                SegmentEngine.computePlanMetrics(
                    snapshot.users(),
                    snapshot.events(),
                    snapshot.plans(),
                    parameters.paidEventType()));
    var sources =
        submit(
            "source",
            () ->
                SegmentEngine.computeSourceMetrics(
                    snapshot.users(),
                    snapshot.events(),
                    snapshot.sources(),
                    parameters.paidEventType()));

    try {
      CompletableFuture.allOf(funnel, revenue, cohort, growth, plans, sources).join();
    } catch (CompletionException e) {
      throw unwrap(e);
    }

    var report =
        new MetricsReport(
            asOf,
            funnel.join(),
            revenue.join(),
            cohort.join(),
            growth.join(),
            plans.join(),
            sources.join());

    if (report.cohort().isEmpty()) {
      observer.emptyResult("cohort", "no events could be aligned to a signed-up user");
    }
    if (report.weeklyGrowth().isEmpty()) {
      observer.emptyResult(
          "weekly growth",
          "no %s events in the last %d weeks"
              .formatted(parameters.growthMetric().name(), parameters.growthWeeks()));
    }
    return report;
  }

  private <T> CompletableFuture<T> submit(String engine, Supplier<T> computation) {
    return CompletableFuture.supplyAsync(
        () -> {
          long started = System.nanoTime();
          try {
            T result = computation.get();
            observer.engineCompleted(engine, Duration.ofNanos(System.nanoTime() - started));
            return result;
          } catch (RuntimeException e) {
            observer.engineFailed(engine, e);
            throw e;
          }
        },
        executor);
  }

  private static RuntimeException unwrap(CompletionException e) {
    var cause = e.getCause();
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return e;
  }
}
