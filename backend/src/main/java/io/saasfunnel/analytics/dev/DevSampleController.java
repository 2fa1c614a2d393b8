package io.saasfunnel.analytics.dev;

import io.saasfunnel.analytics.metrics.MetricsReport;
import io.saasfunnel.analytics.metrics.MetricsRequest;
import io.saasfunnel.analytics.metrics.MetricsService;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Dev-only endpoint computing metrics over a generated snapshot, so the dashboard can be exercised
 * without a database. Profile-gated, never exposed in production.
 */
@RestController
@Profile({"local", "dev"})
@RequestMapping("/dev")
public class DevSampleController {

  private static final Logger log = LoggerFactory.getLogger(DevSampleController.class);

  private final MetricsService metricsService;
  private final Clock clock;

  public DevSampleController(MetricsService metricsService, Clock clock) {
    this.metricsService = metricsService;
    this.clock = clock;
  }

  /** Sample data spans the 100 days ending today, so every engine has recent data. */
  @GetMapping("/sample-metrics")
  public ResponseEntity<MetricsReport> sampleMetrics(
      @RequestParam(defaultValue = "42") long seed,
      @RequestParam(defaultValue = "30") int lookbackDays,
      @RequestParam(required = false) List<String> eventTypes,
      @RequestParam(defaultValue = "week") String cohortBucket,
      @RequestParam(defaultValue = "signups") String growthMetric,
      @RequestParam(defaultValue = "12") int growthWeeks) {
    var start = LocalDate.now(clock).minusDays(SampleSnapshotGenerator.SPAN_DAYS - 1L);
    log.info("Computing sample metrics: seed={}, start={}", seed, start);
    var snapshot = SampleSnapshotGenerator.generate(seed, start);
    var request =
        new MetricsRequest(lookbackDays, eventTypes, cohortBucket, growthMetric, growthWeeks);
    return ResponseEntity.ok(metricsService.computeFromSnapshot(snapshot, request));
  }
}
