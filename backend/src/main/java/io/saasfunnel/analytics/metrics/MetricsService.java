package io.saasfunnel.analytics.metrics;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.saasfunnel.analytics.cohort.CohortBucket;
import io.saasfunnel.analytics.exception.InvalidArgumentException;
import io.saasfunnel.analytics.growth.GrowthMetric;
import io.saasfunnel.analytics.snapshot.CsvSnapshotReader;
import io.saasfunnel.analytics.snapshot.InputSnapshot;
import io.saasfunnel.analytics.snapshot.JdbcSnapshotLoader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for computing metric reports from the database, from uploaded files or from any
 * in-memory snapshot.
 *
 * <p>Database-backed reports are cached in Caffeine, keyed by the engine parameters only. The view
 * filter runs after cache retrieval, so requests that differ only in lookback window or stage
 * allowlist share one cached report. Uploaded snapshots are never cached.
 */
@Service
public class MetricsService {

  private static final Logger log = LoggerFactory.getLogger(MetricsService.class);

  private final JdbcSnapshotLoader jdbcSnapshotLoader;
  private final CsvSnapshotReader csvSnapshotReader;
  private final MetricsRunner metricsRunner;
  private final MetricsCsvWriter metricsCsvWriter;
  private final MetricsProperties properties;
  private final Cache<MetricsParameters.EngineKey, MetricsReport> reportCache;

  public MetricsService(
      JdbcSnapshotLoader jdbcSnapshotLoader,
      CsvSnapshotReader csvSnapshotReader,
      MetricsRunner metricsRunner,
      MetricsCsvWriter metricsCsvWriter,
      MetricsProperties properties) {
    this.jdbcSnapshotLoader = jdbcSnapshotLoader;
    this.csvSnapshotReader = csvSnapshotReader;
    this.metricsRunner = metricsRunner;
    this.metricsCsvWriter = metricsCsvWriter;
    this.properties = properties;
    this.reportCache =
        Caffeine.newBuilder()
            .maximumSize(properties.cache().maximumSize())
            .expireAfterWrite(properties.cache().ttl())
            .build();
  }

  /** Computes (or serves from cache) the report for the current database contents. */
  public MetricsReport computeFromDatabase(MetricsRequest request) {
    var parameters = toParameters(request);
    var full =
        reportCache.get(
            parameters.engineKey(),
            key -> {
              log.info(
                  "Computing metrics from database: cohortBucket={}, growthMetric={}, weeks={}",
                  key.cohortBucket().value(),
                  key.growthMetric(),
                  key.growthWeeks());
              return metricsRunner.run(jdbcSnapshotLoader.load(), parameters);
            });
    return MetricsViewFilter.apply(full, request.lookbackDays(), request.eventTypes());
  }

  /** Computes the report for four uploaded delimited-text tables. */
  public MetricsReport computeFromUpload(
      Reader users, Reader events, Reader plans, Reader sources, MetricsRequest request)
      throws IOException {
    var parameters = toParameters(request);
    var snapshot = csvSnapshotReader.read(users, events, plans, sources);
    return computeFromSnapshot(snapshot, parameters, request);
  }

  public MetricsReport computeFromSnapshot(InputSnapshot snapshot, MetricsRequest request) {
    return computeFromSnapshot(snapshot, toParameters(request), request);
  }

  /** Writes one result table of the database-backed report as delimited text. */
  public void exportFromDatabase(ResultTable table, MetricsRequest request, Writer out)
      throws IOException {
    metricsCsvWriter.write(table, computeFromDatabase(request), out);
  }

  public void invalidateCache() {
    reportCache.invalidateAll();
  }

  private MetricsReport computeFromSnapshot(
      InputSnapshot snapshot, MetricsParameters parameters, MetricsRequest request) {
    var full = metricsRunner.run(snapshot, parameters);
    return MetricsViewFilter.apply(full, request.lookbackDays(), request.eventTypes());
  }

  /** Validates the request eagerly, before any snapshot is loaded. */
  MetricsParameters toParameters(MetricsRequest request) {
    if (request.lookbackDays() <= 0) {
      throw new InvalidArgumentException(
          "lookback window", request.lookbackDays(), "must be positive");
    }
    var bucket = CohortBucket.fromValue(request.cohortBucket());
    var metric = GrowthMetric.resolve(request.growthMetric(), properties.growthMetrics());
    return new MetricsParameters(
        properties.stages(),
        properties.paidEventType(),
        bucket,
        metric,
        request.growthWeeks(),
        null);
  }
}
