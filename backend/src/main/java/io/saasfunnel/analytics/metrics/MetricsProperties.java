package io.saasfunnel.analytics.metrics;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for metric computation.
 *
 * @param stages funnel stages in order, also the default event-type allowlist
 * @param paidEventType event type marking a paying user
 * @param growthMetrics growth metric names mapped to the event type they count
 * @param cache result cache settings for database-backed reports
 * @param runnerThreads worker threads used to run the engines concurrently
 */
@ConfigurationProperties(prefix = "analytics.metrics")
public record MetricsProperties(
    List<String> stages,
    String paidEventType,
    Map<String, String> growthMetrics,
    CacheSettings cache,
    int runnerThreads) {

  public MetricsProperties {
    stages = stages == null ? List.of("visit", "signup", "trial", "paid") : List.copyOf(stages);
    paidEventType = paidEventType == null ? "paid" : paidEventType;
    growthMetrics =
        growthMetrics == null
            ? Map.of("signups", "signup", "visits", "visit", "trials", "trial", "paid", "paid")
            : Map.copyOf(growthMetrics);
    cache = cache == null ? new CacheSettings(null, 0) : cache;
    runnerThreads = runnerThreads <= 0 ? 6 : runnerThreads;
  }

  /**
   * @param ttl how long a computed report is served from cache
   * @param maximumSize maximum number of cached reports
   */
  public record CacheSettings(Duration ttl, long maximumSize) {

    public CacheSettings {
      ttl = ttl == null ? Duration.ofMinutes(3) : ttl;
      maximumSize = maximumSize <= 0 ? 100 : maximumSize;
    }
  }
}
