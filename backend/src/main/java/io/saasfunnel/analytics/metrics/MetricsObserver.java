package io.saasfunnel.analytics.metrics;

import java.time.Duration;

/**
 * Receives progress notifications from {@link MetricsRunner}. Engines run concurrently, so
 * implementations must be thread safe.
 */
public interface MetricsObserver {

  void engineCompleted(String engine, Duration elapsed);

  void engineFailed(String engine, Throwable cause);

  /** An engine finished with an empty result, which callers should treat as "no data". */
  void emptyResult(String engine, String reason);
}
