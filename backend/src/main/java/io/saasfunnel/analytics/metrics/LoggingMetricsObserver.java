package io.saasfunnel.analytics.metrics;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingMetricsObserver implements MetricsObserver {

  private static final Logger log = LoggerFactory.getLogger(LoggingMetricsObserver.class);

  @Override
  public void engineCompleted(String engine, Duration elapsed) {
    log.debug("Computed {} metrics in {} ms", engine, elapsed.toMillis());
  }

  @Override
  public void engineFailed(String engine, Throwable cause) {
    log.warn("Computing {} metrics failed: {}", engine, cause.getMessage());
  }

  @Override
  public void emptyResult(String engine, String reason) {
    log.warn("No data available for {} calculation: {}", engine, reason);
  }
}
