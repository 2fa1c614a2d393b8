package io.saasfunnel.analytics.config;

import io.saasfunnel.analytics.metrics.MetricsProperties;
import java.time.Clock;
import java.util.concurrent.Executor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(MetricsProperties.class)
public class MetricsConfig {

  @Bean(name = "metricsExecutor")
  public Executor metricsExecutor(MetricsProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.runnerThreads());
    executor.setMaxPoolSize(properties.runnerThreads());
    executor.setThreadNamePrefix("metrics-");
    executor.initialize();
    return executor;
  }

  /** UTC clock; "now" for churn and growth windows. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
