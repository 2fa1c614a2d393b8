package io.saasfunnel.analytics.metrics;

import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.saasfunnel.analytics.snapshot.JdbcSnapshotLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(
    properties =
        "spring.autoconfigure.exclude="
            + "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
@AutoConfigureMockMvc
class MetricsControllerIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private MetricsService metricsService;

  @MockBean private JdbcSnapshotLoader jdbcSnapshotLoader;

  @BeforeEach
  void clearCache() {
    metricsService.invalidateCache();
  }

  @Test
  void getMetrics_computesReportWithConfiguredStages() throws Exception {
    when(jdbcSnapshotLoader.load()).thenReturn(MetricsFixtures.snapshot());

    mockMvc
        .perform(get("/api/metrics"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.funnel.rows.length()").value(4))
        .andExpect(jsonPath("$.funnel.rows[1].stage").value("signup"))
        .andExpect(jsonPath("$.funnel.rows[1].uniqueUserCount").value(2))
        .andExpect(jsonPath("$.revenue.paidCount").value(1))
        .andExpect(jsonPath("$.planMetrics[0].planName").value("Basic"));
  }

  @Test
  void getMetrics_bucketSpellingsShareOneComputation() throws Exception {
    when(jdbcSnapshotLoader.load()).thenReturn(MetricsFixtures.snapshot());

    mockMvc.perform(get("/api/metrics").param("cohortBucket", "week")).andExpect(status().isOk());
    mockMvc.perform(get("/api/metrics").param("cohortBucket", "WEEK")).andExpect(status().isOk());

    verify(jdbcSnapshotLoader, times(1)).load();
  }

  @Test
  void getMetrics_zeroGrowthWindowReturnsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/metrics").param("growthWeeks", "0"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid growth window"));

    verifyNoInteractions(jdbcSnapshotLoader);
  }

  @Test
  void getMetrics_negativeLookbackReturnsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/metrics").param("lookbackDays", "-3"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid lookback window"));

    verifyNoInteractions(jdbcSnapshotLoader);
  }

  @Test
  void getMetrics_unknownGrowthMetricReturnsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/metrics").param("growthMetric", "revenue"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid growth metric"));

    verifyNoInteractions(jdbcSnapshotLoader);
  }

  @Test
  void export_unknownTableReturnsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/metrics/export/everything"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid result table"));
  }
}
