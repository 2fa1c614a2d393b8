package io.saasfunnel.analytics.dev;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.saasfunnel.analytics.metrics.MetricsRequest;
import io.saasfunnel.analytics.metrics.MetricsService;
import io.saasfunnel.analytics.snapshot.InputSnapshot;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class DevSampleControllerTest {

  @Mock private MetricsService metricsService;

  @Test
  void sampleMetricsComputesOverSnapshotEndingToday() throws Exception {
    var clock = Clock.fixed(Instant.parse("2025-04-10T08:00:00Z"), ZoneOffset.UTC);
    var mockMvc =
        MockMvcBuilders.standaloneSetup(new DevSampleController(metricsService, clock)).build();

    mockMvc.perform(get("/dev/sample-metrics").param("seed", "5")).andExpect(status().isOk());

    var captor = ArgumentCaptor.forClass(InputSnapshot.class);
    verify(metricsService).computeFromSnapshot(captor.capture(), eq(MetricsRequest.defaults()));
    var start = LocalDate.of(2025, 4, 10).minusDays(SampleSnapshotGenerator.SPAN_DAYS - 1L);
    assertThat(captor.getValue()).isEqualTo(SampleSnapshotGenerator.generate(5, start));
  }
}
