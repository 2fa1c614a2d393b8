package io.saasfunnel.analytics.metrics;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST endpoints for the funnel dashboard: computed reports and delimited-text downloads. */
@RestController
@RequestMapping("/api/metrics")
public class MetricsController {

  private final MetricsService metricsService;

  public MetricsController(MetricsService metricsService) {
    this.metricsService = metricsService;
  }

  @GetMapping
  public ResponseEntity<MetricsReport> getMetrics(
      @RequestParam(defaultValue = "30") int lookbackDays,
      @RequestParam(required = false) List<String> eventTypes,
      @RequestParam(defaultValue = "week") String cohortBucket,
      @RequestParam(defaultValue = "signups") String growthMetric,
      @RequestParam(defaultValue = "12") int growthWeeks) {
    var request =
        new MetricsRequest(lookbackDays, eventTypes, cohortBucket, growthMetric, growthWeeks);
    return ResponseEntity.ok(metricsService.computeFromDatabase(request));
  }

  /** Computes metrics for four uploaded CSV files instead of the database tables. */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<MetricsReport> uploadAndCompute(
      @RequestPart("users") MultipartFile users,
      @RequestPart("events") MultipartFile events,
      @RequestPart("plans") MultipartFile plans,
      @RequestPart("sources") MultipartFile sources,
      @RequestParam(defaultValue = "30") int lookbackDays,
      @RequestParam(required = false) List<String> eventTypes,
      @RequestParam(defaultValue = "week") String cohortBucket,
      @RequestParam(defaultValue = "signups") String growthMetric,
      @RequestParam(defaultValue = "12") int growthWeeks)
      throws IOException {
    var request =
        new MetricsRequest(lookbackDays, eventTypes, cohortBucket, growthMetric, growthWeeks);
    try (Reader usersReader = reader(users);
        Reader eventsReader = reader(events);
        Reader plansReader = reader(plans);
        Reader sourcesReader = reader(sources)) {
      return ResponseEntity.ok(
          metricsService.computeFromUpload(
              usersReader, eventsReader, plansReader, sourcesReader, request));
    }
  }

  @GetMapping("/export/{table}")
  public ResponseEntity<String> export(
      @PathVariable String table,
      @RequestParam(defaultValue = "30") int lookbackDays,
      @RequestParam(required = false) List<String> eventTypes,
      @RequestParam(defaultValue = "week") String cohortBucket,
      @RequestParam(defaultValue = "signups") String growthMetric,
      @RequestParam(defaultValue = "12") int growthWeeks)
      throws IOException {
    var resultTable = ResultTable.fromSlug(table);
    var request =
        new MetricsRequest(lookbackDays, eventTypes, cohortBucket, growthMetric, growthWeeks);
    var csv = new StringWriter();
    metricsService.exportFromDatabase(resultTable, request, csv);
    return ResponseEntity.ok()
        .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
        .header(
            "Content-Disposition", "attachment; filename=\"" + resultTable.filename() + "\"")
        .body(csv.toString());
  }

  private static Reader reader(MultipartFile file) throws IOException {
    return new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8);
  }
}
