package io.saasfunnel.analytics.metrics;

import io.saasfunnel.analytics.cohort.CohortMatrix;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Writes result tables as comma-separated text. Column names and order are fixed per table so that
 * downstream spreadsheets keep working across releases.
 */
@Component
public class MetricsCsvWriter {

  static final List<String> FUNNEL_COLUMNS =
      List.of(
          "stage",
          "unique_user_count",
          "conversion_from_start_pct",
          "conversion_from_prev_pct",
          "drop_off_from_prev_pct");
  static final List<String> REVENUE_COLUMNS =
      List.of("paid_count", "mrr", "arpu", "avg_rev_per_paid_user", "churn_rate_pct_30d");
  static final List<String> WEEKLY_GROWTH_COLUMNS = List.of("week_start", "value", "pct_change");
  static final List<String> PLAN_COLUMNS =
      List.of("plan_name", "paid_users", "mrr", "avg_revenue_per_user");
  static final List<String> SOURCE_COLUMNS = List.of("source_name", "paid_users");

  public void write(ResultTable table, MetricsReport report, Writer out) throws IOException {
    var writer = new BufferedWriter(out);
    switch (table) {
      case FUNNEL ->
          writeRows(
              writer,
              FUNNEL_COLUMNS,
              report.funnel().rows().stream()
                  .map(
                      r ->
                          List.<Object>of(
                              r.stage(),
                              r.uniqueUserCount(),
                              r.conversionFromStartPct(),
                              r.conversionFromPrevPct(),
                              r.dropOffFromPrevPct()))
                  .toList());
      case REVENUE -> {
        var revenue = report.revenue();
        writeRows(
            writer,
            REVENUE_COLUMNS,
            List.of(
                List.<Object>of(
                    revenue.paidCount(),
                    revenue.mrr(),
                    revenue.arpu(),
                    revenue.avgRevPerPaidUser(),
                    revenue.churnRatePct30d())));
      }
      case COHORT -> writeCohort(writer, report.cohort());
      case WEEKLY_GROWTH ->
          writeRows(
              writer,
              WEEKLY_GROWTH_COLUMNS,
              report.weeklyGrowth().points().stream()
                  .map(p -> List.<Object>of(p.weekStart(), p.value(), p.pctChange()))
                  .toList());
      case PLAN_METRICS ->
          writeRows(
              writer,
              PLAN_COLUMNS,
              report.planMetrics().stream()
                  .map(
                      r ->
                          List.<Object>of(
                              r.planName(), r.paidUsers(), r.mrr(), r.avgRevenuePerUser()))
                  .toList());
      case SOURCE_METRICS ->
          writeRows(
              writer,
              SOURCE_COLUMNS,
              report.sourceMetrics().stream()
                  .map(r -> List.<Object>of(r.sourceName(), r.paidUsers()))
                  .toList());
    }
    writer.flush();
  }

  /** Cohort start followed by one retention column per period, headed by the period number. */
  private void writeCohort(BufferedWriter writer, CohortMatrix matrix) throws IOException {
    var columns = new ArrayList<String>();
    columns.add("cohort_start");
    matrix.periods().forEach(period -> columns.add(String.valueOf(period)));

    var rows = new ArrayList<List<Object>>();
    for (var row : matrix.rows()) {
      var values = new ArrayList<Object>();
      values.add(row.cohortStart());
      values.addAll(row.retentionPct());
      rows.add(values);
    }
    writeRows(writer, columns, rows);
  }

  private void writeRows(BufferedWriter writer, List<String> columns, List<List<Object>> rows)
      throws IOException {
    writer.write(columns.stream().map(this::escapeCsv).collect(Collectors.joining(",")));
    writer.newLine();
    for (var row : rows) {
      writer.write(
          row.stream()
              .map(value -> escapeCsv(formatValue(value)))
              .collect(Collectors.joining(",")));
      writer.newLine();
    }
  }

  private String formatValue(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
    if (value instanceof Double number) {
      return String.format(Locale.ROOT, "%.2f", number);
    }
    return value.toString();
  }

  private String escapeCsv(String value) {
    if (value == null) {
      return "";
    }
    // Defuse CSV formula injection (OWASP recommendation); negative numbers are left alone
    if (!value.isEmpty() && "=+-@\t\r".indexOf(value.charAt(0)) >= 0 && !isNumeric(value)) {
      value = "'" + value;
    }
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }

  private static boolean isNumeric(String value) {
    try {
      new BigDecimal(value);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
