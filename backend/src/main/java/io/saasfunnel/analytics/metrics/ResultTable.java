package io.saasfunnel.analytics.metrics;

import io.saasfunnel.analytics.exception.InvalidArgumentException;
import java.util.Arrays;
import java.util.stream.Collectors;

/** Result tables available for delimited-text export. */
public enum ResultTable {
  FUNNEL("funnel"),
  REVENUE("revenue"),
  COHORT("cohort"),
  WEEKLY_GROWTH("weekly-growth"),
  PLAN_METRICS("plan-metrics"),
  SOURCE_METRICS("source-metrics");

  private final String slug;

  ResultTable(String slug) {
    this.slug = slug;
  }

  public String slug() {
    return slug;
  }

  public String filename() {
    return slug + ".csv";
  }

  public static ResultTable fromSlug(String slug) {
    return Arrays.stream(values())
        .filter(table -> table.slug.equals(slug))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidArgumentException(
                    "result table",
                    slug,
                    "expected one of "
                        + Arrays.stream(values())
                            .map(ResultTable::slug)
                            .collect(Collectors.joining(", "))));
  }
}
