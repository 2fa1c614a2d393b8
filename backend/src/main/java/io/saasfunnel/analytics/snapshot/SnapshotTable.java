package io.saasfunnel.analytics.snapshot;

import io.saasfunnel.analytics.exception.SchemaMismatchException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** The four input tables and the columns each one must provide. */
public enum SnapshotTable {
  USERS("Users", List.of("user_id", "signup_date", "plan_id", "source_id")),
  EVENTS("Events", List.of("user_id", "event_type", "event_date")),
  PLANS("Plans", List.of("plan_id", "plan_name", "price")),
  SOURCES("Sources", List.of("source_id", "source_name"));

  private static final String BYTE_ORDER_MARK = "\uFEFF";

  private final String tableName;
  private final List<String> requiredColumns;

  SnapshotTable(String tableName, List<String> requiredColumns) {
    this.tableName = tableName;
    this.requiredColumns = requiredColumns;
  }

  public String tableName() {
    return tableName;
  }

  public List<String> requiredColumns() {
    return requiredColumns;
  }

  /**
   * Checks that every required column is present, ignoring case and surrounding whitespace.
   *
   * @throws SchemaMismatchException naming the first missing column
   */
  public void requireColumns(Collection<String> actualColumns) {
    Set<String> normalized =
        actualColumns.stream().map(SnapshotTable::normalize).collect(Collectors.toSet());
    for (String column : requiredColumns) {
      if (!normalized.contains(column)) {
        throw SchemaMismatchException.missingColumn(tableName, column);
      }
    }
  }

  /** Lower-cased and trimmed; a leading byte order mark from spreadsheet exports is dropped. */
  static String normalize(String column) {
    if (column == null) {
      return "";
    }
    var name = column.startsWith(BYTE_ORDER_MARK) ? column.substring(1) : column;
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
