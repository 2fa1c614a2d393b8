package io.saasfunnel.analytics.snapshot;

import io.saasfunnel.analytics.exception.SchemaMismatchException;
import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.HashMap;
import java.util.Map;

/**
 * Converts raw rows (column name to value) into snapshot records. Values may arrive as strings
 * (delimited text) or as JDBC objects; both go through the same conversion rules.
 *
 * <p>Ids and prices are required: a blank or malformed value is a schema mismatch. Nullable
 * references ({@code plan_id}, {@code source_id}) accept blanks. Timestamps are normalized to UTC;
 * values that cannot be parsed become {@code null} rather than failing the load.
 */
final class SnapshotRows {

  private static final DateTimeFormatter TIMESTAMP =
      new DateTimeFormatterBuilder()
          .append(DateTimeFormatter.ISO_LOCAL_DATE)
          .optionalStart()
          .optionalStart()
          .appendLiteral('T')
          .optionalEnd()
          .optionalStart()
          .appendLiteral(' ')
          .optionalEnd()
          .appendPattern("HH:mm")
          .optionalStart()
          .appendPattern(":ss")
          .optionalEnd()
          .optionalStart()
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .optionalEnd()
          .optionalEnd()
          .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
          .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
          .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
          .toFormatter();

  // Same shapes with a trailing UTC offset, e.g. "2025-01-01T10:00:00Z" or "... 10:00:00+00:00"
  private static final DateTimeFormatter OFFSET_TIMESTAMP =
      new DateTimeFormatterBuilder()
          .append(DateTimeFormatter.ISO_LOCAL_DATE)
          .optionalStart()
          .appendLiteral('T')
          .optionalEnd()
          .optionalStart()
          .appendLiteral(' ')
          .optionalEnd()
          .append(DateTimeFormatter.ISO_LOCAL_TIME)
          .appendOffset("+HH:mm", "Z")
          .toFormatter();

  private SnapshotRows() {}

  static Map<String, Object> normalizeKeys(Map<String, ?> row) {
    var normalized = new HashMap<String, Object>();
    row.forEach((key, value) -> normalized.put(SnapshotTable.normalize(key), value));
    return normalized;
  }

  static User user(Map<String, Object> row, int rowNumber) {
    var table = SnapshotTable.USERS.tableName();
    return new User(
        requiredLong(row, table, "user_id", rowNumber),
        timestamp(row.get("signup_date")),
        optionalLong(row, table, "plan_id", rowNumber),
        optionalLong(row, table, "source_id", rowNumber));
  }

  static Event event(Map<String, Object> row, int rowNumber) {
    var table = SnapshotTable.EVENTS.tableName();
    return new Event(
        requiredLong(row, table, "user_id", rowNumber),
        requiredText(row, table, "event_type", rowNumber),
        timestamp(row.get("event_date")));
  }

  static Plan plan(Map<String, Object> row, int rowNumber) {
    var table = SnapshotTable.PLANS.tableName();
    var price = requiredDecimal(row, table, "price", rowNumber);
    if (price.signum() < 0) {
      throw SchemaMismatchException.malformedValue(
          table, "price", rowNumber, price.toPlainString());
    }
    return new Plan(
        requiredLong(row, table, "plan_id", rowNumber),
        requiredText(row, table, "plan_name", rowNumber),
        price);
  }

  static Source source(Map<String, Object> row, int rowNumber) {
    var table = SnapshotTable.SOURCES.tableName();
    return new Source(
        requiredLong(row, table, "source_id", rowNumber),
        requiredText(row, table, "source_name", rowNumber));
  }

  static LocalDateTime timestamp(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof LocalDateTime ldt) {
      return ldt;
    }
    if (value instanceof Timestamp ts) {
      return LocalDateTime.ofInstant(ts.toInstant(), ZoneOffset.UTC);
    }
    if (value instanceof java.sql.Date date) {
      return date.toLocalDate().atStartOfDay();
    }
    if (value instanceof LocalDate ld) {
      return ld.atStartOfDay();
    }
    if (value instanceof OffsetDateTime odt) {
      return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }
    var text = value.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      return LocalDateTime.parse(text, TIMESTAMP);
    } catch (DateTimeParseException e) {
      return offsetTimestamp(text);
    }
  }

  private static LocalDateTime offsetTimestamp(String text) {
    try {
      return OffsetDateTime.parse(text, OFFSET_TIMESTAMP)
          .withOffsetSameInstant(ZoneOffset.UTC)
          .toLocalDateTime();
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static long requiredLong(
      Map<String, Object> row, String table, String column, int rowNumber) {
    Long value = optionalLong(row, table, column, rowNumber);
    if (value == null) {
      throw SchemaMismatchException.malformedValue(table, column, rowNumber, "");
    }
    return value;
  }

  private static Long optionalLong(
      Map<String, Object> row, String table, String column, int rowNumber) {
    var value = row.get(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.longValue();
    }
    var text = value.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      // Exported numeric columns often carry a trailing ".0"
      return new BigDecimal(text).longValueExact();
    } catch (NumberFormatException | ArithmeticException e) {
      throw SchemaMismatchException.malformedValue(table, column, rowNumber, text);
    }
  }

  private static BigDecimal requiredDecimal(
      Map<String, Object> row, String table, String column, int rowNumber) {
    var value = row.get(column);
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    if (value instanceof Number number) {
      return new BigDecimal(number.toString());
    }
    var text = value == null ? "" : value.toString().trim();
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException e) {
      throw SchemaMismatchException.malformedValue(table, column, rowNumber, text);
    }
  }

  private static String requiredText(
      Map<String, Object> row, String table, String column, int rowNumber) {
    var value = row.get(column);
    var text = value == null ? "" : value.toString().trim();
    if (text.isEmpty()) {
      throw SchemaMismatchException.malformedValue(table, column, rowNumber, text);
    }
    return text;
  }
}
