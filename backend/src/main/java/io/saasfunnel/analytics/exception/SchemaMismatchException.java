package io.saasfunnel.analytics.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Input table does not match the expected schema. Raised while loading a snapshot, before any
 * metric is computed.
 */
public class SchemaMismatchException extends ErrorResponseException {

  private final String table;
  private final String column;

  private SchemaMismatchException(String table, String column, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(table, column, detail), null);
    this.table = table;
    this.column = column;
  }

  public static SchemaMismatchException missingColumn(String table, String column) {
    return new SchemaMismatchException(
        table, column, "Table " + table + " is missing required column '" + column + "'");
  }

  public static SchemaMismatchException malformedValue(
      String table, String column, int rowNumber, String value) {
    return new SchemaMismatchException(
        table,
        column,
        "Table " + table + " row " + rowNumber + ": invalid " + column + " value '" + value + "'");
  }

  public String getTable() {
    return table;
  }

  public String getColumn() {
    return column;
  }

  private static ProblemDetail createProblem(String table, String column, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Schema mismatch");
    problem.setDetail(detail);
    problem.setProperty("table", table);
    problem.setProperty("column", column);
    return problem;
  }
}
