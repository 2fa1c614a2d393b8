package io.saasfunnel.analytics.snapshot;

import io.saasfunnel.analytics.exception.SnapshotUnavailableException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * Loads the four input tables from the relational store with read-only {@code SELECT *} queries.
 * Columns are checked against result-set metadata before any row is mapped.
 */
@Repository
public class JdbcSnapshotLoader {

  private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotLoader.class);

  private final JdbcClient jdbc;

  public JdbcSnapshotLoader(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  public InputSnapshot load() {
    log.info("Fetching raw tables from database");
    try {
      var snapshot =
          new InputSnapshot(
              fetch(SnapshotTable.USERS, SnapshotRows::user),
              fetch(SnapshotTable.EVENTS, SnapshotRows::event),
              fetch(SnapshotTable.PLANS, SnapshotRows::plan),
              fetch(SnapshotTable.SOURCES, SnapshotRows::source));
      log.info(
          "Fetched: {} users, {} events", snapshot.users().size(), snapshot.events().size());
      return snapshot;
    } catch (DataAccessException e) {
      throw new SnapshotUnavailableException("database", e);
    }
  }

  private <T> List<T> fetch(
      SnapshotTable table, BiFunction<Map<String, Object>, Integer, T> rowMapper) {
    return jdbc.sql("SELECT * FROM " + table.tableName())
        .query(extractor(table, rowMapper));
  }

  static <T> ResultSetExtractor<List<T>> extractor(
      SnapshotTable table, BiFunction<Map<String, Object>, Integer, T> rowMapper) {
    return rs -> {
      var columns = columnLabels(rs);
      table.requireColumns(columns);
      var rows = new ArrayList<T>();
      int rowNumber = 0;
      while (rs.next()) {
        rowNumber++;
        var row = new HashMap<String, Object>();
        for (int i = 0; i < columns.size(); i++) {
          row.put(SnapshotTable.normalize(columns.get(i)), rs.getObject(i + 1));
        }
        rows.add(rowMapper.apply(row, rowNumber));
      }
      return rows;
    };
  }

  private static List<String> columnLabels(ResultSet rs) throws SQLException {
    var metaData = rs.getMetaData();
    var labels = new ArrayList<String>(metaData.getColumnCount());
    for (int i = 1; i <= metaData.getColumnCount(); i++) {
      labels.add(metaData.getColumnLabel(i));
    }
    return labels;
  }
}
