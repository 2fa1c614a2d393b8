package io.saasfunnel.analytics.snapshot;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the four input tables from header-first comma-separated text, as produced by a spreadsheet
 * or a dataframe export. Column order is free; extra columns are ignored.
 */
@Component
public class CsvSnapshotReader {

  private static final Logger log = LoggerFactory.getLogger(CsvSnapshotReader.class);

  private final CsvMapper csvMapper;

  public CsvSnapshotReader() {
    this.csvMapper =
        CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
  }

  /**
   * Reads all four tables. Each table's header is checked before its rows are parsed, so a missing
   * column fails fast with the table and column named.
   */
  public InputSnapshot read(Reader users, Reader events, Reader plans, Reader sources)
      throws IOException {
    var snapshot =
        new InputSnapshot(
            readTable(SnapshotTable.USERS, users, SnapshotRows::user),
            readTable(SnapshotTable.EVENTS, events, SnapshotRows::event),
            readTable(SnapshotTable.PLANS, plans, SnapshotRows::plan),
            readTable(SnapshotTable.SOURCES, sources, SnapshotRows::source));
    log.info(
        "Read CSV snapshot: {} users, {} events, {} plans, {} sources",
        snapshot.users().size(),
        snapshot.events().size(),
        snapshot.plans().size(),
        snapshot.sources().size());
    return snapshot;
  }

  <T> List<T> readTable(
      SnapshotTable table,
      Reader reader,
      BiFunction<Map<String, Object>, Integer, T> rowMapper)
      throws IOException {
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    try (MappingIterator<Map<String, String>> iterator =
        csvMapper.readerForMapOf(String.class).with(schema).readValues(reader)) {
      // hasNextValue() forces the header line to be parsed
      boolean hasRows = iterator.hasNextValue();
      var header = new ArrayList<String>();
      if (iterator.getParserSchema() instanceof CsvSchema parsed) {
        parsed.forEach(column -> header.add(column.getName()));
      }
      table.requireColumns(header);

      var rows = new ArrayList<T>();
      int rowNumber = 0;
      while (hasRows) {
        rowNumber++;
        rows.add(rowMapper.apply(SnapshotRows.normalizeKeys(iterator.nextValue()), rowNumber));
        hasRows = iterator.hasNextValue();
      }
      return rows;
    }
  }
}
