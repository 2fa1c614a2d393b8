package io.saasfunnel.analytics.table;

import java.util.List;
import java.util.Map;

/**
 * Dense two-dimensional view of a grouped count. Row and column keys are sorted ascending; cells
 * with no observations read as zero.
 *
 * @param rowKeys sorted row keys
 * @param columnKeys sorted column keys
 * @param cells observed counts, keyed by row then column
 */
public record PivotTable<K extends Comparable<? super K>, C extends Comparable<? super C>>(
    List<K> rowKeys, List<C> columnKeys, Map<K, Map<C, Long>> cells) {

  public PivotTable {
    rowKeys = List.copyOf(rowKeys);
    columnKeys = List.copyOf(columnKeys);
    cells = Map.copyOf(cells);
  }

  public long get(K rowKey, C columnKey) {
    var row = cells.get(rowKey);
    if (row == null) {
      return 0L;
    }
    return row.getOrDefault(columnKey, 0L);
  }

  public boolean isEmpty() {
    return rowKeys.isEmpty();
  }
}
