package io.saasfunnel.analytics.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Immutable in-memory row table with the relational primitives the metric engines need: filter,
 * projection, hash joins, distinct-count group-by and pivot.
 *
 * <p>Every operation returns a new table or a new collection. Rows are never mutated, so a table
 * can be shared between threads.
 *
 * @param <R> row type
 */
public final class Table<R> {

  private final List<R> rows;

  private Table(List<R> rows) {
    this.rows = rows;
  }

  public static <R> Table<R> of(Collection<R> rows) {
    return new Table<>(List.copyOf(rows));
  }

  public static <R> Table<R> empty() {
    return new Table<>(List.of());
  }

  public List<R> rows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public Table<R> filter(Predicate<? super R> predicate) {
    return new Table<>(rows.stream().filter(predicate).toList());
  }

  public <T> Table<T> map(Function<? super R, ? extends T> mapper) {
    List<T> mapped = new ArrayList<>(rows.size());
    for (R row : rows) {
      mapped.add(mapper.apply(row));
    }
    return new Table<>(List.copyOf(mapped));
  }

  /** Distinct non-null values of {@code key}, in first-seen order. */
  public <K> Set<K> distinct(Function<? super R, K> key) {
    Set<K> values = new LinkedHashSet<>();
    for (R row : rows) {
      K value = key.apply(row);
      if (value != null) {
        values.add(value);
      }
    }
    return values;
  }

  /**
   * Hash inner join. Left rows with a null key or no matching right row are dropped; a left row
   * matching several right rows produces one output row per match.
   */
  public <S, K, J> Table<J> innerJoin(
      Table<S> right,
      Function<? super R, K> leftKey,
      Function<? super S, K> rightKey,
      BiFunction<? super R, ? super S, ? extends J> combiner) {
    var index = right.index(rightKey);
    List<J> joined = new ArrayList<>();
    for (R row : rows) {
      K key = leftKey.apply(row);
      if (key == null) {
        continue;
      }
      for (S match : index.getOrDefault(key, List.of())) {
        joined.add(combiner.apply(row, match));
      }
    }
    return new Table<>(List.copyOf(joined));
  }

  /**
   * Hash left join. Left rows without a match are kept once, with {@code null} passed to the
   * combiner as the right row.
   */
  public <S, K, J> Table<J> leftJoin(
      Table<S> right,
      Function<? super R, K> leftKey,
      Function<? super S, K> rightKey,
      BiFunction<? super R, ? super S, ? extends J> combiner) {
    var index = right.index(rightKey);
    List<J> joined = new ArrayList<>();
    for (R row : rows) {
      K key = leftKey.apply(row);
      List<S> matches = key == null ? List.of() : index.getOrDefault(key, List.of());
      if (matches.isEmpty()) {
        joined.add(combiner.apply(row, null));
      } else {
        for (S match : matches) {
          joined.add(combiner.apply(row, match));
        }
      }
    }
    return new Table<>(List.copyOf(joined));
  }

  /** Groups by {@code groupKey} and counts distinct non-null {@code valueKey} values per group. */
  public <K, V> Map<K, Long> countDistinct(
      Function<? super R, K> groupKey, Function<? super R, V> valueKey) {
    Map<K, Set<V>> seen = new HashMap<>();
    for (R row : rows) {
      V value = valueKey.apply(row);
      if (value == null) {
        continue;
      }
      seen.computeIfAbsent(groupKey.apply(row), k -> new HashSet<>()).add(value);
    }
    Map<K, Long> counts = new HashMap<>();
    seen.forEach((key, values) -> counts.put(key, (long) values.size()));
    return counts;
  }

  /**
   * Pivots a distinct count: rows keyed by {@code rowKey}, columns by {@code columnKey}, each cell
   * the number of distinct {@code valueKey} values observed for that pair.
   */
  public <K extends Comparable<? super K>, C extends Comparable<? super C>, V>
      PivotTable<K, C> pivotDistinct(
          Function<? super R, K> rowKey,
          Function<? super R, C> columnKey,
          Function<? super R, V> valueKey) {
    Map<K, Map<C, Set<V>>> seen = new TreeMap<>();
    Set<C> columns = new TreeSet<>();
    for (R row : rows) {
      V value = valueKey.apply(row);
      if (value == null) {
        continue;
      }
      K rowValue = rowKey.apply(row);
      C columnValue = columnKey.apply(row);
      columns.add(columnValue);
      seen.computeIfAbsent(rowValue, k -> new TreeMap<>())
          .computeIfAbsent(columnValue, c -> new HashSet<>())
          .add(value);
    }
    Map<K, Map<C, Long>> cells = new HashMap<>();
    seen.forEach(
        (rowValue, byColumn) -> {
          Map<C, Long> counts = new HashMap<>();
          byColumn.forEach((column, values) -> counts.put(column, (long) values.size()));
          cells.put(rowValue, Map.copyOf(counts));
        });
    return new PivotTable<>(List.copyOf(seen.keySet()), List.copyOf(columns), cells);
  }

  private <K> Map<K, List<R>> index(Function<? super R, K> key) {
    Map<K, List<R>> index = new HashMap<>();
    for (R row : rows) {
      K value = key.apply(row);
      if (value != null) {
        index.computeIfAbsent(value, k -> new ArrayList<>()).add(row);
      }
    }
    return index;
  }
}
