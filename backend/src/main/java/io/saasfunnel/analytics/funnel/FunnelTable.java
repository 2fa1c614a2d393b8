package io.saasfunnel.analytics.funnel;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Funnel stages in caller-specified order. */
public record FunnelTable(List<FunnelStageRow> rows) {

  public FunnelTable {
    rows = List.copyOf(rows);
  }

  public Optional<FunnelStageRow> stage(String stage) {
    return rows.stream().filter(row -> row.stage().equals(stage)).findFirst();
  }

  /** Keeps only the given stages, preserving order. Percentages are not recomputed. */
  public FunnelTable retainStages(Collection<String> stages) {
    return new FunnelTable(rows.stream().filter(row -> stages.contains(row.stage())).toList());
  }
}
