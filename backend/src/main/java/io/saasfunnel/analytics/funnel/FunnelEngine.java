package io.saasfunnel.analytics.funnel;

import io.saasfunnel.analytics.snapshot.Event;
import io.saasfunnel.analytics.table.Ratios;
import io.saasfunnel.analytics.table.Table;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts raw events into per-stage distinct-user counts and conversion ratios.
 *
 * <p>Conversion rules:
 *
 * <ul>
 *   <li>from start: {@code count[i] / count[0]}, with an empty first stage treated as 1
 *   <li>from previous: {@code count[i] / count[i-1]}; the first stage converts at 100%, and a
 *       transition out of an empty stage is also reported as 100%
 *   <li>drop-off: {@code 100 - fromPrevious}
 * </ul>
 *
 * <p>Pure function with no Spring dependencies. Never fails on empty or mismatched input.
 */
public final class FunnelEngine {

  static final double FIRST_STAGE_CONVERSION = 100.0;

  private FunnelEngine() {}

  public static FunnelTable computeFunnel(List<Event> events, List<String> stages) {
    var usersByType = Table.of(events).countDistinct(Event::eventType, Event::userId);

    var counts = new long[stages.size()];
    for (int i = 0; i < stages.size(); i++) {
      counts[i] = usersByType.getOrDefault(stages.get(i), 0L);
    }

    long start = counts.length > 0 ? Math.max(counts[0], 1) : 1;
    var rows = new ArrayList<FunnelStageRow>(stages.size());
    for (int i = 0; i < stages.size(); i++) {
      double fromStart = Ratios.percent(counts[i], start, 0.0);
      double fromPrev =
          i == 0
              ? FIRST_STAGE_CONVERSION
              : Ratios.percent(counts[i], counts[i - 1], FIRST_STAGE_CONVERSION);
      rows.add(
          new FunnelStageRow(
              stages.get(i), counts[i], fromStart, fromPrev, Ratios.round2(100 - fromPrev)));
    }
    return new FunnelTable(rows);
  }
}
