package io.saasfunnel.analytics.segment;

import io.saasfunnel.analytics.snapshot.Event;
import io.saasfunnel.analytics.snapshot.Plan;
import io.saasfunnel.analytics.snapshot.Source;
import io.saasfunnel.analytics.snapshot.User;
import io.saasfunnel.analytics.table.Ratios;
import io.saasfunnel.analytics.table.Table;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Breaks paid users down by plan and by acquisition source.
 *
 * <p>Only users with at least one paid event are considered, each counted once however many paid
 * events they have. A user whose plan or source id has no reference row is left out of that
 * breakdown instead of being reported under an "unknown" group.
 */
public final class SegmentEngine {

  private SegmentEngine() {}

  public static List<PlanMetricsRow> computePlanMetrics(
      List<User> users, List<Event> events, List<Plan> plans, String paidEventType) {
    var byPlan =
        paidUsers(users, events, paidEventType)
            .innerJoin(Table.of(plans), User::planId, Plan::planId, PaidPlan::new)
            .rows();

    Map<String, List<PaidPlan>> groups = new TreeMap<>();
    for (PaidPlan row : byPlan) {
      groups.computeIfAbsent(row.plan().planName(), k -> new ArrayList<>()).add(row);
    }

    var result = new ArrayList<PlanMetricsRow>(groups.size());
    groups.forEach(
        (planName, rows) -> {
          long paid = rows.stream().map(r -> r.user().userId()).distinct().count();
          BigDecimal mrr =
              rows.stream().map(r -> r.plan().price()).reduce(BigDecimal.ZERO, BigDecimal::add);
          var average = Ratios.mean(mrr, rows.size());
          result.add(new PlanMetricsRow(planName, paid, Ratios.round2(mrr), average));
        });
    return List.copyOf(result);
  }

  public static List<SourceMetricsRow> computeSourceMetrics(
      List<User> users, List<Event> events, List<Source> sources, String paidEventType) {
    var counts =
        paidUsers(users, events, paidEventType)
            .innerJoin(Table.of(sources), User::sourceId, Source::sourceId, PaidSource::new)
            .countDistinct(r -> r.source().sourceName(), r -> r.user().userId());

    return new TreeMap<>(counts)
        .entrySet().stream()
            .map(entry -> new SourceMetricsRow(entry.getKey(), entry.getValue()))
            .toList();
  }

  private static Table<User> paidUsers(List<User> users, List<Event> events, String paidEventType) {
    var paidUserIds = Table.of(events).filter(e -> e.isType(paidEventType)).distinct(Event::userId);
    return Table.of(users).filter(u -> paidUserIds.contains(u.userId()));
  }

  private record PaidPlan(User user, Plan plan) {}

  private record PaidSource(User user, Source source) {}
}
