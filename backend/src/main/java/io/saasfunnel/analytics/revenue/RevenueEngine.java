package io.saasfunnel.analytics.revenue;

import io.saasfunnel.analytics.snapshot.Event;
import io.saasfunnel.analytics.snapshot.Plan;
import io.saasfunnel.analytics.snapshot.User;
import io.saasfunnel.analytics.table.Ratios;
import io.saasfunnel.analytics.table.Table;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Computes paid-user count, MRR, ARPU, average revenue per paid user and a trailing 30-day churn
 * estimate.
 *
 * <p>The churn figure is a retention proxy: it compares all-time paying users with users who
 * produced a paid event in the 30 days ending at {@code asOf}. It does not model subscription
 * start and cancellation, so a user on an annual plan who paid once 40 days ago counts as churned.
 */
public final class RevenueEngine {

  static final int CHURN_WINDOW_DAYS = 30;

  private RevenueEngine() {}

  public static RevenueSummary computeRevenue(
      List<User> users,
      List<Event> events,
      List<Plan> plans,
      String paidEventType,
      LocalDateTime asOf) {
    var paidEvents = Table.of(events).filter(e -> e.isType(paidEventType));
    var paidUserIds = paidEvents.distinct(Event::userId);
    long paidCount = paidUserIds.size();
    if (paidCount == 0) {
      return RevenueSummary.empty();
    }

    // left join: a paid user whose plan is unknown contributes no price
    var prices =
        Table.of(users)
            .filter(u -> paidUserIds.contains(u.userId()))
            .leftJoin(
                Table.of(plans),
                User::planId,
                Plan::planId,
                (user, plan) -> Optional.ofNullable(plan).map(Plan::price))
            .filter(Optional::isPresent)
            .map(Optional::get)
            .rows();

    BigDecimal mrr = prices.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    BigDecimal arpu =
        users.isEmpty()
            ? BigDecimal.ZERO.setScale(2)
            : mrr.divide(BigDecimal.valueOf(users.size()), 2, RoundingMode.HALF_UP);
    BigDecimal avgPerPaid = Ratios.mean(mrr, prices.size());

    var windowStart = asOf.minusDays(CHURN_WINDOW_DAYS);
    long recentPaid =
        paidEvents
            .filter(e -> e.eventDate() != null)
            .filter(e -> !e.eventDate().isBefore(windowStart) && !e.eventDate().isAfter(asOf))
            .distinct(Event::userId)
            .size();
    double churn = Ratios.round2(100 * (1 - (double) recentPaid / paidCount));

    return new RevenueSummary(paidCount, Ratios.round2(mrr), arpu, avgPerPaid, churn);
  }
}
