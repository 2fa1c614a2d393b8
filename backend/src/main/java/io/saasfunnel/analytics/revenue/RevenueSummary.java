package io.saasfunnel.analytics.revenue;

import java.math.BigDecimal;

/**
 * Headline revenue figures. Money values are rounded to cents.
 *
 * @param paidCount distinct users with a paid event
 * @param mrr sum of the plan prices of paid users
 * @param arpu {@code mrr} over all users
 * @param avgRevPerPaidUser mean plan price among paid users with a known plan
 * @param churnRatePct30d share of paid users not seen paying in the trailing 30 days, in percent
 */
public record RevenueSummary(
    long paidCount,
    BigDecimal mrr,
    BigDecimal arpu,
    BigDecimal avgRevPerPaidUser,
    double churnRatePct30d) {

  public static RevenueSummary empty() {
    var zero = BigDecimal.ZERO.setScale(2);
    return new RevenueSummary(0, zero, zero, zero, 0.0);
  }
}
