package io.saasfunnel.analytics.segment;

import java.math.BigDecimal;

public record PlanMetricsRow(
    String planName, long paidUsers, BigDecimal mrr, BigDecimal avgRevenuePerUser) {}
