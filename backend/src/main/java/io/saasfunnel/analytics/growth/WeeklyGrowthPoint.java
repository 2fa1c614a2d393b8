package io.saasfunnel.analytics.growth;

import java.time.LocalDate;

/**
 * @param weekStart Monday of the week
 * @param value distinct users counted in the week
 * @param pctChange change from the previous week, in percent
 */
public record WeeklyGrowthPoint(LocalDate weekStart, long value, double pctChange) {}
