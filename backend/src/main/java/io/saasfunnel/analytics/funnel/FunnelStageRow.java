package io.saasfunnel.analytics.funnel;

/**
 * One funnel stage.
 *
 * @param stage stage name, matched against event types
 * @param uniqueUserCount distinct users with at least one event of this type
 * @param conversionFromStartPct share of the first stage's users, in percent
 * @param conversionFromPrevPct share of the previous stage's users, in percent (100 for the first)
 * @param dropOffFromPrevPct {@code 100 - conversionFromPrevPct}
 */
public record FunnelStageRow(
    String stage,
    long uniqueUserCount,
    double conversionFromStartPct,
    double conversionFromPrevPct,
    double dropOffFromPrevPct) {}
