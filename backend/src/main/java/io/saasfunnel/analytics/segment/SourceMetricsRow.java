package io.saasfunnel.analytics.segment;

public record SourceMetricsRow(String sourceName, long paidUsers) {}
