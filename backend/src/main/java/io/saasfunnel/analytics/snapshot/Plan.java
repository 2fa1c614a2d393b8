package io.saasfunnel.analytics.snapshot;

import java.math.BigDecimal;

/** A subscription plan and its monthly price. */
public record Plan(long planId, String planName, BigDecimal price) {}
