package io.saasfunnel.analytics.snapshot;

/** A traffic or acquisition source. */
public record Source(long sourceId, String sourceName) {}
