package io.saasfunnel.analytics.snapshot;

import java.time.LocalDateTime;

/**
 * A registered user.
 *
 * @param userId unique user id, the join key for every other table
 * @param signupDate signup timestamp (UTC), null when the source value could not be parsed
 * @param planId referenced plan, null when the user has none
 * @param sourceId referenced acquisition source, null when unknown
 */
public record User(long userId, LocalDateTime signupDate, Long planId, Long sourceId) {}
