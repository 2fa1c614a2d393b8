package io.saasfunnel.analytics.snapshot;

import java.time.LocalDateTime;

/**
 * A single tracked user event. Users may have any number of events of the same type.
 *
 * @param userId the acting user
 * @param eventType event type from the stage vocabulary, e.g. {@code visit} or {@code paid}
 * @param eventDate event timestamp (UTC), null when the source value could not be parsed
 */
public record Event(long userId, String eventType, LocalDateTime eventDate) {

  public boolean isType(String type) {
    return eventType != null && eventType.equals(type);
  }
}
