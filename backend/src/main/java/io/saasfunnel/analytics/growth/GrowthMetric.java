package io.saasfunnel.analytics.growth;

import io.saasfunnel.analytics.exception.InvalidArgumentException;
import io.saasfunnel.analytics.snapshot.Event;
import java.util.Map;
import java.util.TreeSet;

/**
 * What the weekly growth series counts: distinct users with any event ({@value #ACTIVE_USERS}), or
 * distinct users with one specific event type.
 *
 * @param name metric name as requested by the caller
 * @param eventType event type counted, null for any type
 */
public record GrowthMetric(String name, String eventType) {

  public static final String ACTIVE_USERS = "active_users";

  public boolean matches(Event event) {
    return eventType == null || event.isType(eventType);
  }

  /**
   * Resolves a metric name against the configured name-to-event-type table.
   *
   * @throws InvalidArgumentException for names that are neither {@value #ACTIVE_USERS} nor mapped
   */
  public static GrowthMetric resolve(String name, Map<String, String> eventTypesByMetric) {
    if (ACTIVE_USERS.equals(name)) {
      return new GrowthMetric(name, null);
    }
    var eventType = name == null ? null : eventTypesByMetric.get(name);
    if (eventType == null) {
      var supported = new TreeSet<>(eventTypesByMetric.keySet());
      supported.add(ACTIVE_USERS);
      throw new InvalidArgumentException(
          "growth metric", name, "expected one of " + String.join(", ", supported));
    }
    return new GrowthMetric(name, eventType);
  }
}
