package io.saasfunnel.analytics.snapshot;

import java.util.List;

/**
 * Immutable bundle of the four input tables. Every metric engine reads from a snapshot and none
 * modifies it, so one instance can be shared by concurrently running engines.
 */
public record InputSnapshot(
    List<User> users, List<Event> events, List<Plan> plans, List<Source> sources) {

  public InputSnapshot {
    users = List.copyOf(users);
    events = List.copyOf(events);
    plans = List.copyOf(plans);
    sources = List.copyOf(sources);
  }

  public static InputSnapshot empty() {
    return new InputSnapshot(List.of(), List.of(), List.of(), List.of());
  }
}
