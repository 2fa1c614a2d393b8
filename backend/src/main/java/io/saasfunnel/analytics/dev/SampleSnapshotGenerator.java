package io.saasfunnel.analytics.dev;

import io.saasfunnel.analytics.snapshot.Event;
import io.saasfunnel.analytics.snapshot.InputSnapshot;
import io.saasfunnel.analytics.snapshot.Plan;
import io.saasfunnel.analytics.snapshot.Source;
import io.saasfunnel.analytics.snapshot.User;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates a random but reproducible snapshot for local development: users signing up over a
 * window of days, three priced plans, four traffic sources and uniformly drawn funnel events.
 */
public final class SampleSnapshotGenerator {

  static final int USER_COUNT = 100;
  static final int EVENT_COUNT = 300;
  static final int SPAN_DAYS = 100;
  static final List<String> EVENT_TYPES = List.of("visit", "signup", "trial", "paid");

  private SampleSnapshotGenerator() {}

  public static InputSnapshot generate(long seed, LocalDate start) {
    var random = new Random(seed);
    var plans =
        List.of(
            new Plan(1, "Basic", new BigDecimal("10.00")),
            new Plan(2, "Standard", new BigDecimal("20.00")),
            new Plan(3, "Pro", new BigDecimal("50.00")));
    var sources =
        List.of(
            new Source(1, "Google Ads"),
            new Source(2, "Organic"),
            new Source(3, "Referral"),
            new Source(4, "Social Media"));

    var users = new ArrayList<User>(USER_COUNT);
    for (long id = 1; id <= USER_COUNT; id++) {
      users.add(
          new User(
              id,
              randomDay(random, start),
              1L + random.nextInt(plans.size()),
              1L + random.nextInt(sources.size())));
    }

    var events = new ArrayList<Event>(EVENT_COUNT);
    for (int i = 0; i < EVENT_COUNT; i++) {
      events.add(
          new Event(
              1L + random.nextInt(USER_COUNT),
              EVENT_TYPES.get(random.nextInt(EVENT_TYPES.size())),
              randomDay(random, start)));
    }
    return new InputSnapshot(users, events, plans, sources);
  }

  private static LocalDateTime randomDay(Random random, LocalDate start) {
    return start.plusDays(random.nextInt(SPAN_DAYS)).atStartOfDay();
  }
}
