package io.saasfunnel.analytics.growth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.saasfunnel.analytics.exception.InvalidArgumentException;
import io.saasfunnel.analytics.snapshot.Event;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GrowthEngineTest {

  private static final Map<String, String> METRICS =
      Map.of("signups", "signup", "visits", "visit", "trials", "trial", "paid", "paid");
  private static final GrowthMetric SIGNUPS = GrowthMetric.resolve("signups", METRICS);
  private static final LocalDateTime NOW = LocalDateTime.of(2025, 1, 24, 12, 0);

  private static List<Event> signups(long firstUserId, int count, LocalDate day) {
    var events = new ArrayList<Event>();
    for (long id = firstUserId; id < firstUserId + count; id++) {
      events.add(new Event(id, "signup", day.atTime(10, 0)));
    }
    return events;
  }

  @Test
  void gapWeekIsFilledAndPercentChangesFollowRebound() {
    var events = new ArrayList<Event>();
    events.addAll(signups(1, 5, LocalDate.of(2025, 1, 7)));
    events.addAll(signups(10, 2, LocalDate.of(2025, 1, 21)));

    var series = GrowthEngine.computeWeeklyGrowth(events, SIGNUPS, 12, NOW);

    assertThat(series.metric()).isEqualTo("signups");
    assertThat(series.points())
        .containsExactly(
            new WeeklyGrowthPoint(LocalDate.of(2025, 1, 6), 5, 0.0),
            new WeeklyGrowthPoint(LocalDate.of(2025, 1, 13), 0, -100.0),
            new WeeklyGrowthPoint(LocalDate.of(2025, 1, 20), 2, 100.0));
  }

  @Test
  void seriesCoversEveryWeekBetweenFirstAndLastObservation() {
    var events = new ArrayList<Event>();
    events.addAll(signups(1, 1, LocalDate.of(2024, 11, 5)));
    events.addAll(signups(2, 1, LocalDate.of(2025, 1, 22)));

    var series = GrowthEngine.computeWeeklyGrowth(events, SIGNUPS, 12, NOW);

    var first = series.points().get(0).weekStart();
    var last = series.points().get(series.points().size() - 1).weekStart();
    assertThat(series.points()).hasSize((int) ChronoUnit.WEEKS.between(first, last) + 1);
  }

  @Test
  void repeatedEventsCountDistinctUsers() {
    var day = LocalDate.of(2025, 1, 21);
    var events = new ArrayList<>(signups(1, 3, day));
    events.addAll(signups(1, 3, day.plusDays(1)));

    var series = GrowthEngine.computeWeeklyGrowth(events, SIGNUPS, 4, NOW);

    assertThat(series.points()).extracting(WeeklyGrowthPoint::value).containsExactly(3L);
  }

  @Test
  void activeUsersCountsAnyEventType() {
    var events =
        List.of(
            new Event(1, "visit", NOW.minusDays(1)),
            new Event(2, "paid", NOW.minusDays(1)),
            new Event(3, "trial", NOW.minusDays(2)));

    var series =
        GrowthEngine.computeWeeklyGrowth(
            events, GrowthMetric.resolve(GrowthMetric.ACTIVE_USERS, METRICS), 4, NOW);

    assertThat(series.points()).extracting(WeeklyGrowthPoint::value).containsExactly(3L);
  }

  @Test
  void eventsOutsideWindowAreIgnored() {
    var events =
        List.of(
            new Event(1, "signup", NOW.minusWeeks(5)),
            new Event(2, "signup", NOW.plusDays(1)),
            new Event(3, "signup", null));

    var series = GrowthEngine.computeWeeklyGrowth(events, SIGNUPS, 4, NOW);

    assertThat(series.isEmpty()).isTrue();
  }

  @Test
  void unknownMetricIsRejected() {
    assertThatThrownBy(() -> GrowthMetric.resolve("revenue", METRICS))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageContaining("revenue");
  }

  @Test
  void nonPositiveWindowIsRejected() {
    assertThatThrownBy(() -> GrowthEngine.computeWeeklyGrowth(List.of(), SIGNUPS, 0, NOW))
        .isInstanceOf(InvalidArgumentException.class);
  }

  @Test
  void sinceDropsEarlierWeeksWithoutRecomputing() {
    var events = new ArrayList<Event>();
    events.addAll(signups(1, 4, LocalDate.of(2025, 1, 7)));
    events.addAll(signups(10, 2, LocalDate.of(2025, 1, 14)));

    var series = GrowthEngine.computeWeeklyGrowth(events, SIGNUPS, 12, NOW);
    var recent = series.since(LocalDate.of(2025, 1, 10).atStartOfDay());

    assertThat(recent.points())
        .containsExactly(new WeeklyGrowthPoint(LocalDate.of(2025, 1, 13), 2, -50.0));
  }
}
