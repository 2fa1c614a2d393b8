package io.saasfunnel.analytics.funnel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.saasfunnel.analytics.snapshot.Event;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class FunnelEngineTest {

  private static final List<String> STAGES = List.of("visit", "signup", "trial", "paid");

  private static Event event(long userId, String type, int day) {
    return new Event(userId, type, LocalDateTime.of(2025, 1, day, 0, 0));
  }

  @Test
  void singleUserWhoSignedUpButNeverTrialled() {
    var events = List.of(event(1, "visit", 1), event(1, "signup", 2));

    var funnel = FunnelEngine.computeFunnel(events, STAGES);

    assertThat(funnel.rows())
        .containsExactly(
            new FunnelStageRow("visit", 1, 100.0, 100.0, 0.0),
            new FunnelStageRow("signup", 1, 100.0, 100.0, 0.0),
            new FunnelStageRow("trial", 0, 0.0, 0.0, 100.0),
            new FunnelStageRow("paid", 0, 0.0, 100.0, 0.0));
  }

  @Test
  void repeatedEventsAreCountedOncePerUser() {
    var events =
        List.of(
            event(1, "visit", 1),
            event(1, "visit", 2),
            event(1, "visit", 3),
            event(2, "visit", 1),
            event(3, "visit", 1),
            event(4, "visit", 1),
            event(1, "signup", 2),
            event(1, "signup", 4));

    var funnel = FunnelEngine.computeFunnel(events, STAGES);

    assertThat(funnel.stage("visit").orElseThrow().uniqueUserCount()).isEqualTo(4L);
    var signup = funnel.stage("signup").orElseThrow();
    assertThat(signup.uniqueUserCount()).isEqualTo(1L);
    assertThat(signup.conversionFromStartPct()).isEqualTo(25.0);
    assertThat(signup.conversionFromPrevPct()).isEqualTo(25.0);
    assertThat(signup.dropOffFromPrevPct()).isEqualTo(75.0);
  }

  @Test
  void countsNeverIncreaseAlongAMonotoneJourney() {
    var events =
        List.of(
            event(1, "visit", 1),
            event(2, "visit", 1),
            event(3, "visit", 1),
            event(1, "signup", 2),
            event(2, "signup", 2),
            event(1, "trial", 3),
            event(1, "paid", 4));

    var rows = FunnelEngine.computeFunnel(events, STAGES).rows();

    assertThat(rows).extracting(FunnelStageRow::uniqueUserCount).containsExactly(3L, 2L, 1L, 1L);
    assertThat(rows)
        .allSatisfy(
            row -> {
              assertThat(row.conversionFromStartPct()).isBetween(0.0, 100.0);
              assertThat(row.dropOffFromPrevPct())
                  .isCloseTo(100 - row.conversionFromPrevPct(), within(0.001));
            });
    assertThat(rows.get(1).conversionFromPrevPct()).isEqualTo(66.67);
  }

  @Test
  void emptyEventsYieldZeroCountsWithoutFailing() {
    var rows = FunnelEngine.computeFunnel(List.of(), STAGES).rows();

    assertThat(rows).hasSize(4).extracting(FunnelStageRow::uniqueUserCount).containsOnly(0L);
    assertThat(rows.get(0).conversionFromPrevPct()).isEqualTo(100.0);
  }

  @Test
  void emptyStageListYieldsEmptyTable() {
    assertThat(FunnelEngine.computeFunnel(List.of(event(1, "visit", 1)), List.of()).rows())
        .isEmpty();
  }

  @Test
  void retainStagesKeepsOrderAndValues() {
    var funnel =
        FunnelEngine.computeFunnel(List.of(event(1, "visit", 1), event(1, "paid", 2)), STAGES);

    var retained = funnel.retainStages(List.of("paid", "visit"));

    assertThat(retained.rows())
        .extracting(FunnelStageRow::stage)
        .containsExactly("visit", "paid");
    assertThat(retained.stage("paid").orElseThrow().conversionFromPrevPct()).isEqualTo(100.0);
  }
}
