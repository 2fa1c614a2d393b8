package io.saasfunnel.analytics.cohort;

import io.saasfunnel.analytics.cohort.CohortMatrix.CohortRow;
import io.saasfunnel.analytics.snapshot.Event;
import io.saasfunnel.analytics.snapshot.User;
import io.saasfunnel.analytics.table.Ratios;
import io.saasfunnel.analytics.table.Table;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Buckets users into signup cohorts and measures, for each later week, the share of the cohort
 * that is still producing events.
 *
 * <p>Periods are always 7-day windows measured from each user's own signup timestamp, whatever the
 * cohort bucket. Monthly cohorts therefore get weekly retention curves.
 *
 * <p>Events without a timestamp, events of unknown users and events dated before the user's signup
 * are not aligned to any period.
 */
public final class CohortEngine {

  static final int PERIOD_DAYS = 7;

  private CohortEngine() {}

  public static CohortMatrix computeCohortRetention(
      List<User> users, List<Event> events, CohortBucket bucket) {
    var signedUp = Table.of(users).filter(u -> u.signupDate() != null);

    var aligned =
        Table.of(events)
            .filter(e -> e.eventDate() != null)
            .innerJoin(
                signedUp,
                Event::userId,
                User::userId,
                (event, user) ->
                    new AlignedEvent(
                        user.userId(),
                        bucket.startOf(user.signupDate()),
                        periodNumber(Duration.between(user.signupDate(), event.eventDate()))))
            .filter(e -> e.period() >= 0);

    if (aligned.isEmpty()) {
      return CohortMatrix.empty(bucket);
    }

    var pivot =
        aligned.pivotDistinct(AlignedEvent::cohort, AlignedEvent::period, AlignedEvent::userId);
    var cohortSizes =
        signedUp.countDistinct(u -> bucket.startOf(u.signupDate()), User::userId);

    var periods = new TreeSet<>(pivot.columnKeys());
    periods.add(0);
    var columns = List.copyOf(periods);

    var rows = new ArrayList<CohortRow>(pivot.rowKeys().size());
    for (LocalDate cohort : pivot.rowKeys()) {
      long size = cohortSizes.getOrDefault(cohort, 0L);
      var active = new ArrayList<Long>(columns.size());
      var retention = new ArrayList<Double>(columns.size());
      for (int period : columns) {
        long count = period == 0 ? size : pivot.get(cohort, period);
        active.add(count);
        retention.add(Ratios.percent(count, size, 0.0));
      }
      rows.add(new CohortRow(cohort, size, active, retention));
    }
    return new CohortMatrix(bucket, columns, rows);
  }

  static int periodNumber(Duration sinceSignup) {
    if (sinceSignup.isNegative()) {
      return -1;
    }
    return (int) (sinceSignup.toDays() / PERIOD_DAYS);
  }

  private record AlignedEvent(long userId, LocalDate cohort, int period) {}
}
