package com.acme.brickwatch.web.dto;

import com.acme.brickwatch.domain.Brick;
import com.acme.brickwatch.domain.HistoryEntry;
import com.acme.brickwatch.schedule.Periodicity;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JSON projection of a brick. {@code history} is included for single-brick responses and verbose
 * listings; {@code schedule} lists the rule boundaries of the coming week for cron-style
 * periodicities.
 */
public record BrickView(
    String id,
    String name,
    String slug,
    String description,
    String periodicity,
    List<String> emails,
    boolean paused,
    boolean late,
    Instant deadline,
    Instant resumeAt,
    Instant createdAt,
    Instant lastEventAt,
    List<HistoryEntry> history,
    List<ScheduleSegmentView> schedule) {

  public static BrickView summary(Brick brick) {
    return of(brick, false, null);
  }

  public static BrickView detailed(Brick brick, Instant scheduleFrom) {
    return of(brick, true, scheduleFrom);
  }

  private static BrickView of(Brick brick, boolean withHistory, Instant scheduleFrom) {
    List<ScheduleSegmentView> schedule = null;
    if (scheduleFrom != null) {
      Periodicity periodicity = brick.parsedPeriodicity();
      if (periodicity.isScheduled()) {
        schedule =
            periodicity.materialize(scheduleFrom, Periodicity.DISPLAY_SPAN).stream()
                .map(ScheduleSegmentView::from)
                .collect(Collectors.toList());
      }
    }
    return new BrickView(
        brick.getId(),
        brick.getName(),
        brick.getSlug(),
        brick.getDescription(),
        brick.getPeriodicity(),
        List.copyOf(brick.getEmails()),
        brick.isPaused(),
        brick.isLate(),
        brick.getDeadline(),
        brick.getResumeAt(),
        brick.getCreatedAt(),
        brick.lastEventAt(),
        withHistory ? List.copyOf(brick.getHistory()) : null,
        schedule);
  }
}
