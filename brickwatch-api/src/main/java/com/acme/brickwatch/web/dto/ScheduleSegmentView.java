package com.acme.brickwatch.web.dto;

import com.acme.brickwatch.schedule.ScheduleSegment;
import java.time.Instant;

/** A schedule segment; {@code periodicitySeconds} is null for a gap. */
public record ScheduleSegmentView(Instant start, Instant end, Long periodicitySeconds) {

  public static ScheduleSegmentView from(ScheduleSegment segment) {
    return new ScheduleSegmentView(
        segment.start(),
        segment.end(),
        segment.isGap() ? null : segment.periodicity().getSeconds());
  }
}
