package com.example.itop_notification.model;

import java.time.Duration;
import java.time.Instant;

/** Last escalation level signaled to one user for one ticket deadline. */
public record SlaWarningMark(
    String userId, String ticketId, DeadlineKind kind, Instant deadlineAt, Duration level) {

  public boolean coversDeadline(Instant deadline) {
    return deadlineAt.equals(deadline);
  }

  /** A level is only worth signaling again when it is strictly tighter than the recorded one. */
  public boolean isTighter(Duration candidate) {
    return candidate.compareTo(level) < 0;
  }
}
