package com.example.itop_notification.model;

import java.time.Duration;
import java.time.Instant;

public record DeadlineWarning(
    String ticketId, String ticketClass, Duration level, String deadline, Instant deadlineAt) {

  public String levelLabel() {
    final long hours = level.toHours();
    if (hours > 0 && level.equals(Duration.ofHours(hours))) {
      return hours + "h";
    }
    return level.toMinutes() + "m";
  }
}
