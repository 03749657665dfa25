package com.example.itop_notification.api;

import com.example.itop_notification.model.JobRunSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobRunResponse(
    String job, int processed, int skipped, int failed, int notificationsSent, long durationMs) {

  static JobRunResponse from(JobRunSummary summary) {
    return new JobRunResponse(
        summary.job().value(),
        summary.processed(),
        summary.skipped(),
        summary.failed(),
        summary.notificationsSent(),
        summary.duration().toMillis());
  }
}
