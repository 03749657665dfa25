package com.example.itop_notification.model;

/** SLA deadline tracked by iTop: Time-To-Own or Time-To-Resolve. */
public enum DeadlineKind {
  TTO("tto_escalation_deadline", NotificationType.TICKET_TTO_WARNING),
  TTR("ttr_escalation_deadline", NotificationType.TICKET_TTR_WARNING);

  private final String deadlineField;
  private final NotificationType warningType;

  DeadlineKind(String deadlineField, NotificationType warningType) {
    this.deadlineField = deadlineField;
    this.warningType = warningType;
  }

  public String deadlineField() {
    return deadlineField;
  }

  public NotificationType warningType() {
    return warningType;
  }
}
