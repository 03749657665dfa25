/*
 * どこで: iTop 通知ドメインモデル
 * 何を: 通知サブジェクト種別と管理者ポリシーの既定値を定義する
 * なぜ: ジョブ/ポリシー/シンクで同じ文字列を共有するため
 */
package com.example.itop_notification.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum NotificationType {
  TICKET_STATUS_CHANGED("ticket_status_changed", JobKind.PORTAL, PolicyState.USER_CHOICE),
  AGENT_RESPONDED("agent_responded", JobKind.PORTAL, PolicyState.USER_CHOICE),
  TICKET_RESOLVED("ticket_resolved", JobKind.PORTAL, PolicyState.USER_CHOICE),
  AGENT_ASSIGNED("agent_assigned", JobKind.PORTAL, PolicyState.USER_CHOICE),

  TICKET_ASSIGNED("ticket_assigned", JobKind.AGENT, PolicyState.USER_CHOICE),
  TICKET_REASSIGNED("ticket_reassigned", JobKind.AGENT, PolicyState.USER_CHOICE),
  TEAM_UNASSIGNED_NEW("team_unassigned_new", JobKind.AGENT, PolicyState.DISABLED),
  TICKET_TTO_WARNING("ticket_tto_warning", JobKind.AGENT, PolicyState.USER_CHOICE),
  TICKET_TTR_WARNING("ticket_ttr_warning", JobKind.AGENT, PolicyState.USER_CHOICE),
  TICKET_SLA_BREACH("ticket_sla_breach", JobKind.AGENT, PolicyState.FORCED),
  TICKET_PRIORITY_CRITICAL("ticket_priority_critical", JobKind.AGENT, PolicyState.FORCED),
  TICKET_COMMENT("ticket_comment", JobKind.AGENT, PolicyState.USER_CHOICE);

  private final String subject;
  private final JobKind audience;
  private final PolicyState defaultState;

  NotificationType(String subject, JobKind audience, PolicyState defaultState) {
    this.subject = subject;
    this.audience = audience;
    this.defaultState = defaultState;
  }

  public String subject() {
    return subject;
  }

  public JobKind audience() {
    return audience;
  }

  public PolicyState defaultState() {
    return defaultState;
  }

  public static List<NotificationType> forAudience(JobKind audience) {
    return Arrays.stream(values()).filter(type -> type.audience == audience).toList();
  }

  public static Optional<NotificationType> fromSubject(String subject) {
    return Arrays.stream(values()).filter(type -> type.subject.equals(subject)).findFirst();
  }
}
