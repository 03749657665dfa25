/*
 * どこで: iTop 通知ジョブ
 * 何を: エージェント向けの検出手順(割当→チーム未割当→SLA 警告→SLA 違反→優先度→コメント)を実行する
 * なぜ: 上限に達したとき優先度の高い通知が残るよう、手順の順序を固定するため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.model.ChangeRecord;
import com.example.itop_notification.model.DeadlineKind;
import com.example.itop_notification.model.DeadlineScope;
import com.example.itop_notification.model.DeadlineWarning;
import com.example.itop_notification.model.JobKind;
import com.example.itop_notification.model.NotificationTarget;
import com.example.itop_notification.model.NotificationType;
import com.example.itop_notification.model.Team;
import com.example.itop_notification.model.TeamAssignment;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AgentTicketJob extends TicketNotificationJob {

  private static final Logger logger = LoggerFactory.getLogger(AgentTicketJob.class);

  static final String ATTR_AGENT = "agent_id";
  static final String ATTR_TTO_PASSED = "sla_tto_passed";
  static final String ATTR_TTR_PASSED = "sla_ttr_passed";
  static final String ATTR_PRIORITY = "priority";
  static final String LOG_PUBLIC = "public_log";
  static final String LOG_PRIVATE = "private_log";

  private static final Set<NotificationType> TICKET_BASED =
      EnumSet.of(
          NotificationType.TICKET_ASSIGNED,
          NotificationType.TICKET_REASSIGNED,
          NotificationType.TICKET_SLA_BREACH,
          NotificationType.TICKET_PRIORITY_CRITICAL,
          NotificationType.TICKET_COMMENT);

  public AgentTicketJob(JobServices services) {
    super(services, JobKind.AGENT);
  }

  @Override
  protected void detect(
      NotificationTarget target,
      Set<NotificationType> enabled,
      Instant since,
      Instant now,
      NotificationBudget budget) {
    final List<String> ticketIds =
        enabled.stream().anyMatch(TICKET_BASED::contains)
            ? services.queryService().agentTicketIds(target.userId(), target.personId())
            : List.of();
    logger.debug(
        "agent notification check userId={} since={} enabled={} tickets={}",
        target.userId(),
        since,
        enabled,
        ticketIds.size());

    if (enabled.contains(NotificationType.TICKET_ASSIGNED)
        || enabled.contains(NotificationType.TICKET_REASSIGNED)) {
      detectAssignments(target, enabled, ticketIds, since, budget);
    }
    if (enabled.contains(NotificationType.TEAM_UNASSIGNED_NEW) && !budget.isExhausted()) {
      detectTeamUnassigned(target, since, budget);
    }
    if ((enabled.contains(NotificationType.TICKET_TTO_WARNING)
            || enabled.contains(NotificationType.TICKET_TTR_WARNING))
        && !budget.isExhausted()) {
      detectDeadlineWarnings(target, enabled, since, now, budget);
    }
    if (enabled.contains(NotificationType.TICKET_SLA_BREACH) && !budget.isExhausted()) {
      detectSlaBreaches(target, ticketIds, since, budget);
    }
    if (enabled.contains(NotificationType.TICKET_PRIORITY_CRITICAL) && !budget.isExhausted()) {
      detectPriorityCritical(target, ticketIds, since, budget);
    }
    if (enabled.contains(NotificationType.TICKET_COMMENT) && !budget.isExhausted()) {
      detectComments(target, ticketIds, since, budget);
    }
  }

  private void detectAssignments(
      NotificationTarget target,
      Set<NotificationType> enabled,
      List<String> ticketIds,
      Instant since,
      NotificationBudget budget) {
    for (ChangeRecord change :
        services
            .changeDetector()
            .getChanges(target.userId(), ticketIds, since, List.of(ATTR_AGENT))) {
      if (budget.isExhausted()) {
        return;
      }
      if (!target.personId().equals(change.newValue())) {
        continue;
      }
      if (ItopObjects.isEmptyReference(change.oldValue())) {
        if (enabled.contains(NotificationType.TICKET_ASSIGNED)) {
          services
              .dispatcher()
              .dispatchChange(
                  target, NotificationType.TICKET_ASSIGNED, change, ticketParams(change), budget);
        }
      } else if (enabled.contains(NotificationType.TICKET_REASSIGNED)) {
        final Map<String, String> params = ticketParams(change);
        params.put("old_agent_id", change.oldValue());
        services
            .dispatcher()
            .dispatchChange(target, NotificationType.TICKET_REASSIGNED, change, params, budget);
      }
    }
  }

  private void detectTeamUnassigned(
      NotificationTarget target, Instant since, NotificationBudget budget) {
    final Map<String, String> teamNames =
        services.queryService().userTeams(target.userId(), target.personId()).stream()
            .collect(
                Collectors.toMap(
                    Team::id, Team::friendlyName, (first, second) -> first, LinkedHashMap::new));
    if (teamNames.isEmpty()) {
      return;
    }
    for (TeamAssignment assignment :
        services
            .changeDetector()
            .getTeamAssignmentChanges(target.userId(), teamNames.keySet(), since)) {
      if (budget.isExhausted()) {
        return;
      }
      final Map<String, String> params = new LinkedHashMap<>();
      params.put("ticket_id", assignment.ticketId());
      params.put("ticket_class", assignment.ticketClass());
      params.put("team_id", assignment.teamId());
      params.put(
          "team_name",
          teamNames.getOrDefault(assignment.teamId(), "Team #" + assignment.teamId()));
      params.put("timestamp", assignment.timestamp());
      services.dispatcher().dispatch(target, NotificationType.TEAM_UNASSIGNED_NEW, params, budget);
    }
  }

  private void detectDeadlineWarnings(
      NotificationTarget target,
      Set<NotificationType> enabled,
      Instant since,
      Instant now,
      NotificationBudget budget) {
    // TTO は未割当のチームチケット、TTR は自分のチケットが対象
    if (enabled.contains(NotificationType.TICKET_TTO_WARNING)) {
      warnDeadlines(target, DeadlineKind.TTO, DeadlineScope.TEAM_UNASSIGNED, since, now, budget);
    }
    if (enabled.contains(NotificationType.TICKET_TTR_WARNING) && !budget.isExhausted()) {
      warnDeadlines(target, DeadlineKind.TTR, DeadlineScope.MINE, since, now, budget);
    }
  }

  private void warnDeadlines(
      NotificationTarget target,
      DeadlineKind kind,
      DeadlineScope scope,
      Instant since,
      Instant now,
      NotificationBudget budget) {
    final List<DeadlineWarning> warnings =
        services
            .changeDetector()
            .getTicketsApproachingDeadline(
                target.userId(), target.personId(), kind, scope, since, now);
    for (DeadlineWarning warning : warnings) {
      if (budget.isExhausted()) {
        return;
      }
      final Map<String, String> params = new LinkedHashMap<>();
      params.put("ticket_id", warning.ticketId());
      params.put("ticket_class", warning.ticketClass());
      params.put("level", warning.levelLabel());
      params.put("deadline", warning.deadline());
      // 通過時刻を使うと同じ閾値通過から常に同じキーになる
      params.put(
          "timestamp",
          services.dispatcher().formatTimestamp(warning.deadlineAt().minus(warning.level())));
      if (services.dispatcher().dispatch(target, kind.warningType(), params, budget)) {
        services.changeDetector().recordSignaled(target.userId(), kind, warning);
      }
    }
  }

  private void detectSlaBreaches(
      NotificationTarget target, List<String> ticketIds, Instant since, NotificationBudget budget) {
    for (ChangeRecord change :
        services
            .changeDetector()
            .getChanges(
                target.userId(), ticketIds, since, List.of(ATTR_TTO_PASSED, ATTR_TTR_PASSED))) {
      if (budget.isExhausted()) {
        return;
      }
      if (!"1".equals(change.newValue())) {
        continue;
      }
      final Map<String, String> params = ticketParams(change);
      params.put("sla_type", ATTR_TTO_PASSED.equals(change.attributeCode()) ? "TTO" : "TTR");
      services
          .dispatcher()
          .dispatchChange(target, NotificationType.TICKET_SLA_BREACH, change, params, budget);
    }
  }

  private void detectPriorityCritical(
      NotificationTarget target, List<String> ticketIds, Instant since, NotificationBudget budget) {
    final String critical = services.properties().criticalPriority();
    for (ChangeRecord change :
        services
            .changeDetector()
            .getChanges(target.userId(), ticketIds, since, List.of(ATTR_PRIORITY))) {
      if (budget.isExhausted()) {
        return;
      }
      if (!critical.equals(change.newValue()) || critical.equals(change.oldValue())) {
        continue;
      }
      final Map<String, String> params = ticketParams(change);
      params.put("old_priority", change.oldValue());
      services
          .dispatcher()
          .dispatchChange(
              target, NotificationType.TICKET_PRIORITY_CRITICAL, change, params, budget);
    }
  }

  private void detectComments(
      NotificationTarget target, List<String> ticketIds, Instant since, NotificationBudget budget) {
    for (ChangeRecord change :
        services
            .changeDetector()
            .getCaseLogChanges(
                target.userId(), ticketIds, since, List.of(LOG_PUBLIC, LOG_PRIVATE))) {
      if (budget.isExhausted()) {
        return;
      }
      if (change.isSystemGenerated()) {
        continue;
      }
      final Map<String, String> params = ticketParams(change);
      params.put("commenter_name", change.userInfo());
      params.put("log_type", LOG_PRIVATE.equals(change.attributeCode()) ? "private" : "public");
      services
          .dispatcher()
          .dispatchChange(target, NotificationType.TICKET_COMMENT, change, params, budget);
    }
  }
}
