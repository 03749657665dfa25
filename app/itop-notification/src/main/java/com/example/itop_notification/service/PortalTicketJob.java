/*
 * どこで: iTop 通知ジョブ
 * 何を: ポータル利用者向けの検出手順(状態変更/担当者変更→エージェント回答)を実行する
 * なぜ: 起票者が自分のチケットの進展を通知で受け取れるようにするため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.model.ChangeRecord;
import com.example.itop_notification.model.JobKind;
import com.example.itop_notification.model.NotificationTarget;
import com.example.itop_notification.model.NotificationType;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PortalTicketJob extends TicketNotificationJob {

  private static final Logger logger = LoggerFactory.getLogger(PortalTicketJob.class);

  static final String ATTR_STATUS = "status";
  static final String ATTR_AGENT = "agent_id";
  static final String STATUS_RESOLVED = "resolved";
  static final String UNASSIGNED = "Unassigned";

  public PortalTicketJob(JobServices services) {
    super(services, JobKind.PORTAL);
  }

  @Override
  protected void detect(
      NotificationTarget target,
      Set<NotificationType> enabled,
      Instant since,
      Instant now,
      NotificationBudget budget) {
    final List<String> ticketIds =
        services.queryService().callerTicketIds(target.userId(), target.personId());
    logger.debug(
        "portal notification check userId={} since={} enabled={} tickets={}",
        target.userId(),
        since,
        enabled,
        ticketIds.size());
    if (ticketIds.isEmpty()) {
      return;
    }
    if (enabled.contains(NotificationType.TICKET_STATUS_CHANGED)
        || enabled.contains(NotificationType.TICKET_RESOLVED)
        || enabled.contains(NotificationType.AGENT_ASSIGNED)) {
      detectStatusAndAgentChanges(target, enabled, ticketIds, since, budget);
    }
    if (enabled.contains(NotificationType.AGENT_RESPONDED) && !budget.isExhausted()) {
      detectAgentResponses(target, ticketIds, since, budget);
    }
  }

  private void detectStatusAndAgentChanges(
      NotificationTarget target,
      Set<NotificationType> enabled,
      List<String> ticketIds,
      Instant since,
      NotificationBudget budget) {
    final List<ChangeRecord> changes =
        services
            .changeDetector()
            .getChanges(target.userId(), ticketIds, since, List.of(ATTR_STATUS, ATTR_AGENT));
    final Map<String, String> agentNames =
        enabled.contains(NotificationType.AGENT_ASSIGNED) ? resolveAgentNames(changes) : Map.of();
    for (ChangeRecord change : changes) {
      if (budget.isExhausted()) {
        return;
      }
      if (change.isNoOp()) {
        continue;
      }
      if (ATTR_AGENT.equals(change.attributeCode())) {
        if (enabled.contains(NotificationType.AGENT_ASSIGNED)) {
          final Map<String, String> params = ticketParams(change);
          params.put("old_agent", agentLabel(change.oldValue(), agentNames));
          params.put("new_agent", agentLabel(change.newValue(), agentNames));
          services
              .dispatcher()
              .dispatchChange(target, NotificationType.AGENT_ASSIGNED, change, params, budget);
        }
        continue;
      }
      // resolved への遷移は汎用の状態変更とは別の通知にする
      final NotificationType type;
      if (STATUS_RESOLVED.equals(change.newValue())) {
        if (!enabled.contains(NotificationType.TICKET_RESOLVED)) {
          continue;
        }
        type = NotificationType.TICKET_RESOLVED;
      } else if (enabled.contains(NotificationType.TICKET_STATUS_CHANGED)) {
        type = NotificationType.TICKET_STATUS_CHANGED;
      } else {
        continue;
      }
      final Map<String, String> params = ticketParams(change);
      params.put("old_status", change.oldValue());
      params.put("new_status", change.newValue());
      services.dispatcher().dispatchChange(target, type, change, params, budget);
    }
  }

  private void detectAgentResponses(
      NotificationTarget target, List<String> ticketIds, Instant since, NotificationBudget budget) {
    // ポータル利用者には private_log を見せない
    for (ChangeRecord change :
        services
            .changeDetector()
            .getCaseLogChanges(target.userId(), ticketIds, since, List.of("public_log"))) {
      if (budget.isExhausted()) {
        return;
      }
      if (change.isSystemGenerated()) {
        continue;
      }
      final Map<String, String> params = ticketParams(change);
      params.put("agent_name", change.userInfo());
      services
          .dispatcher()
          .dispatchChange(target, NotificationType.AGENT_RESPONDED, change, params, budget);
    }
  }

  private Map<String, String> resolveAgentNames(List<ChangeRecord> changes) {
    final Set<String> agentIds = new LinkedHashSet<>();
    for (ChangeRecord change : changes) {
      if (!ATTR_AGENT.equals(change.attributeCode()) || change.isNoOp()) {
        continue;
      }
      if (!ItopObjects.isEmptyReference(change.oldValue())) {
        agentIds.add(change.oldValue());
      }
      if (!ItopObjects.isEmptyReference(change.newValue())) {
        agentIds.add(change.newValue());
      }
    }
    return agentIds.isEmpty() ? Map.of() : services.queryService().personNames(agentIds);
  }

  static String agentLabel(String agentId, Map<String, String> agentNames) {
    if (ItopObjects.isEmptyReference(agentId)) {
      return UNASSIGNED;
    }
    return agentNames.getOrDefault(agentId, agentId);
  }
}
