/*
 * どこで: iTop 通知サービス層
 * 何を: ウォーターマーク以降の属性変更/ケースログ/チーム割当/SLA 閾値通過を検出する
 * なぜ: ジョブが iTop の変更ログから差分だけを取り出して通知へ変換できるようにするため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.config.ItopNotificationProperties;
import com.example.itop_notification.model.ChangeRecord;
import com.example.itop_notification.model.DeadlineKind;
import com.example.itop_notification.model.DeadlineScope;
import com.example.itop_notification.model.DeadlineWarning;
import com.example.itop_notification.model.SlaWarningMark;
import com.example.itop_notification.model.Team;
import com.example.itop_notification.model.TeamAssignment;
import com.example.itop_notification.repository.SlaWarningRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ChangeDetector {

  private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

  private final ItopQueryService queryService;
  private final ItopTimestamps timestamps;
  private final SlaWarningRepository slaWarningRepository;
  private final ItopNotificationProperties properties;

  /**
   * スカラー属性の変更記録を返す。
   *
   * <p>attcode は許可リストで厳密に絞り込む。old == new の記録もそのまま返すため、除外は呼び出し側で行う。
   */
  public List<ChangeRecord> getChanges(
      String userId,
      Collection<String> objectIds,
      Instant since,
      Collection<String> attributeCodes) {
    if (objectIds.isEmpty() || attributeCodes.isEmpty()) {
      return List.of();
    }
    final Set<String> allowed = Set.copyOf(attributeCodes);
    final List<ChangeRecord> changes = new ArrayList<>();
    for (JsonNode row :
        queryService.changeOps(
            ItopQueryService.SCALAR_CHANGE_CLASS, objectIds, allowed, timestamps.format(since))) {
      final String attributeCode = ItopObjects.text(row, "attcode");
      if (!allowed.contains(attributeCode)) {
        continue;
      }
      changes.add(
          new ChangeRecord(
              ItopObjects.text(row, "objkey"),
              ItopObjects.text(row, "objclass"),
              attributeCode,
              ItopObjects.text(row, "oldvalue"),
              ItopObjects.text(row, "newvalue"),
              ItopObjects.text(row, "date"),
              ItopObjects.text(row, "userinfo"),
              ItopObjects.text(row, "user_id")));
    }
    logger.debug(
        "scalar changes detected userId={} objects={} attributes={} found={}",
        userId,
        objectIds.size(),
        allowed,
        changes.size());
    return changes;
  }

  /** ケースログ(public_log/private_log)への追記を返す。newValue は追記された本文。 */
  public List<ChangeRecord> getCaseLogChanges(
      String userId,
      Collection<String> objectIds,
      Instant since,
      Collection<String> logAttributes) {
    if (objectIds.isEmpty() || logAttributes.isEmpty()) {
      return List.of();
    }
    final Set<String> allowed = Set.copyOf(logAttributes);
    final List<ChangeRecord> changes = new ArrayList<>();
    for (JsonNode row :
        queryService.changeOps(
            ItopQueryService.CASE_LOG_CHANGE_CLASS, objectIds, allowed, timestamps.format(since))) {
      final String attributeCode = ItopObjects.text(row, "attcode");
      if (!allowed.contains(attributeCode)) {
        continue;
      }
      final String entry = ItopObjects.text(row, "lastentry");
      changes.add(
          new ChangeRecord(
              ItopObjects.text(row, "objkey"),
              ItopObjects.text(row, "objclass"),
              attributeCode,
              null,
              entry == null ? "" : entry,
              ItopObjects.text(row, "date"),
              ItopObjects.text(row, "userinfo"),
              ItopObjects.text(row, "user_id")));
    }
    logger.debug(
        "case log changes detected userId={} objects={} found={}",
        userId,
        objectIds.size(),
        changes.size());
    return changes;
  }

  /**
   * チームに入ったまま担当者がいないチケットを返す。
   *
   * <p>対象期間内に作成されたもの、または team_id がいずれかのチームへ変わったものを、チケット単位で 1 件にまとめる。
   */
  public List<TeamAssignment> getTeamAssignmentChanges(
      String userId, Collection<String> teamIds, Instant since) {
    if (teamIds.isEmpty()) {
      return List.of();
    }
    final List<JsonNode> tickets = queryService.unassignedTeamTickets(teamIds);
    if (tickets.isEmpty()) {
      return List.of();
    }
    final Map<String, JsonNode> byId = new LinkedHashMap<>();
    for (JsonNode ticket : tickets) {
      final String id = ItopObjects.text(ticket, "id");
      if (!ItopObjects.isEmptyReference(id)) {
        byId.putIfAbsent(id, ticket);
      }
    }
    final Map<String, TeamAssignment> result = new LinkedHashMap<>();
    for (JsonNode ticket : byId.values()) {
      final String startDate = ItopObjects.text(ticket, "start_date");
      final Optional<Instant> createdAt = timestamps.tryParse(startDate);
      if (createdAt.isPresent() && createdAt.get().isAfter(since)) {
        final String id = ItopObjects.text(ticket, "id");
        result.put(
            id,
            new TeamAssignment(
                id,
                ItopObjects.text(ticket, "finalclass"),
                ItopObjects.text(ticket, "team_id"),
                startDate));
      }
    }
    final Set<String> teams = Set.copyOf(teamIds);
    for (ChangeRecord change : getChanges(userId, byId.keySet(), since, List.of("team_id"))) {
      if (change.isNoOp() || !teams.contains(change.newValue())) {
        continue;
      }
      final JsonNode ticket = byId.get(change.objectKey());
      // 変更後に別チームへ移ったチケットは対象外
      if (ticket == null || !change.newValue().equals(ItopObjects.text(ticket, "team_id"))) {
        continue;
      }
      result.putIfAbsent(
          change.objectKey(),
          new TeamAssignment(
              change.objectKey(), change.objectClass(), change.newValue(), change.date()));
    }
    return List.copyOf(result.values());
  }

  /**
   * SLA 期限の閾値を (since, now] の間に新たに跨いだチケットを返す。
   *
   * <p>閾値 L の通過時刻は deadline - L。期間内に通過した最も狭い閾値を報告し、同じ期限に対して既に同じか
   * より狭いレベルを通知済みなら報告しない。期限切れ(deadline <= now)は警告ではなく違反として扱うため除外する。
   * 通知後は {@link #recordSignaled} でレベルを記録すること。
   */
  public List<DeadlineWarning> getTicketsApproachingDeadline(
      String userId,
      String personId,
      DeadlineKind kind,
      DeadlineScope scope,
      Instant since,
      Instant now) {
    final List<JsonNode> candidates;
    if (scope == DeadlineScope.TEAM_UNASSIGNED) {
      final List<String> teamIds =
          queryService.userTeams(userId, personId).stream().map(Team::id).toList();
      if (teamIds.isEmpty()) {
        return List.of();
      }
      candidates = queryService.deadlineCandidates(kind, teamIds, null);
    } else {
      candidates = queryService.deadlineCandidates(kind, null, personId);
    }
    final List<DeadlineWarning> warnings = new ArrayList<>();
    for (JsonNode ticket : candidates) {
      final String rawDeadline = ItopObjects.text(ticket, kind.deadlineField());
      final Optional<Instant> deadline = timestamps.tryParse(rawDeadline);
      if (deadline.isEmpty() || !deadline.get().isAfter(now)) {
        continue;
      }
      final Optional<Duration> level = tightestCrossedLevel(deadline.get(), since, now);
      if (level.isEmpty()) {
        continue;
      }
      final String ticketId = ItopObjects.text(ticket, "id");
      final Optional<SlaWarningMark> mark = slaWarningRepository.find(userId, ticketId, kind);
      if (mark.isPresent()
          && mark.get().coversDeadline(deadline.get())
          && !mark.get().isTighter(level.get())) {
        continue;
      }
      warnings.add(
          new DeadlineWarning(
              ticketId,
              ItopObjects.text(ticket, "finalclass"),
              level.get(),
              rawDeadline,
              deadline.get()));
    }
    logger.debug(
        "deadline warnings detected userId={} kind={} scope={} candidates={} found={}",
        userId,
        kind,
        scope,
        candidates.size(),
        warnings.size());
    return warnings;
  }

  public void recordSignaled(String userId, DeadlineKind kind, DeadlineWarning warning) {
    slaWarningRepository.save(
        new SlaWarningMark(
            userId, warning.ticketId(), kind, warning.deadlineAt(), warning.level()));
  }

  @VisibleForTesting
  Optional<Duration> tightestCrossedLevel(Instant deadline, Instant since, Instant now) {
    Duration tightest = null;
    // 閾値は広い順に並んでいるため、最後に一致したものが最も狭い
    for (Duration threshold : properties.slaWarningThresholds()) {
      final Instant crossing = deadline.minus(threshold);
      if (crossing.isAfter(since) && !crossing.isAfter(now)) {
        tightest = threshold;
      }
    }
    return Optional.ofNullable(tightest);
  }
}
