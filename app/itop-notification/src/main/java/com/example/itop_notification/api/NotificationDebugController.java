/*
 * どこで: iTop 通知デバッグ API
 * 何を: 利用者の状態確認/ウォーターマーク初期化/ジョブ手動実行/通知一覧/キャッシュ消去を提供する
 * なぜ: 無人で動くジョブの挙動を運用者が確認・再実行できるようにするため
 */
package com.example.itop_notification.api;

import com.example.itop_notification.model.JobKind;
import com.example.itop_notification.model.NotificationType;
import com.example.itop_notification.model.SchedulingDecision;
import com.example.itop_notification.model.StoredNotification;
import com.example.itop_notification.repository.NotificationRepository;
import com.example.itop_notification.repository.NotificationSettingsRepository;
import com.example.itop_notification.repository.WatermarkRepository;
import com.example.itop_notification.service.AgentTicketJob;
import com.example.itop_notification.service.NotificationPolicyResolver;
import com.example.itop_notification.service.PortalTicketJob;
import com.example.itop_notification.service.TtlCache;
import com.example.itop_notification.service.UserScheduler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/notification")
@RequiredArgsConstructor
public class NotificationDebugController {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDebugController.class);

  private final NotificationSettingsRepository settingsRepository;
  private final WatermarkRepository watermarkRepository;
  private final NotificationRepository notificationRepository;
  private final UserScheduler userScheduler;
  private final NotificationPolicyResolver policyResolver;
  private final AgentTicketJob agentTicketJob;
  private final PortalTicketJob portalTicketJob;
  private final TtlCache cache;
  private final ObjectMapper objectMapper;

  @GetMapping("/users/{userId}/status")
  public UserNotificationStatusResponse status(@PathVariable("userId") String userId) {
    final int defaultMinutes = settingsRepository.findDefaultIntervalMinutes();
    final Duration adminDefault = Duration.ofMinutes(defaultMinutes);
    final Map<String, UserNotificationStatusResponse.JobStatus> jobs = new LinkedHashMap<>();
    for (JobKind kind : JobKind.values()) {
      final SchedulingDecision decision = userScheduler.evaluate(userId, kind, adminDefault);
      final List<String> enabledTypes =
          policyResolver
              .enabledTypes(
                  kind,
                  settingsRepository.findAdminPolicies(kind),
                  settingsRepository.findOptOut(userId, kind))
              .stream()
              .map(NotificationType::subject)
              .toList();
      jobs.put(
          kind.value(),
          new UserNotificationStatusResponse.JobStatus(
              watermarkRepository.find(userId, kind).orElse(null),
              decision.outcome().name(),
              decision.nextEligibleAt(),
              enabledTypes));
    }
    return new UserNotificationStatusResponse(
        userId,
        settingsRepository.isNotificationEnabled(userId),
        settingsRepository.findPersonId(userId).orElse(null),
        settingsRepository.findItopUserId(userId).orElse(null),
        settingsRepository.findCheckIntervalMinutes(userId).orElse(null),
        defaultMinutes,
        jobs);
  }

  /** 次回実行を初回扱いにする。job 省略時は両ジョブを対象にする。 */
  @DeleteMapping("/users/{userId}/watermarks")
  public ResponseEntity<Void> resetWatermarks(
      @PathVariable("userId") String userId,
      @RequestParam(name = "job", required = false) String job) {
    final List<JobKind> kinds =
        job == null || job.isBlank() ? List.of(JobKind.values()) : List.of(JobKind.fromValue(job));
    for (JobKind kind : kinds) {
      watermarkRepository.delete(userId, kind);
    }
    logger.info("notification watermarks reset userId={} jobs={}", userId, kinds);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/jobs/{job}/run")
  public JobRunResponse run(@PathVariable("job") String job) {
    final JobKind kind = JobKind.fromValue(job);
    return JobRunResponse.from(
        kind == JobKind.AGENT ? agentTicketJob.run() : portalTicketJob.run());
  }

  @GetMapping("/inbox/{userId}")
  public NotificationInboxResponse inbox(@PathVariable("userId") String userId) {
    final List<NotificationSummary> items =
        notificationRepository.findByUserId(userId).stream().map(this::toSummary).toList();
    return new NotificationInboxResponse(userId, items);
  }

  @DeleteMapping("/cache")
  public Map<String, Long> clearCache() {
    return Map.of("removed", cache.clear());
  }

  private NotificationSummary toSummary(StoredNotification notification) {
    try {
      final JsonNode params = objectMapper.readTree(notification.paramsJson());
      return new NotificationSummary(
          notification.notificationId(),
          notification.subject(),
          notification.objectType(),
          notification.objectKey(),
          notification.occurredAt(),
          notification.createdAt(),
          params);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification params parse failure", ex);
    }
  }
}
