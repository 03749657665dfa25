/*
 * どこで: iTop 通知サービス層
 * 何を: 利用者ごとに今回のジョブで処理すべきかを判定する
 * なぜ: 安い判定から順に短絡し、利用者ごとの間隔設定を守るため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.model.JobKind;
import com.example.itop_notification.model.SchedulingDecision;
import com.example.itop_notification.model.SchedulingDecision.Outcome;
import com.example.itop_notification.repository.NotificationSettingsRepository;
import com.example.itop_notification.repository.WatermarkRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserScheduler {

  private static final Logger logger = LoggerFactory.getLogger(UserScheduler.class);

  private final NotificationSettingsRepository settingsRepository;
  private final WatermarkRepository watermarkRepository;
  private final ProfileService profileService;
  private final Clock clock;

  public boolean shouldProcess(String userId, JobKind job, Duration adminDefaultInterval) {
    return evaluate(userId, job, adminDefaultInterval).eligible();
  }

  /** Next instant the user becomes eligible, or empty while a non-time gate keeps them out. */
  public Optional<Instant> nextEligibleAt(
      String userId, JobKind job, Duration adminDefaultInterval) {
    final SchedulingDecision decision = evaluate(userId, job, adminDefaultInterval);
    return Optional.ofNullable(decision.nextEligibleAt());
  }

  public SchedulingDecision evaluate(String userId, JobKind job, Duration adminDefaultInterval) {
    if (!settingsRepository.isNotificationEnabled(userId)) {
      return SchedulingDecision.closed(Outcome.NOTIFICATIONS_DISABLED);
    }
    if (settingsRepository.findPersonId(userId).isEmpty()) {
      return SchedulingDecision.closed(Outcome.NOT_CONFIGURED);
    }
    if (job == JobKind.AGENT) {
      if (settingsRepository.findOptOut(userId, JobKind.AGENT).all()) {
        return SchedulingDecision.closed(Outcome.AGENT_OPTED_OUT);
      }
      try {
        if (profileService.isPortalOnly(userId)) {
          return SchedulingDecision.closed(Outcome.PORTAL_ONLY);
        }
      } catch (RuntimeException ex) {
        logger.warn("profile lookup failed; skipping user this run userId={}", userId, ex);
        return SchedulingDecision.closed(Outcome.PROFILE_UNAVAILABLE);
      }
    }
    final Duration interval = effectiveInterval(userId, adminDefaultInterval);
    final Instant now = Instant.now(clock);
    final Optional<Instant> watermark = watermarkRepository.find(userId, job);
    if (watermark.isEmpty()) {
      return new SchedulingDecision(Outcome.ELIGIBLE, now);
    }
    final Instant next = watermark.get().plus(interval);
    if (now.isBefore(next)) {
      return new SchedulingDecision(Outcome.INTERVAL_NOT_ELAPSED, next);
    }
    return new SchedulingDecision(Outcome.ELIGIBLE, next);
  }

  @VisibleForTesting
  Duration effectiveInterval(String userId, Duration adminDefaultInterval) {
    return settingsRepository
        .findCheckIntervalMinutes(userId)
        .map(minutes -> Duration.ofMinutes(minutes))
        .orElse(adminDefaultInterval);
  }
}
