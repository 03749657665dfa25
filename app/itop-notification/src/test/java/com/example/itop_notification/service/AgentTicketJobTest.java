/*
 * どこで: iTop 通知ジョブテスト
 * 何を: エージェントジョブの検出手順、上限での打ち切り、利用者単位の失敗隔離、トークン拒否時の中断を検証する
 * なぜ: ウォーターマークの更新条件を誤ると通知の取りこぼしや重複が起きるため
 */
package com.example.itop_notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.itop_notification.config.ItopNotificationProperties;
import com.example.itop_notification.model.ChangeRecord;
import com.example.itop_notification.model.DeadlineKind;
import com.example.itop_notification.model.DeadlineScope;
import com.example.itop_notification.model.DeadlineWarning;
import com.example.itop_notification.model.JobKind;
import com.example.itop_notification.model.JobRunSummary;
import com.example.itop_notification.model.Notification;
import com.example.itop_notification.model.NotificationType;
import com.example.itop_notification.model.PolicyState;
import com.example.itop_notification.model.SchedulingDecision;
import com.example.itop_notification.model.SchedulingDecision.Outcome;
import com.example.itop_notification.model.Team;
import com.example.itop_notification.model.TeamAssignment;
import com.example.itop_notification.model.UserOptOut;
import com.example.itop_notification.repository.NotificationSettingsRepository;
import com.example.itop_notification.repository.WatermarkRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AgentTicketJobTest {

  private static final Instant RUN_START = Instant.parse("2025-11-05T23:00:00Z");
  private static final Instant WATERMARK = Instant.parse("2025-11-05T22:00:00Z");
  private static final String ALICE = "alice";
  private static final String BOB = "bob";
  private static final String PERSON_A = "7";
  private static final String PERSON_B = "3";
  private static final List<String> AGENT_ATTRIBUTES = List.of("agent_id");

  @Mock private ItopClient itopClient;
  @Mock private NotificationSettingsRepository settingsRepository;
  @Mock private WatermarkRepository watermarkRepository;
  @Mock private UserScheduler userScheduler;
  @Mock private ChangeDetector changeDetector;
  @Mock private ItopQueryService queryService;

  private final List<Notification> delivered = new ArrayList<>();

  @Test
  void reassignmentProducesOneNotificationAndAdvancesWatermarkToRunStart() {
    givenEligibleAgent(ALICE, PERSON_A, "12");
    when(queryService.agentTicketIds(ALICE, PERSON_A)).thenReturn(List.of("42"));
    when(changeDetector.getChanges(ALICE, List.of("42"), WATERMARK, AGENT_ATTRIBUTES))
        .thenReturn(List.of(agentChange("42", PERSON_B, PERSON_A, "2025-11-05 22:40:21", "5")));

    final JobRunSummary summary = newJob(20).run();

    assertThat(summary.processed()).isEqualTo(1);
    assertThat(summary.notificationsSent()).isEqualTo(1);
    assertThat(delivered)
        .singleElement()
        .satisfies(
            notification -> {
              assertThat(notification.subject()).isEqualTo("ticket_reassigned");
              assertThat(notification.userId()).isEqualTo(ALICE);
              assertThat(notification.params())
                  .containsEntry("ticket_id", "42")
                  .containsEntry("ticket_class", "UserRequest")
                  .containsEntry("old_agent_id", PERSON_B)
                  .containsEntry("timestamp", "2025-11-05 22:40:21");
            });
    verify(watermarkRepository).save(ALICE, JobKind.AGENT, RUN_START);
  }

  @Test
  void assignmentToSomeoneElseIsIgnored() {
    givenEligibleAgent(ALICE, PERSON_A, "12");
    when(queryService.agentTicketIds(ALICE, PERSON_A)).thenReturn(List.of("42"));
    when(changeDetector.getChanges(ALICE, List.of("42"), WATERMARK, AGENT_ATTRIBUTES))
        .thenReturn(List.of(agentChange("42", PERSON_A, "9", "2025-11-05 22:40:21", "5")));

    final JobRunSummary summary = newJob(20).run();

    assertThat(summary.notificationsSent()).isZero();
    assertThat(delivered).isEmpty();
    verify(watermarkRepository).save(ALICE, JobKind.AGENT, RUN_START);
  }

  @Test
  void capStopsLaterStepsButStillAdvancesWatermark() {
    givenEligibleAgent(ALICE, PERSON_A, "12");
    when(queryService.agentTicketIds(ALICE, PERSON_A)).thenReturn(List.of("41", "42", "43"));
    when(changeDetector.getChanges(ALICE, List.of("41", "42", "43"), WATERMARK, AGENT_ATTRIBUTES))
        .thenReturn(
            List.of(
                agentChange("41", "", PERSON_A, "2025-11-05 22:10:00", "5"),
                agentChange("42", "", PERSON_A, "2025-11-05 22:20:00", "5"),
                agentChange("43", "", PERSON_A, "2025-11-05 22:30:00", "5")));

    final JobRunSummary summary = newJob(2).run();

    assertThat(summary.notificationsSent()).isEqualTo(2);
    assertThat(delivered)
        .extracting(Notification::subject)
        .containsExactly("ticket_assigned", "ticket_assigned");
    verify(changeDetector, never())
        .getTicketsApproachingDeadline(any(), any(), any(), any(), any(), any());
    verify(changeDetector, never()).getCaseLogChanges(any(), any(), any(), any());
    verify(watermarkRepository).save(ALICE, JobKind.AGENT, RUN_START);
  }

  @Test
  void deadlineWarningUsesCrossingInstantAndRecordsLevel() {
    givenEligibleAgent(ALICE, PERSON_A, "12");
    when(queryService.agentTicketIds(ALICE, PERSON_A)).thenReturn(List.of("42"));
    final Instant deadline = Instant.parse("2025-11-06T02:30:00Z");
    final DeadlineWarning warning =
        new DeadlineWarning("42", "Incident", Duration.ofHours(4), "2025-11-06 02:30:00", deadline);
    // TTO の検出が先に呼ばれるため、引数違いの呼び出しを許容する
    lenient()
        .when(
            changeDetector.getTicketsApproachingDeadline(
                ALICE, PERSON_A, DeadlineKind.TTR, DeadlineScope.MINE, WATERMARK, RUN_START))
        .thenReturn(List.of(warning));

    newJob(20).run();

    assertThat(delivered)
        .singleElement()
        .satisfies(
            notification -> {
              assertThat(notification.subject()).isEqualTo("ticket_ttr_warning");
              assertThat(notification.params())
                  .containsEntry("level", "4h")
                  .containsEntry("deadline", "2025-11-06 02:30:00")
                  .containsEntry("timestamp", "2025-11-05 22:30:00");
            });
    verify(changeDetector).recordSignaled(ALICE, DeadlineKind.TTR, warning);
  }

  @Test
  void ownCommentIsSuppressedAndOthersAreDelivered() {
    givenEligibleAgent(ALICE, PERSON_A, "12");
    when(queryService.agentTicketIds(ALICE, PERSON_A)).thenReturn(List.of("42"));
    when(changeDetector.getCaseLogChanges(
            ALICE, List.of("42"), WATERMARK, List.of("public_log", "private_log")))
        .thenReturn(
            List.of(
                comment("private_log", "my note", "2025-11-05 22:50:00", "Alice Agent", "12"),
                comment("public_log", "any update?", "2025-11-05 22:55:00", "Carol Caller", "30"),
                comment("public_log", "auto reply", "2025-11-05 22:56:00", "", "0")));

    newJob(20).run();

    assertThat(delivered)
        .singleElement()
        .satisfies(
            notification -> {
              assertThat(notification.subject()).isEqualTo("ticket_comment");
              assertThat(notification.params())
                  .containsEntry("commenter_name", "Carol Caller")
                  .containsEntry("log_type", "public");
            });
  }

  @Test
  void failureOfOneUserDoesNotStopOthers() {
    when(itopClient.isConfigured()).thenReturn(true);
    when(settingsRepository.findDefaultIntervalMinutes()).thenReturn(60);
    when(settingsRepository.findAllUserIds()).thenReturn(List.of(ALICE, BOB));
    givenUserBinding(ALICE, PERSON_A, "12");
    givenUserBinding(BOB, "8", "13");
    when(queryService.agentTicketIds(ALICE, PERSON_A))
        .thenThrow(
            new ItopIntegrationException(ItopIntegrationException.Reason.TIMEOUT, "timeout"));
    when(queryService.agentTicketIds(BOB, "8")).thenReturn(List.of());

    final JobRunSummary summary = newJob(20).run();

    assertThat(summary.failed()).isEqualTo(1);
    assertThat(summary.processed()).isEqualTo(1);
    verify(watermarkRepository, never()).save(eq(ALICE), any(), any());
    verify(watermarkRepository).save(BOB, JobKind.AGENT, RUN_START);
  }

  @Test
  void rejectedApplicationTokenAbortsRunWithoutTouchingUsers() {
    when(itopClient.isConfigured()).thenReturn(true);
    when(settingsRepository.findDefaultIntervalMinutes()).thenReturn(60);
    when(settingsRepository.findAllUserIds()).thenReturn(List.of(ALICE, BOB, "carol"));
    givenUserBinding(ALICE, PERSON_A, "12");
    givenUserBinding(BOB, "8", "13");
    givenUserBinding("carol", "9", "14");
    when(queryService.agentTicketIds(ALICE, PERSON_A))
        .thenThrow(
            new ItopIntegrationException(ItopIntegrationException.Reason.UNAUTHORIZED, "401"));

    final JobRunSummary summary = newJob(20).run();

    assertThat(summary.failed()).isEqualTo(1);
    assertThat(summary.processed()).isZero();
    verify(queryService, never()).agentTicketIds(eq(BOB), any());
    verify(queryService, never()).agentTicketIds(eq("carol"), any());
    verify(watermarkRepository, never()).save(any(), any(), any());
    verify(watermarkRepository, never()).delete(any(), any());
  }

  @Test
  void slaBreachIsSentOnlyWhenFlagTurnsOn() {
    givenEligibleAgent(ALICE, PERSON_A, "12");
    when(queryService.agentTicketIds(ALICE, PERSON_A)).thenReturn(List.of("42", "43", "44"));
    lenient()
        .when(
            changeDetector.getChanges(
                ALICE,
                List.of("42", "43", "44"),
                WATERMARK,
                List.of("sla_tto_passed", "sla_ttr_passed")))
        .thenReturn(
            List.of(
                flagChange("42", "sla_tto_passed", "0", "1", "2025-11-05 22:10:00"),
                flagChange("43", "sla_ttr_passed", "1", "0", "2025-11-05 22:20:00"),
                flagChange("44", "sla_ttr_passed", "0", "1", "2025-11-05 22:30:00")));

    newJob(20).run();

    assertThat(delivered)
        .extracting(Notification::subject)
        .containsExactly("ticket_sla_breach", "ticket_sla_breach");
    assertThat(delivered.get(0).params())
        .containsEntry("ticket_id", "42")
        .containsEntry("sla_type", "TTO");
    assertThat(delivered.get(1).params())
        .containsEntry("ticket_id", "44")
        .containsEntry("sla_type", "TTR");
  }

  @Test
  void priorityNotificationOnlyWhenTicketBecomesCritical() {
    givenEligibleAgent(ALICE, PERSON_A, "12");
    when(queryService.agentTicketIds(ALICE, PERSON_A)).thenReturn(List.of("42", "43", "44"));
    lenient()
        .when(
            changeDetector.getChanges(
                ALICE, List.of("42", "43", "44"), WATERMARK, List.of("priority")))
        .thenReturn(
            List.of(
                flagChange("42", "priority", "2", "1", "2025-11-05 22:10:00"),
                flagChange("43", "priority", "1", "1", "2025-11-05 22:20:00"),
                flagChange("44", "priority", "1", "2", "2025-11-05 22:30:00")));

    newJob(20).run();

    assertThat(delivered)
        .singleElement()
        .satisfies(
            notification -> {
              assertThat(notification.subject()).isEqualTo("ticket_priority_critical");
              assertThat(notification.params())
                  .containsEntry("ticket_id", "42")
                  .containsEntry("old_priority", "2");
            });
  }

  @Test
  void teamUnassignedUsesTeamNameWithFallbackForUnknownTeam() {
    givenEligibleAgent(ALICE, PERSON_A, "12");
    when(settingsRepository.findAdminPolicies(JobKind.AGENT))
        .thenReturn(Map.of(NotificationType.TEAM_UNASSIGNED_NEW, PolicyState.USER_CHOICE));
    when(queryService.agentTicketIds(ALICE, PERSON_A)).thenReturn(List.of());
    when(queryService.userTeams(ALICE, PERSON_A))
        .thenReturn(List.of(new Team("5", "Service Desk"), new Team("6", "Network")));
    when(changeDetector.getTeamAssignmentChanges(ALICE, Set.of("5", "6"), WATERMARK))
        .thenReturn(
            List.of(
                new TeamAssignment("42", "Incident", "5", "2025-11-05 22:15:00"),
                new TeamAssignment("43", "UserRequest", "7", "2025-11-05 22:25:00")));

    newJob(20).run();

    assertThat(delivered)
        .extracting(Notification::subject)
        .containsExactly("team_unassigned_new", "team_unassigned_new");
    assertThat(delivered.get(0).params())
        .containsEntry("ticket_id", "42")
        .containsEntry("team_id", "5")
        .containsEntry("team_name", "Service Desk");
    assertThat(delivered.get(1).params()).containsEntry("team_name", "Team #7");
  }

  @Test
  void skippedUserKeepsWatermark() {
    when(itopClient.isConfigured()).thenReturn(true);
    when(settingsRepository.findDefaultIntervalMinutes()).thenReturn(60);
    when(settingsRepository.findAllUserIds()).thenReturn(List.of(ALICE));
    when(userScheduler.evaluate(ALICE, JobKind.AGENT, Duration.ofMinutes(60)))
        .thenReturn(SchedulingDecision.closed(Outcome.PORTAL_ONLY));

    final JobRunSummary summary = newJob(20).run();

    assertThat(summary.skipped()).isEqualTo(1);
    verify(watermarkRepository, never()).save(any(), any(), any());
  }

  @Test
  void runWithoutApplicationTokenDoesNothing() {
    when(itopClient.isConfigured()).thenReturn(false);

    final JobRunSummary summary = newJob(20).run();

    assertThat(summary.processed()).isZero();
    verify(settingsRepository, never()).findAllUserIds();
  }

  private void givenEligibleAgent(String userId, String personId, String itopUserId) {
    when(itopClient.isConfigured()).thenReturn(true);
    when(settingsRepository.findDefaultIntervalMinutes()).thenReturn(60);
    when(settingsRepository.findAllUserIds()).thenReturn(List.of(userId));
    givenUserBinding(userId, personId, itopUserId);
  }

  private void givenUserBinding(String userId, String personId, String itopUserId) {
    lenient()
        .when(userScheduler.evaluate(userId, JobKind.AGENT, Duration.ofMinutes(60)))
        .thenReturn(new SchedulingDecision(Outcome.ELIGIBLE, RUN_START));
    lenient().when(settingsRepository.findPersonId(userId)).thenReturn(Optional.of(personId));
    lenient().when(settingsRepository.findItopUserId(userId)).thenReturn(Optional.of(itopUserId));
    lenient().when(settingsRepository.findAdminPolicies(JobKind.AGENT)).thenReturn(Map.of());
    lenient()
        .when(settingsRepository.findOptOut(userId, JobKind.AGENT))
        .thenReturn(UserOptOut.none());
    lenient()
        .when(watermarkRepository.find(userId, JobKind.AGENT))
        .thenReturn(Optional.of(WATERMARK));
  }

  private AgentTicketJob newJob(int maxNotificationsPerRun) {
    final Clock clock = Clock.fixed(RUN_START, ZoneOffset.UTC);
    final ItopNotificationProperties properties =
        new ItopNotificationProperties(
            true, true, null, null, maxNotificationsPerRun, null, "UTC", null, null);
    final NotificationJobMetrics metrics = new NotificationJobMetrics(new SimpleMeterRegistry());
    final NotificationDispatcher dispatcher =
        new NotificationDispatcher(
            delivered::add, new ItopTimestamps(properties, clock), metrics, clock);
    return new AgentTicketJob(
        new JobServices(
            itopClient,
            settingsRepository,
            watermarkRepository,
            userScheduler,
            new NotificationPolicyResolver(),
            changeDetector,
            dispatcher,
            queryService,
            metrics,
            properties,
            clock));
  }

  private static ChangeRecord agentChange(
      String ticketId, String oldAgent, String newAgent, String date, String actorUserId) {
    return new ChangeRecord(
        ticketId, "UserRequest", "agent_id", oldAgent, newAgent, date, "Bob", actorUserId);
  }

  private static ChangeRecord flagChange(
      String ticketId, String attributeCode, String oldValue, String newValue, String date) {
    return new ChangeRecord(
        ticketId, "Incident", attributeCode, oldValue, newValue, date, "Bob", "5");
  }

  private static ChangeRecord comment(
      String logAttribute, String entry, String date, String author, String actorUserId) {
    return new ChangeRecord(
        "42", "UserRequest", logAttribute, null, entry, date, author, actorUserId);
  }
}
