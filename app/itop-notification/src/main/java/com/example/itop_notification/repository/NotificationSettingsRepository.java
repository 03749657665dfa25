/*
 * どこで: iTop 通知データアクセス
 * 何を: 通知設定(有効化/iTop 識別子/間隔/オプトアウト/管理者ポリシー)を型付きで読み書きする
 * なぜ: 文字列キーの散在を避け、未設定を Optional で表現するため
 */
package com.example.itop_notification.repository;

import com.example.itop_notification.model.JobKind;
import com.example.itop_notification.model.NotificationType;
import com.example.itop_notification.model.PolicyState;
import com.example.itop_notification.model.UserOptOut;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationSettingsRepository {

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationSettingsRepository.class);

  static final String KEY_NOTIFICATION_ENABLED = "notification_enabled";
  static final String KEY_PERSON_ID = "person_id";
  static final String KEY_ITOP_USER_ID = "user_id";
  static final String KEY_CHECK_INTERVAL = "notification_check_interval";
  static final String KEY_DISABLED_PORTAL = "disabled_portal_notifications";
  static final String KEY_DISABLED_AGENT = "disabled_agent_notifications";
  static final String KEY_DEFAULT_INTERVAL = "default_notification_interval";
  static final String KEY_PORTAL_POLICY = "portal_notification_config";
  static final String KEY_AGENT_POLICY = "agent_notification_config";

  static final int DEFAULT_INTERVAL_MINUTES = 60;

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

  private final PreferenceStore preferenceStore;
  private final ObjectMapper objectMapper;

  public List<String> findAllUserIds() {
    return preferenceStore.findAllUserIds();
  }

  public boolean isNotificationEnabled(String userId) {
    return preferenceStore
        .getUserValue(userId, KEY_NOTIFICATION_ENABLED)
        .map("1"::equals)
        .orElse(false);
  }

  public Optional<String> findPersonId(String userId) {
    return nonBlank(preferenceStore.getUserValue(userId, KEY_PERSON_ID));
  }

  public Optional<String> findItopUserId(String userId) {
    return nonBlank(preferenceStore.getUserValue(userId, KEY_ITOP_USER_ID));
  }

  public void saveItopUserId(String userId, String itopUserId) {
    preferenceStore.setUserValue(userId, KEY_ITOP_USER_ID, itopUserId);
  }

  public Optional<Integer> findCheckIntervalMinutes(String userId) {
    return preferenceStore.getUserValue(userId, KEY_CHECK_INTERVAL).flatMap(this::parsePositiveInt);
  }

  public int findDefaultIntervalMinutes() {
    return preferenceStore
        .getAppValue(KEY_DEFAULT_INTERVAL)
        .flatMap(this::parsePositiveInt)
        .orElse(DEFAULT_INTERVAL_MINUTES);
  }

  public UserOptOut findOptOut(String userId, JobKind audience) {
    final Optional<String> raw = preferenceStore.getUserValue(userId, optOutKey(audience));
    if (raw.isEmpty() || raw.get().isBlank()) {
      return UserOptOut.none();
    }
    if (UserOptOut.ALL.equals(raw.get())) {
      return UserOptOut.everything();
    }
    try {
      final List<String> subjects = objectMapper.readValue(raw.get(), STRING_LIST);
      return new UserOptOut(false, subjects == null ? Set.of() : new HashSet<>(subjects));
    } catch (JsonProcessingException ex) {
      logger.warn("invalid opt-out list; treating as none userId={} audience={}", userId, audience);
      return UserOptOut.none();
    }
  }

  public void saveOptOut(String userId, JobKind audience, UserOptOut optOut) {
    if (optOut.all()) {
      preferenceStore.setUserValue(userId, optOutKey(audience), UserOptOut.ALL);
      return;
    }
    try {
      final String json =
          objectMapper.writeValueAsString(optOut.subjects().stream().sorted().toList());
      preferenceStore.setUserValue(userId, optOutKey(audience), json);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("opt-out serialization failure", ex);
    }
  }

  /** Admin policy per type of the audience; missing or unreadable entries fall back to defaults. */
  public Map<NotificationType, PolicyState> findAdminPolicies(JobKind audience) {
    final Map<NotificationType, PolicyState> policies = new EnumMap<>(NotificationType.class);
    final Map<String, String> stored = readStoredPolicies(audience);
    for (NotificationType type : NotificationType.forAudience(audience)) {
      final PolicyState state =
          Optional.ofNullable(stored.get(type.subject()))
              .flatMap(PolicyState::fromValue)
              .orElse(type.defaultState());
      policies.put(type, state);
    }
    return policies;
  }

  public void saveAdminPolicies(JobKind audience, Map<NotificationType, PolicyState> policies) {
    final Map<String, String> raw = new TreeMap<>();
    policies.forEach((type, state) -> raw.put(type.subject(), state.value()));
    try {
      preferenceStore.setAppValue(policyKey(audience), objectMapper.writeValueAsString(raw));
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("admin policy serialization failure", ex);
    }
  }

  private Map<String, String> readStoredPolicies(JobKind audience) {
    final Optional<String> raw = preferenceStore.getAppValue(policyKey(audience));
    if (raw.isEmpty() || raw.get().isBlank()) {
      return Map.of();
    }
    try {
      final Map<String, String> parsed = objectMapper.readValue(raw.get(), STRING_MAP);
      return parsed == null ? Map.of() : parsed;
    } catch (JsonProcessingException ex) {
      logger.warn("invalid admin notification policy; using defaults audience={}", audience);
      return Map.of();
    }
  }

  private Optional<Integer> parsePositiveInt(String raw) {
    try {
      final int value = Integer.parseInt(raw.trim());
      return value > 0 ? Optional.of(value) : Optional.empty();
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }

  private static Optional<String> nonBlank(Optional<String> value) {
    return value.filter(v -> !v.isBlank());
  }

  private static String optOutKey(JobKind audience) {
    return audience == JobKind.AGENT ? KEY_DISABLED_AGENT : KEY_DISABLED_PORTAL;
  }

  private static String policyKey(JobKind audience) {
    return audience == JobKind.AGENT ? KEY_AGENT_POLICY : KEY_PORTAL_POLICY;
  }
}
