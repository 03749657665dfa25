/*
 * どこで: iTop 通知サービス層
 * 何を: 利用者が「Portal user」プロファイルのみを持つかを判定してキャッシュする
 * なぜ: ポータル専用利用者をエージェント通知ジョブの対象から外すため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.config.ItopCacheProperties;
import com.example.itop_notification.repository.NotificationSettingsRepository;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProfileService {

  private static final Logger logger = LoggerFactory.getLogger(ProfileService.class);

  static final String PORTAL_PROFILE_NAME = "Portal user";

  private final ItopQueryService queryService;
  private final NotificationSettingsRepository settingsRepository;
  private final TtlCache cache;
  private final ItopCacheProperties cacheProperties;

  /**
   * 利用者がポータル専用かを返す。
   *
   * @throws ItopIntegrationException プロファイル取得に失敗した場合
   * @throws IllegalStateException iTop 識別子が未設定の場合
   */
  public boolean isPortalOnly(String userId) {
    final Optional<Boolean> cached = cache.get(cacheKey(userId), Boolean.class);
    if (cached.isPresent()) {
      return cached.get();
    }
    final List<String> profiles = userProfiles(userId);
    final boolean portalOnly = profiles.size() == 1 && PORTAL_PROFILE_NAME.equals(profiles.get(0));
    cache.set(cacheKey(userId), portalOnly, cacheProperties.profileTtl());
    return portalOnly;
  }

  public List<String> userProfiles(String userId) {
    Optional<String> itopUserId = settingsRepository.findItopUserId(userId);
    if (itopUserId.isEmpty()) {
      final String personId =
          settingsRepository
              .findPersonId(userId)
              .orElseThrow(() -> new IllegalStateException("user has no itop identity binding"));
      itopUserId = queryService.findItopUserIdByPerson(personId);
      if (itopUserId.isEmpty()) {
        logger.info(
            "person has no itop user account; treating as portal-only userId={} personId={}",
            userId,
            personId);
        return List.of(PORTAL_PROFILE_NAME);
      }
      settingsRepository.saveItopUserId(userId, itopUserId.get());
    }
    final List<String> profiles = queryService.userProfiles(itopUserId.get());
    if (profiles.isEmpty()) {
      logger.warn(
          "user has no profiles in itop; treating as portal-only userId={} itopUserId={}",
          userId,
          itopUserId.get());
      return List.of(PORTAL_PROFILE_NAME);
    }
    return profiles;
  }

  private static String cacheKey(String userId) {
    return "profile:portal_only:" + userId;
  }
}
