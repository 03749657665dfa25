/*
 * どこで: iTop 通知サービス層テスト
 * 何を: ポータル専用判定とそのキャッシュ、iTop ユーザー未登録時の扱いを検証する
 * なぜ: 判定を誤るとエージェントがエージェント通知を受け取れなくなるため
 */
package com.example.itop_notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.itop_notification.config.ItopCacheProperties;
import com.example.itop_notification.repository.NotificationSettingsRepository;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProfileServiceTest {

  private static final String USER_ID = "alice";
  private static final String CACHE_KEY = "profile:portal_only:alice";

  @Mock private ItopQueryService queryService;
  @Mock private NotificationSettingsRepository settingsRepository;
  @Mock private TtlCache cache;

  private ProfileService profileService;

  @BeforeEach
  void setUp() {
    profileService =
        new ProfileService(
            queryService,
            settingsRepository,
            cache,
            new ItopCacheProperties(null, null, null, null, null));
  }

  @Test
  void cachedFlagIsReturnedWithoutRemoteCall() {
    when(cache.get(CACHE_KEY, Boolean.class)).thenReturn(Optional.of(false));

    assertThat(profileService.isPortalOnly(USER_ID)).isFalse();
    verifyNoInteractions(queryService);
  }

  @Test
  void onlyPortalUserProfileMeansPortalOnlyAndIsCached() {
    when(cache.get(CACHE_KEY, Boolean.class)).thenReturn(Optional.empty());
    when(settingsRepository.findItopUserId(USER_ID)).thenReturn(Optional.of("12"));
    when(queryService.userProfiles("12")).thenReturn(List.of("Portal user"));

    assertThat(profileService.isPortalOnly(USER_ID)).isTrue();
    verify(cache).set(CACHE_KEY, true, Duration.ofSeconds(300));
  }

  @Test
  void additionalProfileMeansAgent() {
    when(cache.get(CACHE_KEY, Boolean.class)).thenReturn(Optional.empty());
    when(settingsRepository.findItopUserId(USER_ID)).thenReturn(Optional.of("12"));
    when(queryService.userProfiles("12")).thenReturn(List.of("Portal user", "Support Agent"));

    assertThat(profileService.isPortalOnly(USER_ID)).isFalse();
  }

  @Test
  void personWithoutUserAccountIsTreatedAsPortalOnly() {
    when(settingsRepository.findItopUserId(USER_ID)).thenReturn(Optional.empty());
    when(settingsRepository.findPersonId(USER_ID)).thenReturn(Optional.of("7"));
    when(queryService.findItopUserIdByPerson("7")).thenReturn(Optional.empty());

    assertThat(profileService.userProfiles(USER_ID)).containsExactly("Portal user");
    verify(settingsRepository, never()).saveItopUserId(anyString(), anyString());
  }

  @Test
  void missingUserIdIsResolvedFromPersonAndStored() {
    when(settingsRepository.findItopUserId(USER_ID)).thenReturn(Optional.empty());
    when(settingsRepository.findPersonId(USER_ID)).thenReturn(Optional.of("7"));
    when(queryService.findItopUserIdByPerson("7")).thenReturn(Optional.of("12"));
    when(queryService.userProfiles("12")).thenReturn(List.of("Service Desk Agent"));

    assertThat(profileService.userProfiles(USER_ID)).containsExactly("Service Desk Agent");
    verify(settingsRepository).saveItopUserId(USER_ID, "12");
  }
}
