/*
 * どこで: iTop 通知サービス層
 * 何を: 管理者の 3 状態ポリシーと利用者のオプトアウトから有効な通知種別を決める
 * なぜ: 保存形式から切り離した純粋関数として判定を一元化するため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.model.JobKind;
import com.example.itop_notification.model.NotificationType;
import com.example.itop_notification.model.PolicyState;
import com.example.itop_notification.model.UserOptOut;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class NotificationPolicyResolver {

  public static boolean effectivePolicy(PolicyState adminState, boolean userOptedOut) {
    return switch (adminState) {
      case FORCED -> true;
      case DISABLED -> false;
      case USER_CHOICE -> !userOptedOut;
    };
  }

  public Set<NotificationType> enabledTypes(
      JobKind audience, Map<NotificationType, PolicyState> adminPolicies, UserOptOut optOut) {
    final Set<NotificationType> enabled = EnumSet.noneOf(NotificationType.class);
    for (NotificationType type : NotificationType.forAudience(audience)) {
      final PolicyState state = adminPolicies.getOrDefault(type, type.defaultState());
      if (effectivePolicy(state, optOut.optedOut(type))) {
        enabled.add(type);
      }
    }
    return enabled;
  }
}
