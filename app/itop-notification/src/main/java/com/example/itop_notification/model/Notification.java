/*
 * どこで: iTop 通知ドメインモデル
 * 何を: 通知シンクへ渡す 1 件の通知(アプリ/宛先/日時/オブジェクト参照/サブジェクト/パラメータ)
 * なぜ: シンク側がオブジェクト参照で重複排除できる形に揃えるため
 */
package com.example.itop_notification.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record Notification(
    String app,
    String userId,
    Instant dateTime,
    String objectType,
    String objectKey,
    String subject,
    Map<String, String> params) {

  public Notification {
    Objects.requireNonNull(app, "app");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(dateTime, "dateTime");
    Objects.requireNonNull(objectType, "objectType");
    Objects.requireNonNull(objectKey, "objectKey");
    Objects.requireNonNull(subject, "subject");
    params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String app;
    private String userId;
    private Instant dateTime;
    private String objectType;
    private String objectKey;
    private String subject;
    private Map<String, String> params = Map.of();

    private Builder() {}

    public Builder app(String app) {
      this.app = app;
      return this;
    }

    public Builder user(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder dateTime(Instant dateTime) {
      this.dateTime = dateTime;
      return this;
    }

    public Builder object(String objectType, String objectKey) {
      this.objectType = objectType;
      this.objectKey = objectKey;
      return this;
    }

    public Builder subject(String subject, Map<String, String> params) {
      this.subject = subject;
      this.params = params;
      return this;
    }

    public Notification build() {
      return new Notification(app, userId, dateTime, objectType, objectKey, subject, params);
    }
  }
}
