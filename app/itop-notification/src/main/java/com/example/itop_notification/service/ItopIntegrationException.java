/*
 * どこで: iTop 通知サービス層
 * 何を: iTop REST 呼び出し失敗を表現する
 * なぜ: 認証失効(恒久)と一時障害をジョブ側で区別するため
 */
package com.example.itop_notification.service;

public class ItopIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    FORBIDDEN,
    NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY,
    API_ERROR
  }

  private final Reason reason;

  public ItopIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ItopIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public boolean isAuthInvalid() {
    return reason == Reason.UNAUTHORIZED;
  }
}
