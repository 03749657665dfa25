/*
 * どこで: iTop 通知デバッグ API
 * 何を: API の例外を標準エラー形式へ変換する
 * なぜ: 失敗時の契約を一定に保つため
 */
package com.example.itop_notification.api;

import com.example.itop_notification.service.ItopIntegrationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class NotificationApiExceptionHandler {

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    final ApiErrorResponse body = new ApiErrorResponse("BAD_REQUEST", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  /** iTop 側の失敗は理由コードを残して 502/504 で返す。 */
  @ExceptionHandler(ItopIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleIntegration(ItopIntegrationException ex) {
    final HttpStatus status =
        ex.reason() == ItopIntegrationException.Reason.TIMEOUT
            ? HttpStatus.GATEWAY_TIMEOUT
            : HttpStatus.BAD_GATEWAY;
    final ApiErrorResponse body =
        new ApiErrorResponse("ITOP_" + ex.reason().name(), ex.getMessage());
    return ResponseEntity.status(status).body(body);
  }
}
