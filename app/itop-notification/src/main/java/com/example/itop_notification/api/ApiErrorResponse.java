/*
 * どこで: iTop 通知 API モデル
 * 何を: API エラー応答の共通 DTO
 * なぜ: 運用ツールがエラー形式を機械的に扱えるようにするため
 */
package com.example.itop_notification.api;

public record ApiErrorResponse(String code, String message) {}
