/*
 * どこで: iTop 通知ジョブ
 * 何を: 1 回のジョブ実行の集計値
 * なぜ: ログ/メトリクス/手動実行 API で同じ集計を返すため
 */
package com.example.itop_notification.model;

import java.time.Duration;

public record JobRunSummary(
    JobKind job,
    int processed,
    int skipped,
    int failed,
    int notificationsSent,
    Duration duration) {}
