/*
 * どこで: iTop 通知サービス層
 * 何を: ジョブごとの利用者処理結果/送信数/実行時間とキャッシュ結果を記録する
 * なぜ: 無人実行されるジョブの健全性をメトリクスで観測するため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.model.JobKind;
import com.example.itop_notification.model.NotificationType;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationJobMetrics {

  private static final String METRIC_USERS = "itop.notification.users";
  private static final String METRIC_SENT = "itop.notification.sent";
  private static final String METRIC_RUN_DURATION = "itop.notification.run.duration";
  private static final String METRIC_CACHE_REQUESTS = "itop.cache.requests";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<JobKind, Timer> runTimers = new ConcurrentHashMap<>();

  public NotificationJobMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordUserResult(JobKind job, String result) {
    counter(
            METRIC_USERS,
            "Users handled by notification jobs",
            Tags.of("job", job.value(), "result", result))
        .increment();
  }

  public void recordSent(JobKind job, NotificationType type) {
    counter(
            METRIC_SENT,
            "Notifications handed to the notification sink",
            Tags.of("job", job.value(), "type", type.subject()))
        .increment();
  }

  public void recordRunDuration(JobKind job, Duration duration) {
    runTimers
        .computeIfAbsent(
            job,
            ignored ->
                Timer.builder(METRIC_RUN_DURATION)
                    .description("Wall-clock duration of one notification job run")
                    .tags(Tags.of("job", job.value()))
                    .register(meterRegistry))
        .record(duration);
  }

  public void recordCacheResult(String result) {
    counter(METRIC_CACHE_REQUESTS, "TTL cache lookups by outcome", Tags.of("result", result))
        .increment();
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key = name + tags;
    return counters.computeIfAbsent(
        key,
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
