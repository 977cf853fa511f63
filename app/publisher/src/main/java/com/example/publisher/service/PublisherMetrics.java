/*
 * どこで: Publisher サービス層
 * 何を: 資格情報更新/クレジット消費/webhook/メディアキャッシュのメトリクス記録を集約する
 * なぜ: 失敗率やクランプ発生を運用で継続監視できるようにするため
 */
package com.example.publisher.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class PublisherMetrics {

  private static final String METRIC_REFRESH_TOTAL = "publisher.credential.refresh.total";
  private static final String METRIC_CONSUME_TOTAL = "publisher.credit.consume.total";
  private static final String METRIC_CLAMP_TOTAL = "publisher.credit.clamp.total";
  private static final String METRIC_WEBHOOK_TOTAL = "publisher.webhook.total";
  private static final String METRIC_GRANT_FAILED_CURRENT = "publisher.grant.failed.current";
  private static final String METRIC_MEDIA_TOTAL = "publisher.media.cache.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger grantFailedCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter clampCounter;

  public PublisherMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_GRANT_FAILED_CURRENT, grantFailedCurrent, AtomicInteger::get)
        .description("Current number of FAILED credit grant jobs")
        .register(meterRegistry);
    this.clampCounter =
        Counter.builder(METRIC_CLAMP_TOTAL)
            .description("Credit computations clamped to zero")
            .register(meterRegistry);
  }

  public void recordRefresh(String provider, String result) {
    increment(METRIC_REFRESH_TOTAL, "Credential refresh attempts", "provider", provider, result);
  }

  public void recordConsume(String result) {
    increment(METRIC_CONSUME_TOTAL, "Credit consume calls", null, null, result);
  }

  public void recordWebhook(String result) {
    increment(METRIC_WEBHOOK_TOTAL, "Payment webhook outcomes", null, null, result);
  }

  public void recordMedia(String result) {
    increment(METRIC_MEDIA_TOTAL, "Media cache lookups", null, null, result);
  }

  public void recordClamp() {
    clampCounter.increment();
  }

  public void updateGrantFailedCurrent(int failedCount) {
    grantFailedCurrent.set(Math.max(failedCount, 0));
  }

  private void increment(
      String name, String description, String tagKey, String tagValue, String result) {
    final String key = name + ":" + tagValue + ":" + result;
    counters
        .computeIfAbsent(
            key,
            ignored -> {
              final Tags tags =
                  tagKey == null
                      ? Tags.of("result", result)
                      : Tags.of(tagKey, tagValue, "result", result);
              return Counter.builder(name)
                  .description(description)
                  .tags(tags)
                  .register(meterRegistry);
            })
        .increment();
  }
}
