/*
 * どこで: Publisher 設定
 * 何を: 未完了クレジット付与ジョブの再試行ポーリング/バックオフ設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.publisher.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "publisher.billing.grant-sweep")
public record CreditGrantSweepProperties(
    boolean enabled,
    Duration pollInterval,
    Duration initialDelay,
    int batchSize,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    int errorMessageMaxLength,
    Duration lease) {}
