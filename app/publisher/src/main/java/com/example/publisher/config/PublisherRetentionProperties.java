/*
 * どこで: Publisher 設定
 * 何を: 完了済み付与ジョブの保持期間と削除周期を保持する
 * なぜ: テーブル肥大化を防ぐ削除周期を外部化するため
 */
package com.example.publisher.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** 処理済みイベントのマーカーは再送の二重付与を防ぐため削除対象にしない。 */
@ConfigurationProperties(prefix = "publisher.retention")
public record PublisherRetentionProperties(
    boolean enabled, Duration cleanupInterval, Duration completedGrantTtl) {

  public PublisherRetentionProperties {
    cleanupInterval = cleanupInterval == null ? Duration.ofHours(1) : cleanupInterval;
    completedGrantTtl = completedGrantTtl == null ? Duration.ofDays(30) : completedGrantTtl;
  }
}
