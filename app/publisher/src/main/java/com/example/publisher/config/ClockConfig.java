/*
 * どこで: Publisher 設定
 * 何を: 期限判定/リース/保持期間の基準となる UTC の Clock を提供する
 * なぜ: テストで固定時刻へ差し替えられるようにするため
 */
package com.example.publisher.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }
}
