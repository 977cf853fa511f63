/*
 * どこで: Publisher 設定
 * 何を: content hash → 正規 URL のプロセス内キャッシュ(Caffeine)を提供する
 * なぜ: 容量と TTL で上限を設け、DB 参照の前段で再ダウンロード後の照合を速くするため
 */
package com.example.publisher.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MediaCacheConfig {

  @Bean
  Cache<String, String> mediaUrlCache(MediaCacheProperties properties) {
    return Caffeine.newBuilder()
        .maximumSize(properties.cacheMaximumSize())
        .expireAfterWrite(properties.cacheTtl())
        .recordStats()
        .build();
  }
}
