/*
 * どこで: Publisher 設定
 * 何を: メディア再ホストの正規ドメイン、ダウンロード上限、キャッシュ容量/TTL を保持する
 * なぜ: 巨大/低速な転送とメモリ肥大化を設定で制限するため
 */
package com.example.publisher.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "publisher.media")
public record MediaCacheProperties(
    List<String> canonicalHosts,
    long maxDownloadBytes,
    Duration connectTimeout,
    Duration downloadTimeout,
    String rehostBaseUrl,
    String rehostUploadPath,
    String rehostPlatform,
    Duration rehostTimeout,
    long cacheMaximumSize,
    Duration cacheTtl) {

  public MediaCacheProperties {
    canonicalHosts =
        canonicalHosts == null || canonicalHosts.isEmpty()
            ? List.of("amazonaws.com")
            : List.copyOf(canonicalHosts);
    maxDownloadBytes = maxDownloadBytes <= 0 ? 256L * 1024 * 1024 : maxDownloadBytes;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    downloadTimeout = downloadTimeout == null ? Duration.ofSeconds(60) : downloadTimeout;
    rehostBaseUrl = rehostBaseUrl == null ? "http://media-store:8000" : rehostBaseUrl;
    rehostUploadPath =
        rehostUploadPath == null || rehostUploadPath.isBlank()
            ? "/api/v1/upload"
            : rehostUploadPath;
    rehostPlatform =
        rehostPlatform == null || rehostPlatform.isBlank() ? "centralized" : rehostPlatform;
    rehostTimeout = rehostTimeout == null ? Duration.ofSeconds(60) : rehostTimeout;
    cacheMaximumSize = cacheMaximumSize <= 0 ? 10_000L : cacheMaximumSize;
    cacheTtl = cacheTtl == null ? Duration.ofHours(6) : cacheTtl;
  }
}
