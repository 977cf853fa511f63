/*
 * どこで: Publisher メディア層
 * 何を: 外部メディア URL を内容ハッシュで重複排除し、正規ストレージ上の URL を返す
 * なぜ: 同じ内容を複数プロバイダへ投稿するたびに再アップロードしないため
 */
package com.example.publisher.service;

import com.example.common.concurrent.SingleFlight;
import com.example.common.lock.AdvisoryLockKeys;
import com.example.publisher.model.MediaCacheEntry;
import com.example.publisher.model.MediaKind;
import com.example.publisher.repository.AdvisoryLockRepository;
import com.example.publisher.repository.MediaCacheRepository;
import com.example.publisher.service.dto.MediaCacheStats;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import java.net.URI;
import java.net.URISyntaxException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class MediaDedupCache {

  private static final Logger logger = LoggerFactory.getLogger(MediaDedupCache.class);
  private static final String LOCK_NAMESPACE = "media";
  private static final int FILENAME_HASH_LENGTH = 16;
  private static final Pattern EXTENSION = Pattern.compile("\\.[A-Za-z0-9]{1,5}");

  private final CanonicalStoragePolicy storagePolicy;
  private final MediaDownloadClient downloadClient;
  private final MediaRehostClient rehostClient;
  private final MediaCacheRepository mediaCacheRepository;
  private final AdvisoryLockRepository advisoryLockRepository;
  private final Cache<String, String> mediaUrlCache;
  private final TransactionTemplate transactionTemplate;
  private final PublisherMetrics metrics;
  private final Clock clock;
  private final SingleFlight<String, String> populateFlights = new SingleFlight<>();

  /**
   * 役割:
   * - 正規ストレージ上の URL はそのまま返す。
   * - それ以外はダウンロードした内容のハッシュで既存 URL を探し、無ければ 1 度だけ再ホストする。
   */
  public String getConsistentUrl(String sourceUrl, MediaKind kind) {
    final URI source = parseSource(sourceUrl);
    if (storagePolicy.isCanonical(source)) {
      metrics.recordMedia("canonical");
      return sourceUrl;
    }
    final byte[] content = downloadClient.download(source);
    final String contentHash = sha256Hex(content);
    final String cached = mediaUrlCache.getIfPresent(contentHash);
    if (cached != null) {
      metrics.recordMedia("hit");
      logger.debug("media cache hit contentHash={} source={}", contentHash, source);
      return cached;
    }
    return populateFlights.execute(
        contentHash, () -> populate(contentHash, content, kind, source));
  }

  public MediaCacheStats stats() {
    final CacheStats stats = mediaUrlCache.stats();
    return new MediaCacheStats(
        mediaUrlCache.estimatedSize(),
        stats.hitCount(),
        stats.missCount(),
        populateFlights.inFlightCount());
  }

  /** @return 永続層から行を削除した場合 true */
  public boolean invalidate(String contentHash) {
    final String normalized = contentHash.toLowerCase(Locale.ROOT);
    mediaUrlCache.invalidate(normalized);
    final boolean removed = mediaCacheRepository.delete(normalized) > 0;
    logger.info("media cache invalidated contentHash={} removed={}", normalized, removed);
    return removed;
  }

  private String populate(String contentHash, byte[] content, MediaKind kind, URI source) {
    return transactionTemplate.execute(
        status -> {
          // 別プロセスが同じ内容を同時にアップロードしないよう hash 単位で直列化する
          advisoryLockRepository.lock(AdvisoryLockKeys.of(LOCK_NAMESPACE, contentHash));
          final Optional<MediaCacheEntry> stored = mediaCacheRepository.find(contentHash);
          if (stored.isPresent()) {
            final String url = stored.get().canonicalUrl();
            mediaUrlCache.put(contentHash, url);
            metrics.recordMedia("stored_hit");
            return url;
          }
          final String filename = filenameFor(contentHash, source, kind);
          final String url = rehostClient.upload(content, filename, kind);
          mediaCacheRepository.insertIfAbsent(
              new MediaCacheEntry(contentHash, url, kind, Instant.now(clock)));
          mediaUrlCache.put(contentHash, url);
          metrics.recordMedia("uploaded");
          logger.info(
              "media rehosted contentHash={} bytes={} source={} url={}",
              contentHash,
              content.length,
              source,
              url);
          return url;
        });
  }

  static String filenameFor(String contentHash, URI source, MediaKind kind) {
    return "media_" + contentHash.substring(0, FILENAME_HASH_LENGTH) + extensionOf(source, kind);
  }

  private static String extensionOf(URI source, MediaKind kind) {
    final String path = source.getPath();
    if (path != null) {
      final int slash = path.lastIndexOf('/');
      final String lastSegment = path.substring(slash + 1);
      final int dot = lastSegment.lastIndexOf('.');
      if (dot > 0) {
        final String extension = lastSegment.substring(dot);
        if (EXTENSION.matcher(extension).matches()) {
          return extension.toLowerCase(Locale.ROOT);
        }
      }
    }
    return kind.defaultExtension();
  }

  private static URI parseSource(String sourceUrl) {
    if (sourceUrl == null || sourceUrl.isBlank()) {
      throw new IllegalArgumentException("source_url is required");
    }
    final URI uri;
    try {
      uri = new URI(sourceUrl.trim());
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("source_url is not a valid URL", ex);
    }
    final String scheme = uri.getScheme();
    if (scheme == null
        || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
        || uri.getHost() == null) {
      throw new IllegalArgumentException("source_url must be an absolute http(s) URL");
    }
    return uri;
  }

  static String sha256Hex(byte[] content) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }
}
