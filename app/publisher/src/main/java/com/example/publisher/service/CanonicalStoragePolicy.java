/*
 * どこで: Publisher メディア層
 * 何を: URL が既に正規ストレージ上にあるかを判定する
 * なぜ: 再ホスト済みのメディアを再ダウンロードしないため
 */
package com.example.publisher.service;

import com.example.publisher.config.MediaCacheProperties;
import java.net.URI;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class CanonicalStoragePolicy {

  private final List<String> canonicalHosts;

  public CanonicalStoragePolicy(MediaCacheProperties properties) {
    this.canonicalHosts =
        properties.canonicalHosts().stream()
            .map(host -> host.toLowerCase(Locale.ROOT))
            .toList();
  }

  /** ホスト名の一致またはサブドメインのみを正規とみなす。パスやクエリの部分一致は見ない。 */
  public boolean isCanonical(URI uri) {
    final String host = uri.getHost();
    if (host == null) {
      return false;
    }
    final String normalized = host.toLowerCase(Locale.ROOT);
    for (String canonical : canonicalHosts) {
      if (normalized.equals(canonical) || normalized.endsWith("." + canonical)) {
        return true;
      }
    }
    return false;
  }
}
