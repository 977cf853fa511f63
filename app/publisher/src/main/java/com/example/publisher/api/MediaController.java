/*
 * どこで: Publisher API
 * 何を: 外部メディア URL を正規ストレージ URL へ解決するエンドポイントを提供する
 * なぜ: 複数プロバイダへの同一メディア投稿で再アップロードを避けるため
 */
package com.example.publisher.api;

import com.example.publisher.api.request.ResolveMediaRequest;
import com.example.publisher.api.response.ResolveMediaResponse;
import com.example.publisher.service.MediaDedupCache;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class MediaController {

  private final MediaDedupCache mediaDedupCache;

  @PostMapping("/v1/media:resolve")
  public ResponseEntity<ResolveMediaResponse> resolve(
      @Valid @RequestBody ResolveMediaRequest request) {
    final String canonicalUrl =
        mediaDedupCache.getConsistentUrl(request.sourceUrl(), request.mediaType());
    return ResponseEntity.ok(new ResolveMediaResponse(request.sourceUrl(), canonicalUrl));
  }
}
