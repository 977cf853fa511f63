/*
 * どこで: Publisher API
 * 何を: 運用者向けの付与ジョブ再投入とメディアキャッシュ操作を提供する
 * なぜ: FAILED になった付与や誤登録キャッシュを手作業の SQL なしで扱えるようにするため
 */
package com.example.publisher.api;

import com.example.publisher.api.response.GrantJobRequeueResponse;
import com.example.publisher.api.response.MediaInvalidateResponse;
import com.example.publisher.model.GrantJobStatus;
import com.example.publisher.service.CreditGrantSweepService;
import com.example.publisher.service.MediaDedupCache;
import com.example.publisher.service.dto.MediaCacheStats;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
public class AdminController {

  private final CreditGrantSweepService sweepService;
  private final MediaDedupCache mediaDedupCache;

  @PostMapping("/credit-grants/{job_id}:requeue")
  public ResponseEntity<GrantJobRequeueResponse> requeue(@PathVariable("job_id") UUID jobId) {
    sweepService.requeueFailed(jobId);
    return ResponseEntity.ok(new GrantJobRequeueResponse(jobId, GrantJobStatus.PENDING.name()));
  }

  @GetMapping("/media-cache/stats")
  public ResponseEntity<MediaCacheStats> mediaCacheStats() {
    return ResponseEntity.ok(mediaDedupCache.stats());
  }

  @DeleteMapping("/media-cache/{content_hash}")
  public ResponseEntity<MediaInvalidateResponse> invalidateMedia(
      @PathVariable("content_hash") String contentHash) {
    return ResponseEntity.ok(
        new MediaInvalidateResponse(contentHash, mediaDedupCache.invalidate(contentHash)));
  }
}
