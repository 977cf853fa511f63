/*
 * どこで: Publisher API
 * 何を: プロバイダ接続/切断/一覧と有効トークン取得のエンドポイントを提供する
 * なぜ: 各アダプタが更新処理を持たずに常に有効なトークンを得られるようにするため
 */
package com.example.publisher.api;

import com.example.publisher.api.request.ConnectCredentialRequest;
import com.example.publisher.api.response.AccessTokenResponse;
import com.example.publisher.api.response.ConnectionsResponse;
import com.example.publisher.model.OwnerIdentity;
import com.example.publisher.model.Provider;
import com.example.publisher.service.CredentialLifecycleService;
import com.example.publisher.service.dto.ConnectionSummary;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/credentials")
@RequiredArgsConstructor
public class CredentialController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final CredentialLifecycleService credentialService;

  @GetMapping
  public ResponseEntity<ConnectionsResponse> list(@RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(new ConnectionsResponse(credentialService.listConnections(userId)));
  }

  @PostMapping("/{provider}")
  public ResponseEntity<ConnectionSummary> connect(
      @RequestHeader(HEADER_USER_ID) String userId,
      @PathVariable("provider") String provider,
      @Valid @RequestBody ConnectCredentialRequest request) {
    return ResponseEntity.ok(
        credentialService.connect(
            userId,
            Provider.fromPath(provider),
            request.code(),
            request.redirectUri(),
            request.providerUserId(),
            request.email()));
  }

  /** provider_user_id / email はプロバイダ起点の呼び出しで内部 ID より優先して照合される。 */
  @GetMapping("/{provider}/token")
  public ResponseEntity<AccessTokenResponse> token(
      @RequestHeader(HEADER_USER_ID) String userId,
      @PathVariable("provider") String provider,
      @RequestParam(value = "provider_user_id", required = false) String providerUserId,
      @RequestParam(value = "email", required = false) String email) {
    final OwnerIdentity identity = new OwnerIdentity(providerUserId, userId, email);
    return ResponseEntity.ok(
        AccessTokenResponse.from(
            credentialService.getValidAccessToken(identity, Provider.fromPath(provider))));
  }

  @DeleteMapping("/{provider}")
  public ResponseEntity<Void> disconnect(
      @RequestHeader(HEADER_USER_ID) String userId, @PathVariable("provider") String provider) {
    credentialService.disconnect(userId, Provider.fromPath(provider));
    return ResponseEntity.noContent().build();
  }
}
