/*
 * どこで: Publisher モデル
 * 何を: (owner, provider) ごとの OAuth 資格情報 1 件を表現する
 * なぜ: 更新前後の値を不変オブジェクトで受け渡し、部分更新を起こさないため
 */
package com.example.publisher.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

public record CredentialRecord(
    String ownerKey,
    Provider provider,
    String providerUserId,
    String email,
    String accessToken,
    String refreshToken,
    String tokenType,
    Set<String> scope,
    Instant expiresAt,
    boolean rotatesRefreshToken,
    Instant lastRefreshedAt) {

  public CredentialRecord {
    scope = scope == null ? Set.of() : Set.copyOf(scope);
  }

  /** expiresAt 不明のトークンは期限なしとして扱う。 */
  public boolean expiresWithin(Duration threshold, Instant now) {
    if (expiresAt == null) {
      return false;
    }
    return Duration.between(now, expiresAt).compareTo(threshold) < 0;
  }

  public boolean hasRefreshToken() {
    return refreshToken != null && !refreshToken.isBlank();
  }

  public AccessToken toAccessToken() {
    return new AccessToken(accessToken, tokenType, expiresAt);
  }

  @Override
  public String toString() {
    // トークン値をログに出さない
    return "CredentialRecord[ownerKey="
        + ownerKey
        + ", provider="
        + provider
        + ", expiresAt="
        + expiresAt
        + ", lastRefreshedAt="
        + lastRefreshedAt
        + "]";
  }
}
