package com.example.publisher.service.dto;

import java.util.Set;

/**
 * トークンエンドポイントの応答から取り出した値。
 *
 * <p>refreshToken / scope / tokenType / expiresInSeconds / providerUserId は
 * プロバイダが返さなかった場合 null。
 */
public record TokenGrant(
    String accessToken,
    String refreshToken,
    String tokenType,
    Set<String> scope,
    Long expiresInSeconds,
    String providerUserId) {

  public boolean hasRefreshToken() {
    return refreshToken != null && !refreshToken.isBlank();
  }

  @Override
  public String toString() {
    return "TokenGrant[tokenType="
        + tokenType
        + ", expiresInSeconds="
        + expiresInSeconds
        + ", refreshTokenReturned="
        + hasRefreshToken()
        + "]";
  }
}
