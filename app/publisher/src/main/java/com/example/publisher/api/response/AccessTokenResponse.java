package com.example.publisher.api.response;

import com.example.publisher.model.AccessToken;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AccessTokenResponse(String accessToken, String tokenType, Instant expiresAt) {

  public static AccessTokenResponse from(AccessToken token) {
    return new AccessTokenResponse(token.value(), token.tokenType(), token.expiresAt());
  }

  @Override
  public String toString() {
    return "AccessTokenResponse[tokenType=" + tokenType + ", expiresAt=" + expiresAt + "]";
  }
}
