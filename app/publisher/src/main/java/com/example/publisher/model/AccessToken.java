package com.example.publisher.model;

import java.time.Instant;

public record AccessToken(String value, String tokenType, Instant expiresAt) {

  @Override
  public String toString() {
    return "AccessToken[tokenType=" + tokenType + ", expiresAt=" + expiresAt + "]";
  }
}
