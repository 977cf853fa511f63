package com.example.publisher.service.dto;

import com.example.publisher.model.CredentialRecord;
import com.example.publisher.model.Provider;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Set;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConnectionSummary(
    Provider provider,
    String providerUserId,
    Set<String> scope,
    Instant expiresAt,
    Instant lastRefreshedAt,
    boolean refreshable) {

  public static ConnectionSummary from(CredentialRecord record) {
    return new ConnectionSummary(
        record.provider(),
        record.providerUserId(),
        record.scope(),
        record.expiresAt(),
        record.lastRefreshedAt(),
        record.hasRefreshToken());
  }
}
