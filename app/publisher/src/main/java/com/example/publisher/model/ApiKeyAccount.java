package com.example.publisher.model;

import java.time.Instant;

public record ApiKeyAccount(
    String accountId,
    String ownerKey,
    long balance,
    long initialGrant,
    long totalConsumed,
    AccountStatus status,
    Instant createdAt) {

  public boolean isActive() {
    return status == AccountStatus.ACTIVE;
  }
}
