package com.example.publisher.service.dto;

import com.example.publisher.model.AccountStatus;
import com.example.publisher.model.ApiKeyAccount;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AccountSummary(
    String accountId,
    long balance,
    long initialGrant,
    long totalConsumed,
    AccountStatus status,
    Instant createdAt) {

  public static AccountSummary from(ApiKeyAccount account) {
    return new AccountSummary(
        account.accountId(),
        account.balance(),
        account.initialGrant(),
        account.totalConsumed(),
        account.status(),
        account.createdAt());
  }
}
