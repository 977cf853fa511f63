package com.example.publisher.api.response;

import com.example.publisher.model.ConsumeReceipt;
import com.example.publisher.model.CreditSource;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConsumeCreditsResponse(
    CreditSource source, long remaining, String accountId, long consumed) {

  public static ConsumeCreditsResponse from(ConsumeReceipt receipt) {
    return new ConsumeCreditsResponse(
        receipt.source(), receipt.remaining(), receipt.accountId(), receipt.amount());
  }
}
