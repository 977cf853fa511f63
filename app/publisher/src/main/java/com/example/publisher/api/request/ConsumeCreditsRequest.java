package com.example.publisher.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Positive;

/** amount を省略した場合は model の価格(model も無ければ既定モデル)を引き落とす。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConsumeCreditsRequest(
    @Positive(message = "amount must be positive") Long amount, String accountId, String model) {}
