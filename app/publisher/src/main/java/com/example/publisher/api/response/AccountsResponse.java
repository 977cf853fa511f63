package com.example.publisher.api.response;

import com.example.publisher.service.dto.AccountSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AccountsResponse(List<AccountSummary> accounts) {

  public AccountsResponse {
    accounts = accounts == null ? List.of() : List.copyOf(accounts);
  }
}
