package com.example.publisher.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PricingResponse(double creditsPerUsd, String defaultModel, List<ModelPrice> models) {

  public PricingResponse {
    models = models == null ? List.of() : List.copyOf(models);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ModelPrice(String model, int credits, double usdPerVideo) {}
}
