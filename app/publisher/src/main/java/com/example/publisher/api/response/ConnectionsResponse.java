package com.example.publisher.api.response;

import com.example.publisher.service.dto.ConnectionSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConnectionsResponse(List<ConnectionSummary> connections) {

  public ConnectionsResponse {
    connections = connections == null ? List.of() : List.copyOf(connections);
  }
}
