package com.example.publisher.api.response;

import com.example.publisher.model.ReconcileState;
import com.example.publisher.model.SkipReason;
import com.example.publisher.service.dto.ReconcileOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAckResponse(
    boolean received, ReconcileState state, SkipReason skipReason, String eventId, long credits) {

  public static WebhookAckResponse from(ReconcileOutcome outcome) {
    return new WebhookAckResponse(
        true, outcome.state(), outcome.skipReason(), outcome.eventId(), outcome.credits());
  }
}
