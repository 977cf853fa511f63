package com.example.publisher.service.dto;

import com.example.publisher.model.ReconcileState;
import com.example.publisher.model.SkipReason;

/** webhook 1 件の照合結果。skipReason は SKIPPED のときだけ入る。 */
public record ReconcileOutcome(
    ReconcileState state,
    SkipReason skipReason,
    String eventId,
    long credits,
    String destination) {

  public static ReconcileOutcome skipped(String eventId, SkipReason reason) {
    return new ReconcileOutcome(ReconcileState.SKIPPED, reason, eventId, 0L, null);
  }

  public static ReconcileOutcome credited(String eventId, long credits, String destination) {
    return new ReconcileOutcome(ReconcileState.CREDITED, null, eventId, credits, destination);
  }

  public static ReconcileOutcome failedRetryable(String eventId, long credits) {
    return new ReconcileOutcome(ReconcileState.FAILED_RETRYABLE, null, eventId, credits, null);
  }
}
