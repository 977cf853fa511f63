/*
 * どこで: Publisher サービス層
 * 何を: Stripe の checkout.session.completed を一度だけのクレジット付与へ変換する
 * なぜ: 重複/順不同に届く決済通知から残高と購入統計を正確に保つため
 */
package com.example.publisher.service;

import com.example.publisher.config.CreditGrantSweepProperties;
import com.example.publisher.config.StripeWebhookProperties;
import com.example.publisher.model.CreditDestination;
import com.example.publisher.model.CreditGrantJob;
import com.example.publisher.model.PaymentConfirmation;
import com.example.publisher.model.ReconcileState;
import com.example.publisher.model.SkipReason;
import com.example.publisher.repository.CreditGrantJobRepository;
import com.example.publisher.repository.ProcessedEventRepository;
import com.example.publisher.repository.UserWalletRepository;
import com.example.publisher.service.dto.ReconcileOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class PaymentWebhookReconciler {

  private static final Logger logger = LoggerFactory.getLogger(PaymentWebhookReconciler.class);
  static final String CHECKOUT_COMPLETED = "checkout.session.completed";

  private final StripeSignatureVerifier signatureVerifier;
  private final ProcessedEventRepository processedEventRepository;
  private final UserWalletRepository walletRepository;
  private final CreditGrantJobRepository jobRepository;
  private final CreditGrantService creditGrantService;
  private final CreditPricing pricing;
  private final StripeWebhookProperties stripeProperties;
  private final CreditGrantSweepProperties sweepProperties;
  private final TransactionTemplate transactionTemplate;
  private final ObjectMapper objectMapper;
  private final PublisherMetrics metrics;
  private final Clock clock;

  /**
   * 役割:
   * - 署名検証 → マーカー作成 → 統計記録 → 付与 の順で webhook を照合する。
   *
   * 期待動作:
   * - 署名不正は WebhookSignatureException とし、何も書き込まない。
   * - 同じ event id の再送は SKIPPED(ALREADY_PROCESSED) で成功扱いにする。
   * - マーカー作成後の付与失敗は FAILED_RETRYABLE とし、付与ジョブを sweep に残す。
   */
  public ReconcileOutcome reconcile(String payload, String signatureHeader) {
    signatureVerifier.verify(payload, signatureHeader);
    final JsonNode event = parse(payload);
    final String eventId = requireText(event, "id");
    final String type = requireText(event, "type");
    if (!CHECKOUT_COMPLETED.equals(type)) {
      logger.debug("stripe webhook ignored eventId={} type={}", eventId, type);
      return record(ReconcileOutcome.skipped(eventId, SkipReason.UNSUPPORTED_EVENT_TYPE));
    }
    final PaymentConfirmation confirmation =
        toConfirmation(eventId, event.path("data").path("object"));
    if (confirmation.ownerKey() == null) {
      // マーカー作成前に止め、Stripe の再送で再照合できる状態を保つ
      logger.error("stripe webhook has no owner reference eventId={}", eventId);
      throw new WebhookPayloadException("metadata.userId or client_reference_id is required");
    }

    final MarkResult marked = transactionTemplate.execute(status -> markAndRecord(confirmation));
    if (marked == null) {
      throw new IllegalStateException("webhook marker transaction returned no result");
    }
    if (marked.skipReason() != null) {
      return record(ReconcileOutcome.skipped(eventId, marked.skipReason()));
    }
    return record(applyGrant(marked.job()));
  }

  private MarkResult markAndRecord(PaymentConfirmation confirmation) {
    final Instant now = Instant.now(clock);
    final String eventId = confirmation.eventId();
    if (!processedEventRepository.insertIfAbsent(eventId, now)) {
      logger.info("stripe webhook already processed eventId={}", eventId);
      return MarkResult.skip(SkipReason.ALREADY_PROCESSED);
    }
    if (!confirmation.isPaid()) {
      logger.info(
          "stripe checkout not paid eventId={} paymentStatus={}",
          eventId,
          confirmation.paymentStatus());
      return MarkResult.skip(SkipReason.NOT_PAID);
    }
    final boolean creditProduct =
        confirmation.productType() == null
            || stripeProperties.creditProductType().equals(confirmation.productType());
    final long credits = creditProduct ? computeCredits(confirmation) : 0L;
    recordPurchase(confirmation, credits, now);
    if (!creditProduct) {
      logger.info(
          "stripe checkout is not a credit product eventId={} productType={}",
          eventId,
          confirmation.productType());
      return MarkResult.skip(SkipReason.NON_CREDIT_PRODUCT);
    }
    if (credits == 0) {
      logger.warn(
          "stripe checkout resolved to zero credits eventId={} ownerKey={} amountTotal={}",
          eventId,
          confirmation.ownerKey(),
          confirmation.amountTotal());
      return MarkResult.skip(SkipReason.ZERO_CREDITS);
    }
    final UUID jobId = UUID.randomUUID();
    // 直後の付与が成功すれば sweep はこのジョブを拾わない
    jobRepository.insert(
        jobId, eventId, confirmation.ownerKey(), credits, now, now.plus(initialDelay()));
    return MarkResult.job(new CreditGrantJob(jobId, eventId, confirmation.ownerKey(), credits, 0));
  }

  private void recordPurchase(PaymentConfirmation confirmation, long credits, Instant now) {
    final long net = Math.max(0L, confirmation.amountTotal());
    long gross = net + Math.max(0L, confirmation.amountDiscount());
    if (gross <= 0) {
      gross = pricing.estimatedGrossMinorUnits(credits);
    }
    walletRepository.recordPurchase(confirmation.ownerKey(), net, gross, credits, now);
  }

  private ReconcileOutcome applyGrant(CreditGrantJob job) {
    try {
      final Optional<CreditDestination> destination = creditGrantService.apply(job, null);
      if (destination.isEmpty()) {
        return new ReconcileOutcome(
            ReconcileState.MARKED_PROCESSING, null, job.eventId(), job.credits(), null);
      }
      logger.info(
          "stripe checkout credited eventId={} ownerKey={} credits={} destination={}",
          job.eventId(),
          job.ownerKey(),
          job.credits(),
          destination.get().label());
      return ReconcileOutcome.credited(job.eventId(), job.credits(), destination.get().label());
    } catch (RuntimeException ex) {
      // マーカーは確定済みなので、付与ジョブは sweep が再試行する
      logger.error(
          "credit grant failed after marker, left for sweep eventId={} ownerKey={} jobId={}",
          job.eventId(),
          job.ownerKey(),
          job.jobId(),
          ex);
      return ReconcileOutcome.failedRetryable(job.eventId(), job.credits());
    }
  }

  /** metadata.credits が正の有限値ならそれを使い、0/非数値/負値は amount_total から換算する。 */
  private long computeCredits(PaymentConfirmation confirmation) {
    final String metadataCredits = confirmation.metadataCredits();
    if (metadataCredits != null) {
      final double parsed = parseCredits(metadataCredits);
      if (Double.isFinite(parsed) && parsed > 0) {
        return pricing.clampCredits(parsed, "eventId=" + confirmation.eventId());
      }
      logger.warn(
          "metadata.credits is not a positive number, deriving from amount eventId={} value={}",
          confirmation.eventId(),
          metadataCredits);
    }
    return pricing.creditsForAmount(confirmation.amountTotal());
  }

  private static double parseCredits(String value) {
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException ex) {
      return Double.NaN;
    }
  }

  private PaymentConfirmation toConfirmation(String eventId, JsonNode session) {
    final JsonNode metadata = session.path("metadata");
    String ownerKey = text(metadata, "userId");
    if (ownerKey == null) {
      ownerKey = text(session, "client_reference_id");
    }
    return new PaymentConfirmation(
        eventId,
        ownerKey,
        text(session, "payment_status"),
        session.path("amount_total").asLong(0L),
        session.path("total_details").path("amount_discount").asLong(0L),
        text(metadata, "credits"),
        text(metadata, "productType"));
  }

  private JsonNode parse(String payload) {
    try {
      return objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      logger.warn("stripe webhook payload is not valid json");
      throw new WebhookPayloadException("webhook payload is not valid json", ex);
    }
  }

  private ReconcileOutcome record(ReconcileOutcome outcome) {
    final String result =
        outcome.skipReason() == null
            ? outcome.state().name()
            : outcome.state().name() + "_" + outcome.skipReason().name();
    metrics.recordWebhook(result);
    return outcome;
  }

  private Duration initialDelay() {
    return sweepProperties.initialDelay() == null ? Duration.ZERO : sweepProperties.initialDelay();
  }

  private static String requireText(JsonNode node, String field) {
    final String value = text(node, field);
    if (value == null) {
      throw new WebhookPayloadException(field + " is required");
    }
    return value;
  }

  private static String text(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    final String text = value.asText();
    return text.isBlank() ? null : text;
  }

  private record MarkResult(SkipReason skipReason, CreditGrantJob job) {

    static MarkResult skip(SkipReason reason) {
      return new MarkResult(reason, null);
    }

    static MarkResult job(CreditGrantJob job) {
      return new MarkResult(null, job);
    }
  }
}
