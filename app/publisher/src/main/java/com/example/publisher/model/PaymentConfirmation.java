/*
 * どこで: Publisher モデル
 * 何を: checkout.session.completed から取り出した照合用の値を保持する
 * なぜ: webhook JSON の構造を照合ロジックへ漏らさないため
 */
package com.example.publisher.model;

public record PaymentConfirmation(
    String eventId,
    String ownerKey,
    String paymentStatus,
    long amountTotal,
    long amountDiscount,
    String metadataCredits,
    String productType) {

  public boolean isPaid() {
    return "paid".equals(paymentStatus);
  }
}
