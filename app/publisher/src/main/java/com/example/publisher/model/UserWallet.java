package com.example.publisher.model;

import java.time.Instant;

// 金額は最小通貨単位(cent)で保持する
public record UserWallet(
    String ownerKey,
    long balance,
    long totalPaidNet,
    long totalPaidGross,
    long totalPurchases,
    long totalCreditsPurchased,
    Instant lastPurchaseAt) {

  public static UserWallet empty(String ownerKey) {
    return new UserWallet(ownerKey, 0L, 0L, 0L, 0L, 0L, null);
  }
}
