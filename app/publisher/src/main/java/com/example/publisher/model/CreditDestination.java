package com.example.publisher.model;

/** クレジットの付与先。ACCOUNT の場合のみ accountId を持つ。 */
public record CreditDestination(CreditSource source, String accountId) {

  private static final String WALLET_LABEL = "WALLET";
  private static final String ACCOUNT_PREFIX = "ACCOUNT:";

  public CreditDestination {
    if (source == null) {
      throw new IllegalArgumentException("source is required");
    }
    if (source == CreditSource.ACCOUNT && (accountId == null || accountId.isBlank())) {
      throw new IllegalArgumentException("accountId is required for account destination");
    }
    if (source == CreditSource.WALLET) {
      accountId = null;
    }
  }

  public static CreditDestination wallet() {
    return new CreditDestination(CreditSource.WALLET, null);
  }

  public static CreditDestination account(String accountId) {
    return new CreditDestination(CreditSource.ACCOUNT, accountId);
  }

  /** credit_grant_jobs.destination へ保存する表記。 */
  public String label() {
    return source == CreditSource.WALLET ? WALLET_LABEL : ACCOUNT_PREFIX + accountId;
  }
}
