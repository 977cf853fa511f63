/*
 * どこで: Publisher サービス層
 * 何を: 資格情報取得/更新の失敗を分類付きで表現する
 * なぜ: 再認可が必要か再試行で回復するかを呼び出し側が判別できるようにするため
 */
package com.example.publisher.service;

public class CredentialException extends RuntimeException {

  public enum Reason {
    NOT_CONNECTED,
    AUTH_EXPIRED,
    UPSTREAM_UNAVAILABLE
  }

  private final Reason reason;

  public CredentialException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public CredentialException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
