/*
 * どこで: Publisher サービス層
 * 何を: メディアのダウンロード/再ホスト失敗を表現する
 * なぜ: API 層で HTTP ステータスへ一貫変換するため
 */
package com.example.publisher.service;

public class MediaException extends RuntimeException {

  public enum Reason {
    DOWNLOAD_FAILED,
    REHOST_FAILED
  }

  private final Reason reason;

  public MediaException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public MediaException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
