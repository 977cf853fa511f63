/*
 * どこで: Publisher API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.publisher.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  INVALID_SIGNATURE,
  INVALID_PAYLOAD,
  INSUFFICIENT_CREDITS,
  ACCOUNT_FORBIDDEN,
  ACCOUNT_NOT_FOUND,
  NOT_CONNECTED,
  AUTH_EXPIRED,
  UPSTREAM_UNAVAILABLE,
  DOWNLOAD_FAILED,
  REHOST_FAILED,
  GRANT_JOB_NOT_FOUND
}
