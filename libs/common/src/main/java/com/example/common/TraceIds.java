/*
 * どこで: 共通ユーティリティ
 * 何を: リクエスト/ワーカー処理を追跡する ID を払い出す
 * なぜ: ログ横断で同一処理を突き合わせるため
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String orNew(String candidate) {
    return candidate == null || candidate.isBlank() ? newTraceId() : candidate;
  }
}
