/*
 * どこで: 共通ロックユーティリティ
 * 何を: 任意の文字列から 64-bit advisory lock のキーを生成する
 * なぜ: hashtext(32-bit) の衝突による不要な直列化を避けるため
 */
package com.example.common.lock;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class AdvisoryLockKeys {

  // 64-bit advisory lock 用に SHA-256 の先頭 8byte を使う。
  static final int LOCK_KEY_BYTES = 8;

  private AdvisoryLockKeys() {}

  /** 用途ごとに名前空間を分け、別用途の同名キーと同じロックを取り合わないようにする。 */
  public static long of(String namespace, String key) {
    return of(namespace + ":" + key);
  }

  public static long of(String value) {
    final byte[] hashed = sha256(value);
    // ByteBuffer は Big Endian が既定。言語間での再現性を優先して変更しない。
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private static byte[] sha256(String value) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      // JVM が SHA-256 を提供しない場合は実行環境の前提が崩れているため即失敗させる。
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
