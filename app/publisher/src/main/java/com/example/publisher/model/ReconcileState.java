/*
 * どこで: Publisher モデル
 * 何を: 決済 webhook 照合の状態を定義する
 * なぜ: 応答コードとメトリクスを状態から一意に決めるため
 */
package com.example.publisher.model;

public enum ReconcileState {
  RECEIVED,
  MARKED_PROCESSING,
  CREDITED,
  SKIPPED,
  FAILED_RETRYABLE
}
