/*
 * どこで: 共通並行処理ユーティリティ
 * 何を: 同一キーの処理をプロセス内で 1 本に束ね、待機者へ同じ結果を配る
 * なぜ: トークン更新やメディア再ホストのような副作用を重複実行させないため
 */
package com.example.common.concurrent;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * キー単位の single-flight 実行器。
 *
 * <p>先着スレッドだけが {@code loader} を実行し、実行中に到着した同一キーの呼び出しは
 * その完了を待って同じ値(または同じ例外)を受け取る。完了後のエントリは即座に取り除かれるため、
 * 結果はキャッシュされない。
 */
public final class SingleFlight<K, V> {

  private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

  public V execute(K key, Supplier<V> loader) {
    final CompletableFuture<V> created = new CompletableFuture<>();
    final CompletableFuture<V> existing = inFlight.putIfAbsent(key, created);
    if (existing != null) {
      return await(existing);
    }
    try {
      final V value = loader.get();
      created.complete(value);
      return value;
    } catch (RuntimeException | Error ex) {
      created.completeExceptionally(ex);
      throw ex;
    } finally {
      // 自分が登録したエントリだけを消す
      inFlight.remove(key, created);
    }
  }

  public int inFlightCount() {
    return inFlight.size();
  }

  private V await(CompletableFuture<V> future) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw ex;
    }
  }
}
