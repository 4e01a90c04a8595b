/*
 * どこで: 共通ユーティリティ (並行制御)
 * 何を: 文字列キーごとの排他区間を提供する
 * なぜ: 全体ロックを使わず、同一パッケージ/同一ロケーションだけを直列化するため
 */
package com.trackit.common.concurrent;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

public final class KeyedLocks {

  private final ConcurrentMap<String, Holder> holders = new ConcurrentHashMap<>();

  public <T> T withLock(String key, Supplier<T> action) {
    if (key == null) {
      throw new IllegalArgumentException("lock key is required");
    }
    final Holder holder = acquireHolder(key);
    holder.lock.lock();
    try {
      return action.get();
    } finally {
      holder.lock.unlock();
      releaseHolder(key);
    }
  }

  public void withLock(String key, Runnable action) {
    withLock(
        key,
        () -> {
          action.run();
          return null;
        });
  }

  /** 現在ロック待ち/保持中のキー数。待機者がいなくなったキーはマップから外れる。 */
  public int activeKeys() {
    return holders.size();
  }

  private Holder acquireHolder(String key) {
    // compute はキー単位で原子的なので、参照カウントの増減と削除が競合しない。
    return holders.compute(
        key,
        (ignored, existing) -> {
          final Holder holder = existing == null ? new Holder() : existing;
          holder.references++;
          return holder;
        });
  }

  private void releaseHolder(String key) {
    holders.computeIfPresent(
        key,
        (ignored, existing) -> {
          existing.references--;
          return existing.references == 0 ? null : existing;
        });
  }

  private static final class Holder {
    private final ReentrantLock lock = new ReentrantLock();
    private int references;
  }
}
