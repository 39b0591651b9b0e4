package com.streamfirst.chainbattles.application;

import com.streamfirst.chainbattles.domain.TokenId;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * One read/write lock per token. Mutations of the same token run one at a time and readers never
 * observe a mutation halfway; different tokens never contend.
 *
 * <p>Callers only lock tokens that exist or are being minted, so the map holds at most one entry
 * per issued identifier.
 */
public class TokenLockRegistry {

  private final Map<TokenId, ReadWriteLock> locks = new ConcurrentHashMap<>();

  /** Runs {@code action} while holding the write lock of {@code tokenId}. */
  public <T> T withWriteLock(TokenId tokenId, Supplier<T> action) {
    return runLocked(lockFor(tokenId).writeLock(), action);
  }

  /** Runs {@code action} while holding the read lock of {@code tokenId}. */
  public <T> T withReadLock(TokenId tokenId, Supplier<T> action) {
    return runLocked(lockFor(tokenId).readLock(), action);
  }

  /** Whether a lock was ever taken for {@code tokenId}. */
  public boolean isTracked(TokenId tokenId) {
    return locks.containsKey(tokenId);
  }

  /** Number of tokens holding a lock entry. */
  public int size() {
    return locks.size();
  }

  private ReadWriteLock lockFor(TokenId tokenId) {
    return locks.computeIfAbsent(tokenId, id -> new ReentrantReadWriteLock());
  }

  private static <T> T runLocked(Lock lock, Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
