package com.streamfirst.chainbattles.application;

import com.streamfirst.chainbattles.domain.Identity;
import com.streamfirst.chainbattles.domain.StatRecord;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.domain.TrainContext;
import com.streamfirst.chainbattles.ports.StatRecordStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes and stores the stats a token reaches after one train event. Callers must have passed
 * the {@link AccessGuard} and must hold the token's lock.
 */
@Slf4j
@RequiredArgsConstructor
public class StatAdvancementEngine {

  static final int HEALTH_GROWTH_BOUND = 10;
  static final int STRENGTH_GROWTH_BOUND = 6;
  static final int SPEED_GROWTH_BOUND = 3;

  private final StatRecordStorePort statRecordStore;
  private final StatSeedHasher hasher;

  /**
   * Advances the stored record of {@code tokenId} by one train event and persists the result.
   *
   * @return the updated record
   * @throws IllegalStateException if the token has no record
   */
  public StatRecord train(TokenId tokenId, Identity caller, TrainContext context) {
    StatRecord current =
        statRecordStore
            .get(tokenId)
            .orElseThrow(
                () -> new IllegalStateException("No stat record exists for token " + tokenId));

    StatRecord updated = advance(current, tokenId, caller, context);
    statRecordStore.set(tokenId, updated);

    log.debug(
        "Trained token {} for {} (origin {}): {} -> {}",
        tokenId,
        caller,
        context.txOrigin(),
        current,
        updated);
    return updated;
  }

  /**
   * Pure form of {@link #train}: the record {@code current} becomes after one train event.
   *
   * <p>The level always grows by one. Full records additionally grow health by {@code hash mod
   * 10}, strength by {@code hash mod 6} and speed by {@code hash mod 3}. The hash is evaluated once
   * per stat over the same seed, so the three increments are correlated.
   */
  public StatRecord advance(
      StatRecord current, TokenId tokenId, Identity caller, TrainContext context) {
    StatRecord leveled = current.withLevel(current.level() + 1);
    if (!current.isFull()) {
      return leveled;
    }

    long timestamp = context.timestamp();
    long healthDelta = hasher.bounded(timestamp, caller, tokenId, HEALTH_GROWTH_BOUND);
    long strengthDelta = hasher.bounded(timestamp, caller, tokenId, STRENGTH_GROWTH_BOUND);
    long speedDelta = hasher.bounded(timestamp, caller, tokenId, SPEED_GROWTH_BOUND);

    return leveled
        .withHealth(current.health() + healthDelta)
        .withStrength(current.strength() + strengthDelta)
        .withSpeed(current.speed() + speedDelta);
  }
}
