package com.streamfirst.chainbattles.application;

import com.streamfirst.chainbattles.domain.Identity;
import com.streamfirst.chainbattles.domain.RegistryError;
import com.streamfirst.chainbattles.domain.Result;
import com.streamfirst.chainbattles.domain.StatRecord;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.domain.TrainContext;
import com.streamfirst.chainbattles.ports.OwnershipLedgerPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs train events: authorization, stat advancement and metadata refresh as one step per token.
 * A rejected call changes nothing.
 */
@Slf4j
@RequiredArgsConstructor
public class TrainCoordinator {

  private final AccessGuard accessGuard;
  private final StatAdvancementEngine advancementEngine;
  private final MetadataAssembler metadataAssembler;
  private final OwnershipLedgerPort ownershipLedger;
  private final TokenLockRegistry lockRegistry;

  /**
   * Trains {@code tokenId} on behalf of {@code caller}.
   *
   * @return the updated stats, or the {@link AccessGuard} failure
   */
  public Result<StatRecord> train(
      @NonNull TokenId tokenId, @NonNull Identity caller, @NonNull TrainContext context) {
    // tokens are never deleted, so an unissued id needs no lock to be turned away
    if (!ownershipLedger.exists(tokenId)) {
      log.warn("Rejected train of nonexistent token {} by {}", tokenId, caller);
      return Result.failure(RegistryError.NOT_FOUND, "Token " + tokenId + " does not exist");
    }

    return lockRegistry.withWriteLock(
        tokenId,
        () -> {
          Result<StatRecord> result =
              accessGuard
                  .authorizeMutation(tokenId, caller)
                  .flatMap(authorized -> Result.success(advance(tokenId, caller, context)));
          if (result.isFailure()) {
            log.warn("Rejected train of token {} by {}: {}", tokenId, caller, result);
          }
          return result;
        });
  }

  private StatRecord advance(TokenId tokenId, Identity caller, TrainContext context) {
    StatRecord updated = advancementEngine.train(tokenId, caller, context);
    ownershipLedger.setTokenUri(tokenId, metadataAssembler.buildMetadata(tokenId, updated));

    log.info("Trained token {} to level {}", tokenId, updated.level());
    return updated;
  }
}
