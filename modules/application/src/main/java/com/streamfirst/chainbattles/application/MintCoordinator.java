package com.streamfirst.chainbattles.application;

import com.streamfirst.chainbattles.domain.Identity;
import com.streamfirst.chainbattles.domain.RegistryException;
import com.streamfirst.chainbattles.domain.Result;
import com.streamfirst.chainbattles.domain.StatRecord;
import com.streamfirst.chainbattles.domain.StatVariant;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.ports.IdentifierIssuerPort;
import com.streamfirst.chainbattles.ports.OwnershipLedgerPort;
import com.streamfirst.chainbattles.ports.StatRecordStorePort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues new tokens: assigns ownership, stores baseline stats and publishes the first metadata
 * snapshot into the ledger's URI slot.
 */
@Slf4j
@RequiredArgsConstructor
public class MintCoordinator {

  private final IdentifierIssuerPort identifierIssuer;
  private final OwnershipLedgerPort ownershipLedger;
  private final StatRecordStorePort statRecordStore;
  private final MetadataAssembler metadataAssembler;
  private final TokenLockRegistry lockRegistry;
  private final StatVariant variant;

  /**
   * Mints a token owned by {@code caller}. Nothing is written when no identifier can be issued.
   *
   * @return the identifier of the new token, or {@code ISSUER_EXHAUSTED}
   */
  public Result<TokenId> mint(@NonNull Identity caller) {
    TokenId tokenId;
    try {
      tokenId = identifierIssuer.nextId();
    } catch (RegistryException e) {
      log.warn("Rejected mint for {}: {}", caller, e.getMessage());
      return Result.failure(e.getError(), e.getMessage());
    }

    return lockRegistry.withWriteLock(
        tokenId,
        () -> {
          ownershipLedger.assign(tokenId, caller);

          StatRecord baseline = StatRecord.baseline(variant);
          statRecordStore.create(tokenId, baseline);
          ownershipLedger.setTokenUri(tokenId, metadataAssembler.buildMetadata(tokenId, baseline));

          log.info("Minted token {} for {} with {}", tokenId, caller, baseline);
          return Result.success(tokenId);
        });
  }
}
