package com.streamfirst.chainbattles.application;

import com.streamfirst.chainbattles.domain.Identity;
import com.streamfirst.chainbattles.domain.RegistryError;
import com.streamfirst.chainbattles.domain.Result;
import com.streamfirst.chainbattles.domain.StatRecord;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.domain.TokenMetadata;
import com.streamfirst.chainbattles.ports.IdentifierIssuerPort;
import com.streamfirst.chainbattles.ports.OwnershipLedgerPort;
import com.streamfirst.chainbattles.ports.StatRecordStorePort;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.ToLongFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only access to tokens. URIs are served as stored at the last mint or train, never
 * re-rendered on read. Stat accessors treat unissued tokens as all-zero.
 *
 * <p>Each read holds the token's read lock, so it sees a token either before or after a mint or
 * train, never in between.
 */
@Slf4j
@RequiredArgsConstructor
public class TokenQueryService {

  private final OwnershipLedgerPort ownershipLedger;
  private final StatRecordStorePort statRecordStore;
  private final IdentifierIssuerPort identifierIssuer;
  private final MetadataAssembler metadataAssembler;
  private final TokenLockRegistry lockRegistry;

  /**
   * Gets the metadata URI snapshot of a token.
   *
   * @return the stored URI, or {@link RegistryError#NOT_FOUND} for an unissued token
   */
  public Result<String> tokenUri(TokenId tokenId) {
    return read(tokenId, () -> storedUri(tokenId), () -> missing(tokenId));
  }

  /** Decodes the stored metadata snapshot of a token. */
  public Result<TokenMetadata> metadata(TokenId tokenId) {
    return tokenUri(tokenId).map(metadataAssembler::parse);
  }

  public Optional<StatRecord> stats(TokenId tokenId) {
    return read(tokenId, () -> statRecordStore.get(tokenId), Optional::empty);
  }

  public long level(TokenId tokenId) {
    return stat(tokenId, StatRecord::level);
  }

  public long health(TokenId tokenId) {
    return stat(tokenId, StatRecord::health);
  }

  public long strength(TokenId tokenId) {
    return stat(tokenId, StatRecord::strength);
  }

  public long speed(TokenId tokenId) {
    return stat(tokenId, StatRecord::speed);
  }

  public Optional<Identity> ownerOf(TokenId tokenId) {
    return read(tokenId, () -> ownershipLedger.ownerOf(tokenId), Optional::empty);
  }

  /** Number of tokens minted so far, which is also the highest issued identifier. */
  public long totalMinted() {
    return identifierIssuer.lastIssued();
  }

  private long stat(TokenId tokenId, ToLongFunction<StatRecord> accessor) {
    return stats(tokenId).map(accessor::applyAsLong).orElse(0L);
  }

  /**
   * Runs {@code action} under the token's read lock. A token with no lock entry that is not in the
   * ledger has not started minting, so {@code absent} answers without creating an entry.
   */
  private <T> T read(TokenId tokenId, Supplier<T> action, Supplier<T> absent) {
    if (!lockRegistry.isTracked(tokenId) && !ownershipLedger.exists(tokenId)) {
      return absent.get();
    }
    return lockRegistry.withReadLock(tokenId, action);
  }

  private Result<String> storedUri(TokenId tokenId) {
    if (!ownershipLedger.exists(tokenId)) {
      return missing(tokenId);
    }
    return ownershipLedger
        .getTokenUri(tokenId)
        .map(Result::success)
        .orElseGet(
            () ->
                Result.failure(
                    RegistryError.NOT_FOUND, "Token " + tokenId + " has no metadata yet"));
  }

  private Result<String> missing(TokenId tokenId) {
    log.debug("URI requested for nonexistent token {}", tokenId);
    return Result.failure(RegistryError.NOT_FOUND, "Token " + tokenId + " does not exist");
  }
}
