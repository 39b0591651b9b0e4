package com.streamfirst.chainbattles.application;

import com.streamfirst.chainbattles.domain.Identity;
import com.streamfirst.chainbattles.domain.Result;
import com.streamfirst.chainbattles.domain.StatRecord;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.domain.TokenMetadata;
import com.streamfirst.chainbattles.domain.TrainContext;
import com.streamfirst.chainbattles.ports.IdentifierIssuerPort;
import com.streamfirst.chainbattles.ports.OwnershipLedgerPort;
import com.streamfirst.chainbattles.ports.StatRecordStorePort;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the registry: mint, train, tokenURI and the per-stat accessors over one set of
 * ports.
 */
@Slf4j
@Getter
public class ChainBattlesRegistry {

  private final RegistrySettings settings;
  private final MintCoordinator mintCoordinator;
  private final TrainCoordinator trainCoordinator;
  private final TokenQueryService queryService;

  public ChainBattlesRegistry(
      MintCoordinator mintCoordinator,
      TrainCoordinator trainCoordinator,
      TokenQueryService queryService,
      RegistrySettings settings) {
    this.mintCoordinator = mintCoordinator;
    this.trainCoordinator = trainCoordinator;
    this.queryService = queryService;
    this.settings = settings;
  }

  /** Wires every service of the registry over the given ports. */
  public static ChainBattlesRegistry create(
      OwnershipLedgerPort ownershipLedger,
      StatRecordStorePort statRecordStore,
      IdentifierIssuerPort identifierIssuer,
      RegistrySettings settings) {
    log.info(
        "Creating {} registry with {} stat records",
        settings.getCollectionName(),
        settings.getVariant());

    TokenLockRegistry lockRegistry = new TokenLockRegistry();
    MetadataAssembler metadataAssembler =
        new MetadataAssembler(new SvgImageRenderer(settings.getCharacterLabel()), settings);
    StatAdvancementEngine advancementEngine =
        new StatAdvancementEngine(statRecordStore, new StatSeedHasher());

    MintCoordinator mintCoordinator =
        new MintCoordinator(
            identifierIssuer,
            ownershipLedger,
            statRecordStore,
            metadataAssembler,
            lockRegistry,
            settings.getVariant());
    TrainCoordinator trainCoordinator =
        new TrainCoordinator(
            new AccessGuard(ownershipLedger),
            advancementEngine,
            metadataAssembler,
            ownershipLedger,
            lockRegistry);
    TokenQueryService queryService =
        new TokenQueryService(
            ownershipLedger, statRecordStore, identifierIssuer, metadataAssembler, lockRegistry);

    return new ChainBattlesRegistry(mintCoordinator, trainCoordinator, queryService, settings);
  }

  public Result<TokenId> mint(Identity caller) {
    return mintCoordinator.mint(caller);
  }

  public Result<StatRecord> train(TokenId tokenId, Identity caller, TrainContext context) {
    return trainCoordinator.train(tokenId, caller, context);
  }

  public Result<String> tokenUri(TokenId tokenId) {
    return queryService.tokenUri(tokenId);
  }

  public Result<TokenMetadata> metadata(TokenId tokenId) {
    return queryService.metadata(tokenId);
  }

  public Optional<StatRecord> stats(TokenId tokenId) {
    return queryService.stats(tokenId);
  }

  public long level(TokenId tokenId) {
    return queryService.level(tokenId);
  }

  public long health(TokenId tokenId) {
    return queryService.health(tokenId);
  }

  public long strength(TokenId tokenId) {
    return queryService.strength(tokenId);
  }

  public long speed(TokenId tokenId) {
    return queryService.speed(tokenId);
  }

  public Optional<Identity> ownerOf(TokenId tokenId) {
    return queryService.ownerOf(tokenId);
  }

  public long totalMinted() {
    return queryService.totalMinted();
  }
}
