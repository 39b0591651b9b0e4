package com.streamfirst.chainbattles.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.chainbattles.adapters.InMemoryIdentifierIssuerAdapter;
import com.streamfirst.chainbattles.adapters.InMemoryOwnershipLedgerAdapter;
import com.streamfirst.chainbattles.adapters.InMemoryStatRecordStoreAdapter;
import com.streamfirst.chainbattles.domain.Identity;
import com.streamfirst.chainbattles.domain.RegistryError;
import com.streamfirst.chainbattles.domain.Result;
import com.streamfirst.chainbattles.domain.StatRecord;
import com.streamfirst.chainbattles.domain.StatVariant;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.domain.TrainContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrainCoordinatorTest {

  private static final Identity OWNER = Identity.of("0xA11CE");
  private static final Identity STRANGER = Identity.of("0xB0B");
  private static final TokenId ISSUED = TokenId.of(1);
  private static final TrainContext CONTEXT = TrainContext.of(1_700_000_000L, OWNER);

  private InMemoryStatRecordStoreAdapter store;
  private TokenLockRegistry lockRegistry;
  private TrainCoordinator coordinator;
  private TokenQueryService queryService;

  @BeforeEach
  void setUp() {
    InMemoryOwnershipLedgerAdapter ledger = new InMemoryOwnershipLedgerAdapter();
    store = new InMemoryStatRecordStoreAdapter();
    lockRegistry = new TokenLockRegistry();
    MetadataAssembler assembler =
        new MetadataAssembler(new SvgImageRenderer(), RegistrySettings.defaults());

    ledger.assign(ISSUED, OWNER);
    store.create(ISSUED, StatRecord.baseline(StatVariant.FULL));

    coordinator =
        new TrainCoordinator(
            new AccessGuard(ledger),
            new StatAdvancementEngine(store, new StatSeedHasher()),
            assembler,
            ledger,
            lockRegistry);
    queryService =
        new TokenQueryService(
            ledger, store, new InMemoryIdentifierIssuerAdapter(1), assembler, lockRegistry);
  }

  @Test
  void rejectedTrainsOfUnissuedTokensLeaveNoLockBehind() {
    for (long id = 1_000; id < 2_000; id++) {
      Result<StatRecord> result = coordinator.train(TokenId.of(id), OWNER, CONTEXT);
      assertThat(result.getError()).contains(RegistryError.NOT_FOUND);
    }

    assertThat(lockRegistry.size()).isZero();
  }

  @Test
  void readsOfUnissuedTokensLeaveNoLockBehind() {
    for (long id = 1_000; id < 2_000; id++) {
      TokenId unissued = TokenId.of(id);
      assertThat(queryService.level(unissued)).isZero();
      assertThat(queryService.tokenUri(unissued).isFailure()).isTrue();
      assertThat(queryService.ownerOf(unissued)).isEmpty();
    }

    assertThat(lockRegistry.size()).isZero();
  }

  @Test
  void issuedTokenKeepsASingleLock() {
    coordinator.train(ISSUED, OWNER, CONTEXT).orElseThrow();
    Result<StatRecord> rejected = coordinator.train(ISSUED, STRANGER, CONTEXT);

    assertThat(rejected.getError()).contains(RegistryError.NOT_OWNER);
    assertThat(queryService.level(ISSUED)).isEqualTo(1);
    assertThat(lockRegistry.isTracked(ISSUED)).isTrue();
    assertThat(lockRegistry.size()).isEqualTo(1);
  }
}
