package com.streamfirst.chainbattles.boot;

import com.streamfirst.chainbattles.adapters.InMemoryIdentifierIssuerAdapter;
import com.streamfirst.chainbattles.adapters.InMemoryOwnershipLedgerAdapter;
import com.streamfirst.chainbattles.adapters.InMemoryStatRecordStoreAdapter;
import com.streamfirst.chainbattles.application.ChainBattlesRegistry;
import com.streamfirst.chainbattles.application.MetadataAssembler;
import com.streamfirst.chainbattles.application.RegistrySettings;
import com.streamfirst.chainbattles.domain.Identity;
import com.streamfirst.chainbattles.domain.StatRecord;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.domain.TokenMetadata;
import com.streamfirst.chainbattles.domain.TrainContext;
import com.streamfirst.chainbattles.ports.IdentifierIssuerPort;
import com.streamfirst.chainbattles.ports.OwnershipLedgerPort;
import com.streamfirst.chainbattles.ports.StatRecordStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the registry over in-memory adapters and optionally runs a demo walkthrough.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ChainBattlesProperties.class)
public class ChainBattlesConfiguration {

    // --- Adapter Beans ---

    @Bean
    public OwnershipLedgerPort ownershipLedger() {
        log.info("Creating ownership ledger bean (in-memory)");
        return new InMemoryOwnershipLedgerAdapter();
    }

    @Bean
    public StatRecordStorePort statRecordStore() {
        return new InMemoryStatRecordStoreAdapter();
    }

    @Bean
    public IdentifierIssuerPort identifierIssuer() {
        return new InMemoryIdentifierIssuerAdapter();
    }

    // --- Application Beans ---

    @Bean
    public RegistrySettings registrySettings(ChainBattlesProperties properties) {
        return properties.toSettings();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChainBattlesRegistry chainBattlesRegistry(
            OwnershipLedgerPort ownershipLedger,
            StatRecordStorePort statRecordStore,
            IdentifierIssuerPort identifierIssuer,
            RegistrySettings registrySettings) {
        return ChainBattlesRegistry.create(ownershipLedger, statRecordStore, identifierIssuer, registrySettings);
    }

    // --- Demo ---

    @Bean
    @ConditionalOnProperty(prefix = "chain-battles.demo", name = "enabled", havingValue = "true")
    public CommandLineRunner demo(ChainBattlesRegistry registry, OwnershipLedgerPort ownershipLedger,
                                  ChainBattlesProperties properties, Clock clock) {
        return args -> {
            Identity owner = Identity.of(properties.getDemo().getOwner());
            log.info("--- Starting {} demo ---", registry.getSettings().getCollectionName());

            TokenId tokenId = registry.mint(owner).orElseThrow();
            log.info("STEP 1: Minted token {} for {}: {}", tokenId, owner, registry.stats(tokenId).orElseThrow());

            for (int i = 0; i < properties.getDemo().getTrainings(); i++) {
                // distinct timestamps, otherwise every round draws the same increments
                TrainContext context = TrainContext.of(clock.instant().getEpochSecond() + i, owner);
                StatRecord trained = registry.train(tokenId, owner, context).orElseThrow();
                log.info("STEP 2.{}: Trained token {}: {}", i + 1, tokenId, trained);
            }

            TokenMetadata metadata = registry.metadata(tokenId).orElseThrow();
            log.info("STEP 3: Metadata of {}: attributes={}", metadata.name(), metadata.attributes());
            log.info("  -> Image: {}", MetadataAssembler.decodeImage(metadata));

            if (ownershipLedger instanceof InMemoryOwnershipLedgerAdapter inMemory) {
                log.info("Ledger stats: {}", inMemory.getLedgerStats());
            }
            log.info("--- Demo finished: {} token(s) minted ---", registry.totalMinted());
        };
    }
}
