package com.streamfirst.chainbattles.boot;

import com.streamfirst.chainbattles.adapters.InMemoryOwnershipLedgerAdapter;
import com.streamfirst.chainbattles.application.ChainBattlesRegistry;
import com.streamfirst.chainbattles.application.RegistrySettings;
import com.streamfirst.chainbattles.domain.Identity;
import com.streamfirst.chainbattles.domain.StatVariant;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.domain.TokenMetadata;
import com.streamfirst.chainbattles.ports.OwnershipLedgerPort;
import org.junit.jupiter.api.Test;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class ChainBattlesConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(ChainBattlesConfiguration.class);

    @Test
    void wiresRegistryWithDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ChainBattlesRegistry.class);
            assertThat(context).doesNotHaveBean(CommandLineRunner.class);

            RegistrySettings settings = context.getBean(RegistrySettings.class);
            assertThat(settings).isEqualTo(RegistrySettings.defaults());

            ChainBattlesRegistry registry = context.getBean(ChainBattlesRegistry.class);
            TokenId tokenId = registry.mint(Identity.of("0xA11CE")).orElseThrow();
            assertThat(registry.metadata(tokenId).orElseThrow().name()).isEqualTo("Chain Battles #1");
        });
    }

    @Test
    void bindsCustomSettings() {
        contextRunner
            .withPropertyValues(
                "chain-battles.variant=reduced",
                "chain-battles.collection-name=Arena",
                "chain-battles.description=Pit fights",
                "chain-battles.character-label=Rogue")
            .run(context -> {
                RegistrySettings settings = context.getBean(RegistrySettings.class);
                assertThat(settings.getVariant()).isEqualTo(StatVariant.REDUCED);

                ChainBattlesRegistry registry = context.getBean(ChainBattlesRegistry.class);
                TokenMetadata metadata = registry.metadata(registry.mint(Identity.of("0xA11CE")).orElseThrow()).orElseThrow();
                assertThat(metadata.name()).isEqualTo("Arena #1");
                assertThat(metadata.description()).isEqualTo("Pit fights");
                assertThat(metadata.attributes()).isEmpty();
            });
    }

    @Test
    void demoRunnerMintsAndTrains() {
        contextRunner
            .withPropertyValues("chain-battles.demo.enabled=true", "chain-battles.demo.trainings=3")
            .run(context -> {
                context.getBean(CommandLineRunner.class).run();

                ChainBattlesRegistry registry = context.getBean(ChainBattlesRegistry.class);
                assertThat(registry.totalMinted()).isEqualTo(1);
                assertThat(registry.level(TokenId.of(1))).isEqualTo(3);
                assertThat(registry.ownerOf(TokenId.of(1)))
                    .contains(Identity.of("0x5B38Da6a701c568545dCfcB03FcB875f56beddC4"));

                OwnershipLedgerPort ledger = context.getBean(OwnershipLedgerPort.class);
                assertThat(ledger).isInstanceOf(InMemoryOwnershipLedgerAdapter.class);
                assertThat(((InMemoryOwnershipLedgerAdapter) ledger).getLedgerStats())
                    .containsEntry("tokens", 1)
                    .containsEntry("owners", 1)
                    .containsEntry("token_uris", 1);
            });
    }
}
