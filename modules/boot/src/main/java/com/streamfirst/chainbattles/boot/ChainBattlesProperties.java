package com.streamfirst.chainbattles.boot;

import com.streamfirst.chainbattles.application.RegistrySettings;
import com.streamfirst.chainbattles.domain.StatVariant;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized registry configuration, bound from the {@code chain-battles} prefix.
 */
@Data
@ConfigurationProperties(prefix = "chain-battles")
public class ChainBattlesProperties {

    private StatVariant variant = StatVariant.FULL;

    private String collectionName = RegistrySettings.DEFAULT_COLLECTION_NAME;

    private String description = RegistrySettings.DEFAULT_DESCRIPTION;

    private String characterLabel = RegistrySettings.DEFAULT_CHARACTER_LABEL;

    private Demo demo = new Demo();

    public RegistrySettings toSettings() {
        return RegistrySettings.builder()
            .variant(variant)
            .collectionName(collectionName)
            .description(description)
            .characterLabel(characterLabel)
            .build();
    }

    @Data
    public static class Demo {

        /** Runs the mint-and-train walkthrough on startup */
        private boolean enabled = false;

        /** Identity that mints and trains the demo token */
        private String owner = "0x5B38Da6a701c568545dCfcB03FcB875f56beddC4";

        /** Number of train events applied to the demo token */
        private int trainings = 2;
    }
}
