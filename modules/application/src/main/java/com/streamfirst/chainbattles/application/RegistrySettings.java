package com.streamfirst.chainbattles.application;

import com.streamfirst.chainbattles.domain.StatVariant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Configuration-time choices of a registry: the stat record shape and the fixed texts that end up
 * in every rendered image and metadata document.
 */
@Value
@Builder
public class RegistrySettings {

  public static final String DEFAULT_COLLECTION_NAME = "Chain Battles";
  public static final String DEFAULT_DESCRIPTION = "Battles on chain";
  public static final String DEFAULT_CHARACTER_LABEL = "Warrior";

  /** Shape of issued stat records */
  @NonNull @Builder.Default StatVariant variant = StatVariant.FULL;

  /** Prefix of every token name, followed by " #<id>" */
  @NonNull @Builder.Default String collectionName = DEFAULT_COLLECTION_NAME;

  /** Description field of every metadata document */
  @NonNull @Builder.Default String description = DEFAULT_DESCRIPTION;

  /** Title line of the rendered image */
  @NonNull @Builder.Default String characterLabel = DEFAULT_CHARACTER_LABEL;

  public static RegistrySettings defaults() {
    return RegistrySettings.builder().build();
  }
}
