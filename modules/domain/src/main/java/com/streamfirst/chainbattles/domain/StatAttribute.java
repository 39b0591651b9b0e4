package com.streamfirst.chainbattles.domain;

import lombok.NonNull;

/**
 * One trait of a token's metadata, e.g. {@code {"trait_type":"health","value":"10"}}.
 *
 * @param traitType the trait name
 * @param value the trait value as decimal text
 */
public record StatAttribute(@NonNull String traitType, @NonNull String value) {

    public static StatAttribute of(String traitType, long value) {
        return new StatAttribute(traitType, Long.toString(value));
    }
}
