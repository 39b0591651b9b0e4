package com.streamfirst.chainbattles.domain;

import lombok.NonNull;

import java.util.List;

/**
 * Decoded view of a token's metadata document.
 *
 * @param name display name, e.g. "Chain Battles #1"
 * @param description collection description
 * @param image the embedded image as a {@code data:image/svg+xml;base64,} URI
 * @param attributes published traits; empty for reduced stat records
 */
public record TokenMetadata(
    @NonNull String name,
    @NonNull String description,
    @NonNull String image,
    @NonNull List<StatAttribute> attributes
) {
    public TokenMetadata {
        attributes = List.copyOf(attributes);
    }
}
