package com.streamfirst.chainbattles.domain;

import java.util.Objects;

/**
 * Opaque identity of a caller, typically an account address. Two identities are the same caller
 * only if their values match exactly.
 *
 * @param value the identity text (e.g., "0x5B38Da6a701c568545dCfcB03FcB875f56beddC4")
 */
public record Identity(String value) {
    public Identity {
        Objects.requireNonNull(value, "Identity cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Identity cannot be blank");
        }
    }

    public static Identity of(String value) {
        return new Identity(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
