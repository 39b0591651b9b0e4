package com.streamfirst.chainbattles.domain;

/**
 * Identifier of an issued token. Issued values start at 1 and only ever grow; 0 is representable
 * so that lookups of unissued identifiers stay total, but the issuer never hands it out.
 *
 * @param value the unsigned identifier value
 */
public record TokenId(long value) {
    public TokenId {
        if (value < 0) {
            throw new IllegalArgumentException("Token ID cannot be negative: " + value);
        }
    }

    public static TokenId of(long value) {
        return new TokenId(value);
    }

    /**
     * Decimal text of the identifier, as it appears in metadata names and hash seeds.
     */
    public String toDecimalString() {
        return Long.toString(value);
    }

    @Override
    public String toString() {
        return toDecimalString();
    }
}
