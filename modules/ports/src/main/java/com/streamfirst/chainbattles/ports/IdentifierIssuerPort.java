package com.streamfirst.chainbattles.ports;

import com.streamfirst.chainbattles.domain.TokenId;

/**
 * Port for the token identifier counter.
 * Implementations must increment atomically so that concurrent callers never share an identifier.
 */
public interface IdentifierIssuerPort {

    /**
     * Issues the next unused identifier. The first call returns 1; 0 is never returned.
     *
     * @return a fresh identifier
     * @throws com.streamfirst.chainbattles.domain.RegistryException with
     *     {@link com.streamfirst.chainbattles.domain.RegistryError#ISSUER_EXHAUSTED} if the
     *     counter cannot advance
     */
    TokenId nextId();

    /**
     * @return the most recently issued identifier value, or 0 if none was issued yet
     */
    long lastIssued();
}
