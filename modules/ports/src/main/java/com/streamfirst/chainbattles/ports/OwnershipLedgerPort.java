package com.streamfirst.chainbattles.ports;

import com.streamfirst.chainbattles.domain.Identity;
import com.streamfirst.chainbattles.domain.TokenId;

import java.util.Optional;

/**
 * Port to the external ownership ledger.
 * The registry only ever asks whether a token exists, who owns it, and reads or replaces the
 * token's URI slot. Transfers and approvals belong to the ledger and are not reachable from here.
 */
public interface OwnershipLedgerPort {

    /**
     * Checks whether the ledger knows the token.
     *
     * @param tokenId the token identifier
     * @return true if an owner is recorded for the token
     */
    boolean exists(TokenId tokenId);

    /**
     * Gets the current owner of a token.
     *
     * @param tokenId the token identifier
     * @return the owner, or empty if the token does not exist
     */
    Optional<Identity> ownerOf(TokenId tokenId);

    /**
     * Records {@code owner} as the owner of a freshly issued token.
     *
     * @param tokenId the token identifier
     * @param owner the new owner
     * @throws IllegalStateException if the token already has an owner
     */
    void assign(TokenId tokenId, Identity owner);

    /**
     * Replaces the URI slot of an existing token.
     *
     * @param tokenId the token identifier
     * @param uri the encoded metadata reference
     * @throws IllegalStateException if the token does not exist
     */
    void setTokenUri(TokenId tokenId, String uri);

    /**
     * Reads the URI slot of a token.
     *
     * @param tokenId the token identifier
     * @return the stored URI, or empty if the token does not exist or has no URI yet
     */
    Optional<String> getTokenUri(TokenId tokenId);
}
