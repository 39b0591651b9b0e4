package com.streamfirst.chainbattles.adapters;

import com.streamfirst.chainbattles.domain.Identity;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.ports.OwnershipLedgerPort;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of OwnershipLedgerPort for testing and development.
 * Tracks single ownership and the per-token URI slot in concurrent maps.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryOwnershipLedgerAdapter implements OwnershipLedgerPort {

    private final Map<TokenId, Identity> owners = new ConcurrentHashMap<>();

    private final Map<TokenId, String> tokenUris = new ConcurrentHashMap<>();

    @Override
    public boolean exists(TokenId tokenId) {
        return owners.containsKey(tokenId);
    }

    @Override
    public Optional<Identity> ownerOf(TokenId tokenId) {
        Identity owner = owners.get(tokenId);
        if (owner == null) {
            log.debug("No owner recorded for token {}", tokenId);
        }
        return Optional.ofNullable(owner);
    }

    @Override
    public void assign(TokenId tokenId, Identity owner) {
        Identity existing = owners.putIfAbsent(tokenId, owner);
        if (existing != null) {
            throw new IllegalStateException(
                "Token " + tokenId + " is already owned by " + existing);
        }
        log.info("Assigned token {} to {}", tokenId, owner);
    }

    @Override
    public void setTokenUri(TokenId tokenId, String uri) {
        if (!owners.containsKey(tokenId)) {
            throw new IllegalStateException("Cannot set URI of nonexistent token " + tokenId);
        }
        String previous = tokenUris.put(tokenId, uri);
        log.debug("{} URI of token {} ({} chars)",
                 previous == null ? "Stored" : "Replaced", tokenId, uri.length());
    }

    @Override
    public Optional<String> getTokenUri(TokenId tokenId) {
        return Optional.ofNullable(tokenUris.get(tokenId));
    }

    /**
     * Clears all ledger data. Useful for testing.
     */
    public void clear() {
        log.info("Clearing all ownership data");
        owners.clear();
        tokenUris.clear();
    }

    /**
     * Gets ledger statistics for monitoring.
     */
    public Map<String, Integer> getLedgerStats() {
        Map<String, Integer> stats = new HashMap<>();
        stats.put("tokens", owners.size());
        stats.put("owners", (int) owners.values().stream().distinct().count());
        stats.put("token_uris", tokenUris.size());
        return stats;
    }
}
