package com.streamfirst.chainbattles.adapters;

import com.streamfirst.chainbattles.domain.StatRecord;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.ports.StatRecordStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of StatRecordStorePort backed by a concurrent map.
 * Records are immutable values, so readers never see a half-applied update.
 */
@Slf4j
public class InMemoryStatRecordStoreAdapter implements StatRecordStorePort {

    private final Map<TokenId, StatRecord> records = new ConcurrentHashMap<>();

    @Override
    public void create(TokenId tokenId, StatRecord record) {
        StatRecord existing = records.putIfAbsent(tokenId, record);
        if (existing != null) {
            throw new IllegalStateException("Stat record already exists for token " + tokenId);
        }
        log.debug("Created stat record for token {}: {}", tokenId, record);
    }

    @Override
    public Optional<StatRecord> get(TokenId tokenId) {
        return Optional.ofNullable(records.get(tokenId));
    }

    @Override
    public void set(TokenId tokenId, StatRecord record) {
        StatRecord updated = records.computeIfPresent(tokenId, (id, current) -> record);
        if (updated == null) {
            throw new IllegalStateException("No stat record exists for token " + tokenId);
        }
        log.debug("Updated stat record for token {}: {}", tokenId, record);
    }

    @Override
    public long count() {
        return records.size();
    }

    /**
     * Clears all records. Useful for testing.
     */
    public void clear() {
        log.info("Clearing all stat records");
        records.clear();
    }
}
