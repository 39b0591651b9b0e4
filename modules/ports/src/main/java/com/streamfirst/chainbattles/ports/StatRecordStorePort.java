package com.streamfirst.chainbattles.ports;

import com.streamfirst.chainbattles.domain.StatRecord;
import com.streamfirst.chainbattles.domain.TokenId;

import java.util.Optional;

/**
 * Port for the mapping from token identifier to its stat record.
 * Records are created once at mint time and afterwards only replaced as a whole.
 */
public interface StatRecordStorePort {

    /**
     * Inserts the initial record for a token.
     *
     * @param tokenId the token identifier
     * @param record the baseline record
     * @throws IllegalStateException if the token already has a record
     */
    void create(TokenId tokenId, StatRecord record);

    /**
     * Gets the current record of a token.
     *
     * @param tokenId the token identifier
     * @return the record, or empty if none was ever created
     */
    Optional<StatRecord> get(TokenId tokenId);

    /**
     * Overwrites the record of a token.
     *
     * @param tokenId the token identifier
     * @param record the replacement record
     * @throws IllegalStateException if the token has no record
     */
    void set(TokenId tokenId, StatRecord record);

    /**
     * @return the number of stored records
     */
    long count();
}
