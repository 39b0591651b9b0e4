package com.streamfirst.chainbattles.domain;

import lombok.NonNull;

/**
 * Execution context of a train call, passed explicitly instead of being read from ambient state.
 *
 * @param timestamp seconds since the epoch at which the call executes
 * @param txOrigin the identity that originated the surrounding transaction
 */
public record TrainContext(long timestamp, @NonNull Identity txOrigin) {

    /**
     * Context for a call made directly by {@code caller} at {@code timestamp}.
     */
    public static TrainContext of(long timestamp, Identity caller) {
        return new TrainContext(timestamp, caller);
    }
}
