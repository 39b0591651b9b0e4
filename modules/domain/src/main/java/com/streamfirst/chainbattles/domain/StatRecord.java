package com.streamfirst.chainbattles.domain;

import lombok.With;

import java.util.List;
import java.util.Objects;

/**
 * Mutable-by-replacement stat bundle bound to one token. A {@link StatVariant#REDUCED} record only
 * carries a level; its other stats stay at zero and are never published as attributes.
 *
 * @param variant the record shape
 * @param level number of completed train events
 * @param health health points (full variant only)
 * @param strength strength points (full variant only)
 * @param speed speed points (full variant only)
 */
@With
public record StatRecord(
    StatVariant variant,
    long level,
    long health,
    long strength,
    long speed
) {

    public static final long BASELINE_HEALTH = 10;
    public static final long BASELINE_STRENGTH = 6;
    public static final long BASELINE_SPEED = 3;

    public StatRecord {
        Objects.requireNonNull(variant, "Stat variant cannot be null");
        if (level < 0 || health < 0 || strength < 0 || speed < 0) {
            throw new IllegalArgumentException("Stats cannot be negative");
        }
        if (variant == StatVariant.REDUCED && (health != 0 || strength != 0 || speed != 0)) {
            throw new IllegalArgumentException("Reduced stat records only carry a level");
        }
    }

    /**
     * Creates the record every freshly minted token starts from.
     */
    public static StatRecord baseline(StatVariant variant) {
        return switch (variant) {
            case FULL -> new StatRecord(StatVariant.FULL, 0, BASELINE_HEALTH, BASELINE_STRENGTH, BASELINE_SPEED);
            case REDUCED -> new StatRecord(StatVariant.REDUCED, 0, 0, 0, 0);
        };
    }

    public boolean isFull() {
        return variant == StatVariant.FULL;
    }

    /**
     * Published traits in their fixed order: health, strength, speed. Empty for reduced records.
     */
    public List<StatAttribute> attributes() {
        if (!isFull()) {
            return List.of();
        }
        return List.of(
            StatAttribute.of("health", health),
            StatAttribute.of("strength", strength),
            StatAttribute.of("speed", speed));
    }
}
