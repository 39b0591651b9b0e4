package com.streamfirst.chainbattles.domain;

/**
 * Shape of the stat records a registry issues. Chosen once, at configuration time.
 */
public enum StatVariant {

    /** Level plus health, strength and speed. */
    FULL,

    /** Level only. */
    REDUCED
}
