package com.streamfirst.chainbattles.domain;

import lombok.Getter;
import lombok.NonNull;

/**
 * Unchecked form of a {@link RegistryError}, raised when a failed {@link Result} is unwrapped.
 */
@Getter
public class RegistryException extends RuntimeException {

    private final RegistryError error;

    public RegistryException(@NonNull RegistryError error, String message) {
        super(message + " (code: " + error.code() + ")");
        this.error = error;
    }
}
