package com.streamfirst.chainbattles.domain;

/**
 * Reasons a registry operation can be rejected.
 * Every value is a caller precondition violation, never a transient condition, so none is retried.
 */
public enum RegistryError {

    /** The operation referenced an identifier that was never issued. */
    NOT_FOUND("TOKEN_NOT_FOUND"),

    /** The caller does not own the referenced token. */
    NOT_OWNER("NOT_TOKEN_OWNER"),

    /** The identifier counter cannot advance any further. */
    ISSUER_EXHAUSTED("ISSUER_EXHAUSTED");

    private final String code;

    RegistryError(String code) {
        this.code = code;
    }

    /**
     * Stable code suitable for logs and external error payloads.
     */
    public String code() {
        return code;
    }
}
