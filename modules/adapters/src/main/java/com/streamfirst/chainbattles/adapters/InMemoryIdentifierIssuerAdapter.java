package com.streamfirst.chainbattles.adapters;

import com.streamfirst.chainbattles.domain.RegistryError;
import com.streamfirst.chainbattles.domain.RegistryException;
import com.streamfirst.chainbattles.domain.TokenId;
import com.streamfirst.chainbattles.ports.IdentifierIssuerPort;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory identifier counter. Starts at 0 so the first issued identifier is 1.
 */
@Slf4j
public class InMemoryIdentifierIssuerAdapter implements IdentifierIssuerPort {

    private final AtomicLong counter;

    public InMemoryIdentifierIssuerAdapter() {
        this(0L);
    }

    /**
     * Resumes counting after {@code lastIssued}, e.g. when restoring a persisted counter.
     */
    public InMemoryIdentifierIssuerAdapter(long lastIssued) {
        if (lastIssued < 0) {
            throw new IllegalArgumentException("Counter cannot be negative: " + lastIssued);
        }
        this.counter = new AtomicLong(lastIssued);
    }

    @Override
    public TokenId nextId() {
        long next = counter.getAndUpdate(current -> current == Long.MAX_VALUE ? current : current + 1);
        if (next == Long.MAX_VALUE) {
            throw new RegistryException(RegistryError.ISSUER_EXHAUSTED,
                "Identifier counter exhausted at " + next);
        }
        TokenId tokenId = TokenId.of(next + 1);
        log.debug("Issued token identifier {}", tokenId);
        return tokenId;
    }

    @Override
    public long lastIssued() {
        return counter.get();
    }
}
