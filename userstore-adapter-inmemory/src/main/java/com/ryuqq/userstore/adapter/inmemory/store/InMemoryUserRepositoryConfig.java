package com.ryuqq.userstore.adapter.inmemory.store;

/**
 * InMemoryUserRepository configuration (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>lookupDelayMs: artificial wait before an asynchronous lookup completes (default 100ms)</li>
 * </ul>
 *
 * <p>Tests typically lower the delay with {@link #withLookupDelayMs(long)}.</p>
 *
 * @author User Store Team
 * @since 1.0.0
 * @param lookupDelayMs asynchronous lookup delay in milliseconds (zero or more)
 */
public record InMemoryUserRepositoryConfig(long lookupDelayMs) {

    /**
     * Default asynchronous lookup delay in milliseconds.
     */
    public static final long DEFAULT_LOOKUP_DELAY_MS = 100;

    /**
     * Creates a config with the default lookup delay of 100ms.
     */
    public InMemoryUserRepositoryConfig() {
        this(DEFAULT_LOOKUP_DELAY_MS);
    }

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if lookupDelayMs is negative
     */
    public InMemoryUserRepositoryConfig {
        if (lookupDelayMs < 0) {
            throw new IllegalArgumentException(
                "lookupDelayMs must be non-negative (current: " + lookupDelayMs + ")"
            );
        }
    }

    /**
     * Creates a copy with a different lookup delay.
     *
     * @param lookupDelayMs new lookup delay in milliseconds
     * @return new InMemoryUserRepositoryConfig instance
     */
    public InMemoryUserRepositoryConfig withLookupDelayMs(long lookupDelayMs) {
        return new InMemoryUserRepositoryConfig(lookupDelayMs);
    }
}
