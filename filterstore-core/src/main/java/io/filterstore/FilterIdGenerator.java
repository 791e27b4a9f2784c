package io.filterstore;

/**
 * Source of fresh {@link FilterId} values.
 *
 * @see #getDefault()
 * @see RandomFilterIdGenerator
 */
public interface FilterIdGenerator {

    /**
     * Returns the shared generator backed by a {@link java.security.SecureRandom}.
     *
     * @return the default {@link FilterIdGenerator}
     */
    static FilterIdGenerator getDefault() {
        return RandomFilterIdGenerator.INSTANCE;
    }

    /**
     * Generates a new identifier.
     *
     * @return a new id, distinct from every previously generated one with overwhelming probability
     * @throws FilterIdGenerationException if the underlying random source fails
     */
    FilterId newFilterId();
}
