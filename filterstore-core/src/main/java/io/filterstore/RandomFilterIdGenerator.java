package io.filterstore;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * Generates ids from random version-4 UUIDs.
 *
 * <p>The 16 UUID bytes fill the first half of the id; the second half stays zero.
 * Failures of the random source are wrapped in {@link FilterIdGenerationException}
 * and never retried.
 *
 * <p>This class is thread-safe.
 */
public final class RandomFilterIdGenerator implements FilterIdGenerator {
    static final RandomFilterIdGenerator INSTANCE = new RandomFilterIdGenerator();

    private static final int UUID_LENGTH = 16;

    private final SecureRandom random;

    public RandomFilterIdGenerator() {
        this(new SecureRandom());
    }

    public RandomFilterIdGenerator(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public FilterId newFilterId() {
        byte[] uuid = new byte[UUID_LENGTH];
        try {
            random.nextBytes(uuid);
        } catch (RuntimeException e) {
            throw new FilterIdGenerationException("new uuid: " + e.getMessage(), e);
        }
        uuid[6] = (byte) ((uuid[6] & 0x0F) | 0x40); // version 4
        uuid[8] = (byte) ((uuid[8] & 0x3F) | 0x80); // IETF variant

        byte[] id = new byte[FilterId.LENGTH];
        System.arraycopy(uuid, 0, id, 0, UUID_LENGTH);
        return FilterId.of(id);
    }
}
