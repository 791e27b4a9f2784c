package io.filterstore;

/**
 * Thrown when a {@link FilterIdGenerator} cannot produce an id because its
 * random source failed. The request that needed the id should be failed.
 */
public final class FilterIdGenerationException extends RuntimeException {

    public FilterIdGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
