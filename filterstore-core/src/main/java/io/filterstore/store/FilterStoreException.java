package io.filterstore.store;

/**
 * Base class of the errors raised by {@link FilterStore} operations.
 *
 * <p>Callers distinguish the cases by subclass.
 */
public class FilterStoreException extends RuntimeException {

    public FilterStoreException(String message) {
        super(message);
    }
}
