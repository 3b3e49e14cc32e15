package com.pavan.shardedcounter.store;

/**
 * Raised by a {@link ShardStore} when the substrate is unavailable or a record
 * transaction could not be committed. Callers above the store propagate it unchanged.
 */
public class ShardStoreException extends RuntimeException {

    public ShardStoreException(String message) {
        super(message);
    }

    public ShardStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
