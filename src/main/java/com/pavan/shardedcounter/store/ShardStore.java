package com.pavan.shardedcounter.store;

import java.util.List;
import java.util.Optional;

/**
 * Transactional substrate holding shard records, addressable by {@code (name, shardIndex)}.
 * <p>
 * Every method is atomic with respect to the single record it touches. Nothing spans more
 * than one record, so multi-record operations built on top of this interface are sequences
 * of independent atomic steps.
 * <p>
 * Counter names are used as lookup keys and must implement value-based
 * {@code equals}/{@code hashCode}.
 *
 * @param <K> the type of counter names
 */
public interface ShardStore<K> {

    /**
     * Looks up a single shard.
     *
     * @param name the counter name
     * @param shardIndex the shard index
     * @return the shard, or empty if no record exists for the pair
     * @throws ShardStoreException if the store cannot serve the read
     */
    Optional<Shard<K>> get(K name, int shardIndex);

    /**
     * Inserts the shard or overwrites its value.
     *
     * @throws ShardStoreException if the write cannot be committed
     */
    void put(K name, int shardIndex, double value);

    /**
     * Atomically adds {@code delta} to the shard, creating it with {@code value = delta}
     * when absent. Concurrent increments of the same record are serialized; increments of
     * different records never contend.
     *
     * @return the shard as committed
     * @throws ShardStoreException if the write cannot be committed
     */
    Shard<K> increment(K name, int shardIndex, double delta);

    /**
     * Deletes a shard record.
     *
     * @return true if a record was removed
     * @throws ShardStoreException if the delete cannot be committed
     */
    boolean delete(ShardId<K> id);

    /**
     * Returns every shard of a counter, ordered by shard index.
     *
     * @throws ShardStoreException if the store cannot serve the scan
     */
    List<Shard<K>> scan(K name);
}
