package com.pavan.shardedcounter.counter;

import com.pavan.shardedcounter.store.Shard;
import com.pavan.shardedcounter.store.ShardStore;

import java.util.Collection;

/**
 * Computes the exact total of a counter by scanning all of its shards.
 *
 * @param <K> the type of counter names
 */
public class Aggregator<K> {

    private final ShardStore<K> store;

    public Aggregator(ShardStore<K> store) {
        this.store = store;
    }

    /**
     * Sums every shard of the counter. A counter with no shards counts as 0.
     * Each shard is read atomically but the scan is not linearizable with concurrent writers.
     */
    public double count(K name) {
        return sum(store.scan(name));
    }

    static <K> double sum(Collection<Shard<K>> shards) {
        double total = 0;
        for (Shard<K> shard : shards) {
            total += shard.getValue();
        }
        return total;
    }
}
