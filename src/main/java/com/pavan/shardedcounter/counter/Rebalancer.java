package com.pavan.shardedcounter.counter;

import com.pavan.shardedcounter.store.Shard;
import com.pavan.shardedcounter.store.ShardStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Redistributes a counter's total evenly across a target shard count, growing or shrinking
 * the shard set without changing the total.
 * <p>
 * The store only guarantees single-record atomicity, so a rebalance is a sequence of
 * independent writes and deletes. A failure part-way leaves some shards rewritten and
 * others not; running the rebalance again converges. Writers racing a rebalance are not
 * detected.
 *
 * @param <K> the type of counter names
 */
public class Rebalancer<K> {

    private static final Logger logger = LoggerFactory.getLogger(Rebalancer.class);

    private final ShardStore<K> store;
    private final DistributionPolicy policy;

    public Rebalancer(ShardStore<K> store, DistributionPolicy policy) {
        this.store = store;
        this.policy = policy;
    }

    /**
     * Rewrites shards {@code 0..targetShardCount-1} with the policy's allotments and deletes
     * every shard at or above {@code targetShardCount}.
     *
     * @param name the counter name
     * @param targetShardCount the number of shards to keep, must be positive
     * @return the total that was redistributed
     */
    public double rebalance(K name, int targetShardCount) {
        if (targetShardCount <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + targetShardCount);
        }

        List<Shard<K>> existing = store.scan(name);
        double total = Aggregator.sum(existing);
        double[] values = policy.distribute(total, targetShardCount);

        for (int i = 0; i < targetShardCount; i++) {
            store.put(name, i, values[i]);
        }

        int deleted = 0;
        for (Shard<K> shard : existing) {
            if (shard.getShardIndex() >= targetShardCount && store.delete(shard.getId())) {
                deleted++;
            }
        }

        logger.info("Rebalanced counter '{}': total={}, shards {} -> {} ({} deleted, policy {})",
            name, total, existing.size(), targetShardCount, deleted, policy);
        return total;
    }

    public DistributionPolicy getPolicy() {
        return policy;
    }
}
