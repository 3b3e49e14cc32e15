package com.pavan.shardedcounter.counter;

import com.pavan.shardedcounter.store.Shard;
import com.pavan.shardedcounter.store.ShardStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Estimates a counter's total by reading a random subset of its shards and scaling the
 * partial sum by the sampling ratio.
 * <p>
 * The estimate is unbiased when the counter's mass is spread uniformly over its shards,
 * which holds after many random writes or right after a rebalance. Mass concentrated in a
 * few shards can make it arbitrarily far off.
 *
 * @param <K> the type of counter names
 */
public class Estimator<K> {

    private static final Logger logger = LoggerFactory.getLogger(Estimator.class);

    private final ShardStore<K> store;
    private final ShardRandom random;

    public Estimator(ShardStore<K> store, ShardRandom random) {
        this.store = store;
        this.random = random;
    }

    /**
     * Reads {@code readFromShards} distinct shards chosen uniformly at random and returns
     * {@code sum * shardCount / readFromShards}. Missing shards read as 0. When every shard
     * is read the result is the exact sum.
     *
     * @param name the counter name
     * @param shardCount the counter's configured shard count, must be positive
     * @param readFromShards how many shards to sample, at least 1; values above
     *                       {@code shardCount} are clamped to it
     */
    public double estimate(K name, int shardCount, int readFromShards) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + shardCount);
        }
        if (readFromShards < 1) {
            throw new IllegalArgumentException("Read-from-shards must be at least 1: " + readFromShards);
        }
        int sampled = Math.min(readFromShards, shardCount);

        int[] indices = shuffledIndices(shardCount);
        double sum = 0;
        for (int i = 0; i < sampled; i++) {
            Optional<Shard<K>> shard = store.get(name, indices[i]);
            if (shard.isPresent()) {
                sum += shard.get().getValue();
            }
        }

        logger.debug("Estimated counter '{}' from {}/{} shards, partial sum {}", name, sampled, shardCount, sum);
        return sampled == shardCount ? sum : sum * shardCount / sampled;
    }

    /**
     * Returns a uniformly random permutation of {@code 0..shardCount-1} (Fisher-Yates).
     */
    int[] shuffledIndices(int shardCount) {
        int[] indices = new int[shardCount];
        for (int i = 0; i < shardCount; i++) {
            indices[i] = i;
        }
        for (int i = shardCount - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        return indices;
    }
}
