package com.pavan.shardedcounter.counter;

import com.pavan.shardedcounter.metrics.StatsCollector;
import com.pavan.shardedcounter.store.Shard;
import com.pavan.shardedcounter.store.ShardStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A map from counter name to counter, where each counter is split into shards so that
 * concurrent updates of the same counter land on different records.
 * <p>
 * Writes touch exactly one shard. {@link #count} reads every shard and contends with all
 * writers of that counter; {@link #estimateCount} reads a random subset instead.
 * No operation takes an in-process lock: all consistency comes from the store's
 * per-record atomicity, and store failures propagate to the caller unchanged.
 *
 * @param <K> the type of counter names; must implement value-based equals/hashCode, and be
 *            serializable when the store is snapshotted
 */
public class ShardedCounter<K> {

    private static final Logger logger = LoggerFactory.getLogger(ShardedCounter.class);

    private final ShardStore<K> store;
    private final CounterOptions<K> options;
    private final ShardSelector selector;
    private final Aggregator<K> aggregator;
    private final Rebalancer<K> rebalancer;
    private final Estimator<K> estimator;
    private final StatsCollector stats;

    public ShardedCounter(ShardStore<K> store) {
        this(store, CounterOptions.defaults());
    }

    public ShardedCounter(ShardStore<K> store, CounterOptions<K> options) {
        this(store, options, ShardRandom.threadLocal(), new StatsCollector());
    }

    public ShardedCounter(ShardStore<K> store, CounterOptions<K> options,
                          ShardRandom random, StatsCollector stats) {
        this.store = store;
        this.options = options;
        this.selector = new ShardSelector(random);
        this.aggregator = new Aggregator<>(store);
        this.rebalancer = new Rebalancer<>(store, options.getDistributionPolicy());
        this.estimator = new Estimator<>(store, random);
        this.stats = stats;
    }

    /**
     * Increments the counter by 1.
     *
     * @return the shard index written
     */
    public int inc(K name) {
        return add(name, 1);
    }

    /**
     * Decrements the counter by 1.
     *
     * @return the shard index written
     */
    public int dec(K name) {
        return add(name, -1);
    }

    /**
     * Adds {@code delta} to the counter on a random shard. Negative deltas decrease it.
     *
     * @return the shard index written
     */
    public int add(K name, double delta) {
        return add(name, delta, null, null);
    }

    /**
     * Adds {@code delta} using an explicit shard count instead of the configured one.
     *
     * @return the shard index written
     */
    public int add(K name, double delta, int shardCount) {
        return add(name, delta, shardCount, null);
    }

    /**
     * Adds {@code delta} to the counter.
     *
     * @param name the counter name
     * @param delta the amount to add; any value is accepted
     * @param shardCount the shard count to draw from, or null for the configured one
     * @param pinnedShard a shard index to write to instead of a random one, or null
     * @return the shard index written, so callers can pin it for later writes
     */
    public int add(K name, double delta, Integer shardCount, Integer pinnedShard) {
        checkName(name);
        int shards = resolveShardCount(name, shardCount);
        int shardIndex = selector.select(shards, pinnedShard);

        Shard<K> committed = store.increment(name, shardIndex, delta);
        stats.recordAdd();
        logger.debug("Added {} to counter '{}' on shard {}/{} (shard value {})",
            delta, name, shardIndex, shards, committed.getValue());
        return shardIndex;
    }

    /**
     * Subtracts {@code delta} from the counter.
     *
     * @return the shard index written
     */
    public int subtract(K name, double delta) {
        return add(name, -delta);
    }

    /**
     * Returns the exact total of the counter, 0 if it has never been written.
     * Reads every shard.
     */
    public double count(K name) {
        checkName(name);
        double total = aggregator.count(name);
        stats.recordCount();
        return total;
    }

    /**
     * Estimates the counter from the configured number of sampled shards.
     */
    public double estimateCount(K name) {
        return estimateCount(name, null, null);
    }

    /**
     * Estimates the counter by reading {@code readFromShards} random shards.
     *
     * @param name the counter name
     * @param shardCount the counter's shard count, or null for the configured one
     * @param readFromShards how many shards to read, or null for the configured default
     */
    public double estimateCount(K name, Integer shardCount, Integer readFromShards) {
        checkName(name);
        int shards = resolveShardCount(name, shardCount);
        int sampled = readFromShards != null ? readFromShards : options.getReadFromShards();
        if (sampled < 1) {
            throw new IllegalArgumentException("Read-from-shards must be at least 1: " + sampled);
        }
        double estimate = estimator.estimate(name, shards, sampled);
        stats.recordEstimate();
        return estimate;
    }

    /**
     * Redistributes the counter evenly across its configured shard count.
     *
     * @return the total that was redistributed
     */
    public double rebalance(K name) {
        return rebalance(name, null);
    }

    /**
     * Redistributes the counter evenly across {@code shardCount} shards, deleting any shard
     * at or above that index. The total is preserved. Not atomic as a whole: if it fails,
     * run it again.
     *
     * @param shardCount the target shard count, or null for the configured one
     * @return the total that was redistributed
     */
    public double rebalance(K name, Integer shardCount) {
        checkName(name);
        int shards = resolveShardCount(name, shardCount);
        double total = rebalancer.rebalance(name, shards);
        stats.recordRebalance();
        return total;
    }

    /**
     * Deletes every shard of the counter, resetting it to 0.
     *
     * @return the number of shards deleted
     */
    public int reset(K name) {
        checkName(name);
        List<Shard<K>> shards = store.scan(name);
        int deleted = 0;
        for (Shard<K> shard : shards) {
            if (store.delete(shard.getId())) {
                deleted++;
            }
        }
        stats.recordReset();
        logger.info("Reset counter '{}' ({} shards deleted)", name, deleted);
        return deleted;
    }

    /**
     * Returns a handle bound to a single counter name.
     */
    public CounterHandle<K> forName(K name) {
        checkName(name);
        return new CounterHandle<>(this, name);
    }

    /**
     * Returns the shard count used for a name when no explicit one is given.
     */
    public int shardCountFor(K name) {
        return options.shardCountFor(name);
    }

    public CounterOptions<K> getOptions() {
        return options;
    }

    public StatsCollector getStats() {
        return stats;
    }

    private int resolveShardCount(K name, Integer shardCount) {
        int shards = shardCount != null ? shardCount : options.shardCountFor(name);
        if (shards <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + shards);
        }
        if (shards > options.getMaxShardCount()) {
            throw new IllegalArgumentException(
                "Shard count " + shards + " exceeds the maximum of " + options.getMaxShardCount());
        }
        return shards;
    }

    private static void checkName(Object name) {
        if (name == null) {
            throw new IllegalArgumentException("Counter name must not be null");
        }
    }
}
