package com.pavan.shardedcounter.counter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for a {@link ShardedCounter}: shard counts per counter name, the default
 * shard count for every other name, the default sample size for estimates and the
 * rebalance distribution policy.
 * <p>
 * More shards raise write throughput; fewer shards make exact counts and rebalances cheaper.
 *
 * @param <K> the type of counter names
 */
public final class CounterOptions<K> {

    public static final int DEFAULT_SHARD_COUNT = 16;
    public static final int DEFAULT_READ_FROM_SHARDS = 1;
    public static final int DEFAULT_MAX_SHARD_COUNT = 1024;

    private final int defaultShardCount;
    private final int readFromShards;
    private final int maxShardCount;
    private final DistributionPolicy distributionPolicy;
    private final Map<K, Integer> shardsByName;

    private CounterOptions(Builder<K> builder) {
        this.defaultShardCount = builder.defaultShardCount;
        this.readFromShards = builder.readFromShards;
        this.maxShardCount = builder.maxShardCount;
        this.distributionPolicy = builder.distributionPolicy;
        this.shardsByName = Collections.unmodifiableMap(new HashMap<>(builder.shardsByName));
    }

    public static <K> CounterOptions<K> defaults() {
        return new Builder<K>().build();
    }

    public static <K> Builder<K> builder() {
        return new Builder<>();
    }

    /**
     * Returns the shard count configured for a name, falling back to the default.
     */
    public int shardCountFor(K name) {
        Integer configured = shardsByName.get(name);
        return configured != null ? configured : defaultShardCount;
    }

    public int getDefaultShardCount() {
        return defaultShardCount;
    }

    public int getReadFromShards() {
        return readFromShards;
    }

    /**
     * Returns the largest shard count any operation may use, explicit or configured.
     */
    public int getMaxShardCount() {
        return maxShardCount;
    }

    public DistributionPolicy getDistributionPolicy() {
        return distributionPolicy;
    }

    public Map<K, Integer> getShardsByName() {
        return shardsByName;
    }

    @Override
    public String toString() {
        return "CounterOptions{" +
                "defaultShardCount=" + defaultShardCount +
                ", readFromShards=" + readFromShards +
                ", maxShardCount=" + maxShardCount +
                ", distributionPolicy=" + distributionPolicy +
                ", shardsByName=" + shardsByName +
                '}';
    }

    public static final class Builder<K> {
        private int defaultShardCount = DEFAULT_SHARD_COUNT;
        private int readFromShards = DEFAULT_READ_FROM_SHARDS;
        private int maxShardCount = DEFAULT_MAX_SHARD_COUNT;
        private DistributionPolicy distributionPolicy = DistributionPolicy.EVEN;
        private final Map<K, Integer> shardsByName = new HashMap<>();

        private Builder() {
        }

        public Builder<K> defaultShardCount(int defaultShardCount) {
            this.defaultShardCount = defaultShardCount;
            return this;
        }

        public Builder<K> readFromShards(int readFromShards) {
            this.readFromShards = readFromShards;
            return this;
        }

        public Builder<K> maxShardCount(int maxShardCount) {
            this.maxShardCount = maxShardCount;
            return this;
        }

        public Builder<K> distributionPolicy(DistributionPolicy distributionPolicy) {
            this.distributionPolicy = distributionPolicy;
            return this;
        }

        public Builder<K> shards(K name, int shardCount) {
            this.shardsByName.put(name, shardCount);
            return this;
        }

        public Builder<K> shards(Map<K, Integer> shardCounts) {
            this.shardsByName.putAll(shardCounts);
            return this;
        }

        public CounterOptions<K> build() {
            if (defaultShardCount <= 0) {
                throw new IllegalArgumentException("Default shard count must be positive: " + defaultShardCount);
            }
            if (defaultShardCount > maxShardCount) {
                throw new IllegalArgumentException(
                    "Default shard count " + defaultShardCount + " exceeds the maximum of " + maxShardCount);
            }
            if (readFromShards < 1) {
                throw new IllegalArgumentException("Read-from-shards must be at least 1: " + readFromShards);
            }
            if (distributionPolicy == null) {
                throw new IllegalArgumentException("Distribution policy is required");
            }
            for (Map.Entry<K, Integer> entry : shardsByName.entrySet()) {
                if (entry.getKey() == null) {
                    throw new IllegalArgumentException("Counter name must not be null");
                }
                if (entry.getValue() == null || entry.getValue() <= 0) {
                    throw new IllegalArgumentException(
                        "Shard count for '" + entry.getKey() + "' must be positive: " + entry.getValue());
                }
                if (entry.getValue() > maxShardCount) {
                    throw new IllegalArgumentException("Shard count for '" + entry.getKey() + "' exceeds the maximum of "
                        + maxShardCount + ": " + entry.getValue());
                }
            }
            return new CounterOptions<>(this);
        }
    }
}
