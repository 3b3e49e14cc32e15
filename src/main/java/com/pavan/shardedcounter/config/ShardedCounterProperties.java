package com.pavan.shardedcounter.config;

import com.pavan.shardedcounter.counter.CounterOptions;
import com.pavan.shardedcounter.counter.DistributionPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.util.HashMap;
import java.util.Map;

/**
 * Binding for all {@code shardedcounter.*} properties.
 *
 * <pre>
 * shardedcounter.default-shard-count=16
 * shardedcounter.read-from-shards=1
 * shardedcounter.max-shard-count=1024
 * shardedcounter.distribution-policy=EVEN
 * shardedcounter.shards.beans=10
 * shardedcounter.server.port=6380
 * shardedcounter.snapshot.directory=./snapshots
 * </pre>
 */
@ConfigurationProperties(prefix = "shardedcounter")
public class ShardedCounterProperties {

    private int defaultShardCount = CounterOptions.DEFAULT_SHARD_COUNT;

    private int readFromShards = CounterOptions.DEFAULT_READ_FROM_SHARDS;

    /** Upper bound on any shard count, including the ones clients pass per command. */
    private int maxShardCount = CounterOptions.DEFAULT_MAX_SHARD_COUNT;

    /** EVEN allows fractional shard values after a rebalance; INTEGRAL keeps integral totals integral per shard. */
    private DistributionPolicy distributionPolicy = DistributionPolicy.EVEN;

    /** Fixed shard counts for specific counter names. */
    private Map<String, Integer> shards = new HashMap<>();

    @NestedConfigurationProperty
    private Server server = new Server();

    @NestedConfigurationProperty
    private Snapshot snapshot = new Snapshot();

    public CounterOptions<String> toCounterOptions() {
        return CounterOptions.<String>builder()
            .defaultShardCount(defaultShardCount)
            .readFromShards(readFromShards)
            .maxShardCount(maxShardCount)
            .distributionPolicy(distributionPolicy)
            .shards(shards)
            .build();
    }

    public int getDefaultShardCount() {
        return defaultShardCount;
    }

    public void setDefaultShardCount(int defaultShardCount) {
        this.defaultShardCount = defaultShardCount;
    }

    public int getReadFromShards() {
        return readFromShards;
    }

    public void setReadFromShards(int readFromShards) {
        this.readFromShards = readFromShards;
    }

    public int getMaxShardCount() {
        return maxShardCount;
    }

    public void setMaxShardCount(int maxShardCount) {
        this.maxShardCount = maxShardCount;
    }

    public DistributionPolicy getDistributionPolicy() {
        return distributionPolicy;
    }

    public void setDistributionPolicy(DistributionPolicy distributionPolicy) {
        this.distributionPolicy = distributionPolicy;
    }

    public Map<String, Integer> getShards() {
        return shards;
    }

    public void setShards(Map<String, Integer> shards) {
        this.shards = shards;
    }

    public Server getServer() {
        return server;
    }

    public void setServer(Server server) {
        this.server = server;
    }

    public Snapshot getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(Snapshot snapshot) {
        this.snapshot = snapshot;
    }

    public static class Server {
        /** TCP port of the text protocol; 0 picks a free port. */
        private int port = 6380;
        private int workerThreads = 10;

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    public static class Snapshot {
        private boolean enabled = true;
        private String directory = "./snapshots";
        private long intervalSeconds = 30;
        private int keep = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public int getKeep() {
            return keep;
        }

        public void setKeep(int keep) {
            this.keep = keep;
        }
    }
}
