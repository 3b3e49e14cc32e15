package com.pavan.shardedcounter.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects operation statistics for the counter engine and its shard store.
 * Thread-safe using atomic counters.
 */
public class StatsCollector {
    
    // Counter operations
    private final AtomicLong totalAdds;
    private final AtomicLong totalCounts;
    private final AtomicLong totalEstimates;
    private final AtomicLong totalRebalances;
    private final AtomicLong totalResets;
    
    // Store record operations
    private final AtomicLong shardReads;
    private final AtomicLong shardWrites;
    private final AtomicLong shardScans;
    private final AtomicLong shardsCreated;
    private final AtomicLong shardsDeleted;
    
    private final long startTime;
    
    public StatsCollector() {
        this.totalAdds = new AtomicLong(0);
        this.totalCounts = new AtomicLong(0);
        this.totalEstimates = new AtomicLong(0);
        this.totalRebalances = new AtomicLong(0);
        this.totalResets = new AtomicLong(0);
        this.shardReads = new AtomicLong(0);
        this.shardWrites = new AtomicLong(0);
        this.shardScans = new AtomicLong(0);
        this.shardsCreated = new AtomicLong(0);
        this.shardsDeleted = new AtomicLong(0);
        this.startTime = System.currentTimeMillis();
    }
    
    // Counter operation recording
    
    public void recordAdd() {
        totalAdds.incrementAndGet();
    }
    
    public void recordCount() {
        totalCounts.incrementAndGet();
    }
    
    public void recordEstimate() {
        totalEstimates.incrementAndGet();
    }
    
    public void recordRebalance() {
        totalRebalances.incrementAndGet();
    }
    
    public void recordReset() {
        totalResets.incrementAndGet();
    }
    
    // Store operation recording
    
    public void recordShardRead() {
        shardReads.incrementAndGet();
    }
    
    public void recordShardWrite(boolean created) {
        shardWrites.incrementAndGet();
        if (created) {
            shardsCreated.incrementAndGet();
        }
    }
    
    public void recordShardScan() {
        shardScans.incrementAndGet();
    }
    
    public void recordShardDelete(boolean existed) {
        if (existed) {
            shardsDeleted.incrementAndGet();
        }
    }
    
    // Getter methods
    
    public long getTotalAdds() {
        return totalAdds.get();
    }
    
    public long getTotalCounts() {
        return totalCounts.get();
    }
    
    public long getTotalEstimates() {
        return totalEstimates.get();
    }
    
    public long getTotalRebalances() {
        return totalRebalances.get();
    }
    
    public long getTotalResets() {
        return totalResets.get();
    }
    
    public long getShardReads() {
        return shardReads.get();
    }
    
    public long getShardWrites() {
        return shardWrites.get();
    }
    
    public long getShardScans() {
        return shardScans.get();
    }
    
    public long getShardsCreated() {
        return shardsCreated.get();
    }
    
    public long getShardsDeleted() {
        return shardsDeleted.get();
    }
    
    public long getTotalOperations() {
        return totalAdds.get() + totalCounts.get() + totalEstimates.get()
            + totalRebalances.get() + totalResets.get();
    }
    
    public long getUptimeMillis() {
        return System.currentTimeMillis() - startTime;
    }
    
    public long getUptimeSeconds() {
        return getUptimeMillis() / 1000;
    }
    
    /**
     * Returns a snapshot of current statistics.
     */
    public StatsSnapshot getSnapshot() {
        return new StatsSnapshot(
            totalAdds.get(),
            totalCounts.get(),
            totalEstimates.get(),
            totalRebalances.get(),
            totalResets.get(),
            shardReads.get(),
            shardWrites.get(),
            shardScans.get(),
            shardsCreated.get(),
            shardsDeleted.get(),
            getUptimeMillis()
        );
    }
    
    /**
     * Resets all statistics counters.
     */
    public void reset() {
        totalAdds.set(0);
        totalCounts.set(0);
        totalEstimates.set(0);
        totalRebalances.set(0);
        totalResets.set(0);
        shardReads.set(0);
        shardWrites.set(0);
        shardScans.set(0);
        shardsCreated.set(0);
        shardsDeleted.set(0);
    }
    
    @Override
    public String toString() {
        return String.format(
            "StatsCollector{adds=%d, counts=%d, estimates=%d, rebalances=%d, resets=%d, " +
            "shardReads=%d, shardWrites=%d, shardScans=%d, created=%d, deleted=%d, uptime=%ds}",
            totalAdds.get(), totalCounts.get(), totalEstimates.get(), totalRebalances.get(),
            totalResets.get(), shardReads.get(), shardWrites.get(), shardScans.get(),
            shardsCreated.get(), shardsDeleted.get(), getUptimeSeconds()
        );
    }
    
    /**
     * Immutable snapshot of statistics at a point in time.
     */
    public static class StatsSnapshot {
        public final long totalAdds;
        public final long totalCounts;
        public final long totalEstimates;
        public final long totalRebalances;
        public final long totalResets;
        public final long shardReads;
        public final long shardWrites;
        public final long shardScans;
        public final long shardsCreated;
        public final long shardsDeleted;
        public final long uptimeMillis;
        
        public StatsSnapshot(long totalAdds, long totalCounts, long totalEstimates,
                           long totalRebalances, long totalResets, long shardReads,
                           long shardWrites, long shardScans, long shardsCreated,
                           long shardsDeleted, long uptimeMillis) {
            this.totalAdds = totalAdds;
            this.totalCounts = totalCounts;
            this.totalEstimates = totalEstimates;
            this.totalRebalances = totalRebalances;
            this.totalResets = totalResets;
            this.shardReads = shardReads;
            this.shardWrites = shardWrites;
            this.shardScans = shardScans;
            this.shardsCreated = shardsCreated;
            this.shardsDeleted = shardsDeleted;
            this.uptimeMillis = uptimeMillis;
        }
        
        public long getTotalOperations() {
            return totalAdds + totalCounts + totalEstimates + totalRebalances + totalResets;
        }
        
        @Override
        public String toString() {
            return String.format(
                "StatsSnapshot{operations=%d, adds=%d, shardWrites=%d, created=%d, deleted=%d, uptime=%dms}",
                getTotalOperations(), totalAdds, shardWrites, shardsCreated, shardsDeleted, uptimeMillis
            );
        }
    }
}
