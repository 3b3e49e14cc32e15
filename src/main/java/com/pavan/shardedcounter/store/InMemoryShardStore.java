package com.pavan.shardedcounter.store;

import com.pavan.shardedcounter.metrics.StatsCollector;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe in-memory shard store.
 * Records are indexed sparsely by name, then by shard index, so shards exist only once written.
 * Each record mutation runs inside {@link ConcurrentMap#compute}, which serializes writers of the
 * same {@code (name, shardIndex)} while writers of other indices proceed in parallel.
 *
 * @param <K> the type of counter names
 */
public class InMemoryShardStore<K> implements ShardStore<K> {
    
    // Per-name indexes are never removed once created, so a writer holding one can't lose its update.
    private final ConcurrentMap<K, ConcurrentMap<Integer, Shard<K>>> shardsByName;
    private final StatsCollector stats;
    
    public InMemoryShardStore() {
        this(new StatsCollector());
    }
    
    public InMemoryShardStore(StatsCollector stats) {
        this.shardsByName = new ConcurrentHashMap<>();
        this.stats = stats;
    }
    
    @Override
    public Optional<Shard<K>> get(K name, int shardIndex) {
        stats.recordShardRead();
        ConcurrentMap<Integer, Shard<K>> shards = shardsByName.get(name);
        if (shards == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(shards.get(shardIndex));
    }
    
    @Override
    public void put(K name, int shardIndex, double value) {
        Shard<K> previous = indexFor(name).put(shardIndex, new Shard<>(name, shardIndex, value));
        stats.recordShardWrite(previous == null);
    }
    
    @Override
    public Shard<K> increment(K name, int shardIndex, double delta) {
        boolean[] created = new boolean[1];
        Shard<K> committed = indexFor(name).compute(shardIndex, (index, current) -> {
            if (current == null) {
                created[0] = true;
                return new Shard<>(name, index, delta);
            }
            return current.withValue(current.getValue() + delta);
        });
        stats.recordShardWrite(created[0]);
        return committed;
    }
    
    @Override
    public boolean delete(ShardId<K> id) {
        ConcurrentMap<Integer, Shard<K>> shards = shardsByName.get(id.getName());
        boolean removed = shards != null && shards.remove(id.getShardIndex()) != null;
        stats.recordShardDelete(removed);
        return removed;
    }
    
    @Override
    public List<Shard<K>> scan(K name) {
        stats.recordShardScan();
        ConcurrentMap<Integer, Shard<K>> shards = shardsByName.get(name);
        if (shards == null) {
            return Collections.emptyList();
        }
        List<Shard<K>> result = new ArrayList<>(shards.values());
        result.sort(Comparator.comparingInt(Shard::getShardIndex));
        return result;
    }
    
    /**
     * Returns the names that currently own at least one shard.
     */
    public Set<K> names() {
        Set<K> names = new HashSet<>();
        for (Map.Entry<K, ConcurrentMap<Integer, Shard<K>>> entry : shardsByName.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                names.add(entry.getKey());
            }
        }
        return names;
    }
    
    /**
     * Returns the total number of shard records across all counters.
     */
    public int size() {
        int total = 0;
        for (ConcurrentMap<Integer, Shard<K>> shards : shardsByName.values()) {
            total += shards.size();
        }
        return total;
    }
    
    /**
     * Removes every record from the store.
     */
    public void clear() {
        for (ConcurrentMap<Integer, Shard<K>> shards : shardsByName.values()) {
            shards.clear();
        }
    }
    
    /**
     * Returns the statistics collector for this store.
     */
    public StatsCollector getStats() {
        return stats;
    }
    
    /**
     * Returns a copy of every record, for use by SnapshotManager.
     * Each record is read atomically; the copy as a whole is not a point-in-time view.
     */
    public List<Shard<K>> captureSnapshot() {
        List<Shard<K>> snapshot = new ArrayList<>();
        for (ConcurrentMap<Integer, Shard<K>> shards : shardsByName.values()) {
            snapshot.addAll(shards.values());
        }
        return snapshot;
    }
    
    /**
     * Restores records from a snapshot, overwriting any record with the same id.
     *
     * @param shards the records to restore
     */
    public void restoreSnapshot(Collection<Shard<K>> shards) {
        for (Shard<K> shard : shards) {
            indexFor(shard.getName()).put(shard.getShardIndex(), shard);
        }
    }
    
    private ConcurrentMap<Integer, Shard<K>> indexFor(K name) {
        return shardsByName.computeIfAbsent(name, n -> new ConcurrentHashMap<>());
    }
}
