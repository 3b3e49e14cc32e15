package com.pavan.shardedcounter.counter;

import com.pavan.shardedcounter.metrics.StatsCollector;
import com.pavan.shardedcounter.store.InMemoryShardStore;
import com.pavan.shardedcounter.store.Shard;
import com.pavan.shardedcounter.store.ShardStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ShardedCounterTest {
    
    private static final double EPSILON = 1e-6;
    
    private InMemoryShardStore<String> store;
    private StatsCollector stats;
    private ShardedCounter<String> counter;
    
    @BeforeEach
    void setUp() {
        stats = new StatsCollector();
        store = new InMemoryShardStore<>(stats);
        counter = new ShardedCounter<>(store, CounterOptions.defaults(), ShardRandom.seeded(7), stats);
    }
    
    @Test
    void testAddAndSubtract() {
        counter.add("beans", 10);
        counter.add("beans", 5);
        assertEquals(15, counter.count("beans"), EPSILON);
        
        counter.add("beans", -5);
        assertEquals(0, counter.count("friends"), EPSILON);
        
        counter.add("friends", 6, 1);
        counter.add("friends", 2, 1);
        counter.add("friends", 3, 3);
        
        assertEquals(10, counter.count("beans"), EPSILON);
        assertEquals(11, counter.count("friends"), EPSILON);
    }
    
    @Test
    void testSingleShardWritesLandOnShardZero() {
        assertEquals(0, counter.add("friends", 6, 1));
        assertEquals(0, counter.add("friends", 2, 1));
        
        List<Shard<String>> shards = store.scan("friends");
        assertEquals(1, shards.size());
        assertEquals(0, shards.get(0).getShardIndex());
        assertEquals(8, counter.count("friends"), EPSILON);
    }
    
    @Test
    void testRespectsPinnedShard() {
        assertEquals(1, counter.add("beans", 10, null, 1));
        assertEquals(2, counter.add("beans", 5, null, 2));
        assertEquals(1, counter.add("beans", 1, null, 1));
        
        assertEquals(11, store.get("beans", 1).orElseThrow().getValue(), EPSILON);
        assertEquals(5, store.get("beans", 2).orElseThrow().getValue(), EPSILON);
        assertEquals(2, store.scan("beans").size());
    }
    
    @Test
    void testReturnedShardCanBePinned() {
        int shard = counter.add("beans", 1);
        for (int i = 0; i < 10; i++) {
            assertEquals(shard, counter.add("beans", 1, null, shard));
        }
        
        assertEquals(1, store.scan("beans").size());
        assertEquals(11, counter.count("beans"), EPSILON);
    }
    
    @Test
    void testRandomShardsStayWithinShardCount() {
        for (int i = 0; i < 200; i++) {
            int shard = counter.add("beans", 1, 5);
            assertTrue(shard >= 0 && shard < 5);
        }
        
        assertTrue(store.scan("beans").size() <= 5);
        assertEquals(200, counter.count("beans"), EPSILON);
    }
    
    @Test
    void testZeroAndFractionalDeltas() {
        counter.add("beans", 0);
        counter.add("beans", 0.1);
        counter.add("beans", 0.2);
        counter.add("beans", -0.05);
        
        assertEquals(0.25, counter.count("beans"), EPSILON);
    }
    
    @Test
    void testUnknownCounterIsZero() {
        assertEquals(0, counter.count("nobody"), EPSILON);
        assertEquals(0, counter.estimateCount("nobody"), EPSILON);
    }
    
    @Test
    void testCountersAreIndependent() {
        counter.add("a", 100);
        counter.add("b", 1);
        counter.rebalance("a", 3);
        counter.reset("a");
        
        assertEquals(1, counter.count("b"), EPSILON);
    }
    
    @Test
    void testReset() {
        counter.add("beans", 10);
        counter.add("beans", 4, null, 9);
        
        assertTrue(counter.reset("beans") >= 1);
        assertEquals(0, counter.count("beans"), EPSILON);
        assertTrue(store.scan("beans").isEmpty());
        
        counter.add("beans", 5);
        assertEquals(5, counter.count("beans"), EPSILON);
    }
    
    @Test
    void testResetOfUnknownCounter() {
        assertEquals(0, counter.reset("nobody"));
    }
    
    @Test
    void testRebalancePreservesTotalAndShardCount() {
        for (int i = 0; i < 50; i++) {
            counter.add("beans", i % 7 - 2.5, 100);
        }
        double before = counter.count("beans");
        
        counter.rebalance("beans", 6);
        
        assertEquals(before, counter.count("beans"), EPSILON);
        List<Shard<String>> shards = store.scan("beans");
        assertEquals(6, shards.size());
        for (Shard<String> shard : shards) {
            assertTrue(Math.abs(shard.getValue() - before / 6) <= 1 + EPSILON);
        }
    }
    
    @Test
    void testRebalanceUsesConfiguredShardCount() {
        counter.add("beans", 32, 1);
        
        counter.rebalance("beans");
        
        assertEquals(CounterOptions.DEFAULT_SHARD_COUNT, store.scan("beans").size());
    }
    
    @Test
    void testEstimateConvergesAfterRebalance() {
        counter.add("beans", 100, 1);
        counter.rebalance("beans");
        
        for (int k = 1; k <= 16; k++) {
            assertEquals(100, counter.estimateCount("beans", null, k), EPSILON);
        }
    }
    
    @Test
    void testEstimateIsExactWhenReadingEveryShardOfIntegralCounter() {
        ShardedCounter<String> integral = new ShardedCounter<>(store,
            CounterOptions.<String>builder().distributionPolicy(DistributionPolicy.INTEGRAL).build(),
            ShardRandom.seeded(3), stats);
        integral.add("beans", 37, 1);
        integral.rebalance("beans");
        
        assertEquals(37, integral.estimateCount("beans", null, 16), EPSILON);
        for (int k = 1; k < 16; k++) {
            // 37 over 16 shards puts 2 or 3 in each, so no sample can stray further than this
            double estimate = integral.estimateCount("beans", null, k);
            assertTrue(estimate >= 32 - EPSILON && estimate <= 48 + EPSILON, "estimate " + estimate);
        }
    }
    
    @Test
    void testPerNameShardCounts() {
        ShardedCounter<String> configured = new ShardedCounter<>(store,
            CounterOptions.<String>builder().shards("beans", 10).shards("users", 3).defaultShardCount(2).build(),
            ShardRandom.seeded(1), stats);
        
        for (int i = 0; i < 100; i++) {
            assertTrue(configured.inc("users") < 3);
            assertTrue(configured.inc("other") < 2);
        }
        configured.rebalance("beans");
        
        assertEquals(10, configured.shardCountFor("beans"));
        assertEquals(2, configured.shardCountFor("pennies"));
        assertEquals(10, store.scan("beans").size());
        assertEquals(100, configured.count("users"), EPSILON);
    }
    
    @Test
    void testCounterHandle() {
        CounterHandle<String> users = counter.forName("users");
        
        users.inc();
        users.inc();
        users.dec();
        users.add(10);
        users.subtract(4);
        
        assertEquals("users", users.getName());
        assertEquals(7, users.count(), EPSILON);
        assertEquals(7, users.rebalance(), EPSILON);
        assertEquals(7, users.estimateCount(), EPSILON);
        assertEquals(7, users.estimateCount(5), EPSILON);
        assertEquals(16, users.reset());
        assertEquals(0, users.count(), EPSILON);
    }
    
    @Test
    void testCompositeKeys() {
        InMemoryShardStore<CounterKey> keyed = new InMemoryShardStore<>();
        ShardedCounter<CounterKey> nested = new ShardedCounter<>(keyed,
            CounterOptions.<CounterKey>builder().defaultShardCount(3).build());
        
        nested.inc(CounterKey.of("alice", "followers"));
        nested.inc(CounterKey.of("alice", "followers"));
        nested.inc(CounterKey.of("alice", "follows"));
        nested.inc(CounterKey.of("bob", "followers"));
        
        assertEquals(2, nested.count(CounterKey.of("alice", "followers")), EPSILON);
        assertEquals(1, nested.count(CounterKey.of("alice", "follows")), EPSILON);
        assertEquals(1, nested.count(CounterKey.of("bob", "followers")), EPSILON);
        assertEquals(0, nested.count(CounterKey.of("bob", "follows")), EPSILON);
    }
    
    @Test
    void testInvalidConfigurationRejectedBeforeStoreAccess() {
        FaultyShardStore faulty = new FaultyShardStore();
        faulty.failReads();
        faulty.failWritesAfter(0);
        ShardedCounter<String> guarded = new ShardedCounter<>(faulty);
        
        assertThrows(IllegalArgumentException.class, () -> guarded.add("beans", 1, 0));
        assertThrows(IllegalArgumentException.class, () -> guarded.add("beans", 1, 4, 4));
        assertThrows(IllegalArgumentException.class, () -> guarded.add(null, 1));
        assertThrows(IllegalArgumentException.class, () -> guarded.estimateCount("beans", 4, 0));
        assertThrows(IllegalArgumentException.class, () -> guarded.estimateCount("beans", -1, 1));
        assertThrows(IllegalArgumentException.class, () -> guarded.rebalance("beans", 0));
        assertThrows(IllegalArgumentException.class, () -> guarded.count(null));
    }
    
    @Test
    void testInvalidOptions() {
        assertThrows(IllegalArgumentException.class,
            () -> CounterOptions.<String>builder().defaultShardCount(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> CounterOptions.<String>builder().readFromShards(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> CounterOptions.<String>builder().shards("beans", -2).build());
        assertThrows(IllegalArgumentException.class,
            () -> CounterOptions.<String>builder().maxShardCount(8).defaultShardCount(16).build());
        assertThrows(IllegalArgumentException.class,
            () -> CounterOptions.<String>builder().maxShardCount(8).defaultShardCount(4).shards("beans", 9).build());
    }
    
    @Test
    void testShardCountAboveMaximumRejectedBeforeStoreAccess() {
        FaultyShardStore faulty = new FaultyShardStore();
        faulty.failReads();
        faulty.failWritesAfter(0);
        ShardedCounter<String> guarded = new ShardedCounter<>(faulty,
            CounterOptions.<String>builder().defaultShardCount(4).maxShardCount(8).build());
        
        assertThrows(IllegalArgumentException.class, () -> guarded.add("beans", 1, 9));
        assertThrows(IllegalArgumentException.class, () -> guarded.estimateCount("beans", Integer.MAX_VALUE, 1));
        assertThrows(IllegalArgumentException.class, () -> guarded.rebalance("beans", 2_000_000));
        assertTrue(faulty.delegate.names().isEmpty());
    }
    
    @Test
    void testShardCountAtMaximumIsAccepted() {
        ShardedCounter<String> bounded = new ShardedCounter<>(store,
            CounterOptions.<String>builder().defaultShardCount(4).maxShardCount(8).build());
        bounded.add("beans", 16, 1);
        
        bounded.rebalance("beans", 8);
        
        assertEquals(8, store.scan("beans").size());
        assertEquals(16, bounded.estimateCount("beans", 8, 8), EPSILON);
    }
    
    @Test
    void testRebalanceOfInfiniteTotalKeepsItInfinite() {
        ShardedCounter<String> integral = new ShardedCounter<>(store,
            CounterOptions.<String>builder().distributionPolicy(DistributionPolicy.INTEGRAL).build(),
            ShardRandom.seeded(5), stats);
        integral.add("beans", Double.POSITIVE_INFINITY);
        
        integral.rebalance("beans", 4);
        
        assertEquals(Double.POSITIVE_INFINITY, integral.count("beans"));
        assertEquals(4, store.scan("beans").size());
    }
    
    @Test
    void testStoreFailuresPropagate() {
        FaultyShardStore faulty = new FaultyShardStore();
        ShardedCounter<String> failing = new ShardedCounter<>(faulty);
        failing.add("beans", 3, null, 0);
        
        faulty.failWritesAfter(0);
        ShardStoreException e = assertThrows(ShardStoreException.class, () -> failing.add("beans", 1, null, 0));
        assertEquals("transaction conflict", e.getMessage());
        assertEquals(3, faulty.delegate.get("beans", 0).orElseThrow().getValue(), EPSILON);
        
        faulty.heal();
        faulty.failReads();
        assertThrows(ShardStoreException.class, () -> failing.count("beans"));
        assertThrows(ShardStoreException.class, () -> failing.estimateCount("beans"));
    }
    
    @Test
    void testStatsAreRecorded() {
        counter.add("beans", 1);
        counter.count("beans");
        counter.estimateCount("beans");
        counter.rebalance("beans");
        counter.reset("beans");
        
        assertEquals(1, stats.getTotalAdds());
        assertEquals(1, stats.getTotalCounts());
        assertEquals(1, stats.getTotalEstimates());
        assertEquals(1, stats.getTotalRebalances());
        assertEquals(1, stats.getTotalResets());
        assertEquals(16, stats.getShardsDeleted());
    }
    
    @Test
    void testUpdatesMatchUnshardedReference() {
        Random random = new Random(2024);
        String[] keys = {"", "a", "b", "long key", "ü"};
        Map<String, Double> reference = new HashMap<>();
        
        for (int i = 0; i < 500; i++) {
            String key = keys[random.nextInt(keys.length)];
            double delta = (random.nextInt(20_001) - 10_000) / 100.0;
            Integer shards = random.nextBoolean() ? 1 + random.nextInt(100) : null;
            
            reference.merge(key, delta, Double::sum);
            counter.add(key, delta, shards, null);
            assertEquals(reference.get(key), counter.count(key), EPSILON);
        }
        
        for (Map.Entry<String, Double> entry : reference.entrySet()) {
            counter.rebalance(entry.getKey());
            assertEquals(entry.getValue(), counter.count(entry.getKey()), EPSILON);
            for (int k = 1; k <= 16; k++) {
                assertEquals(entry.getValue(), counter.estimateCount(entry.getKey(), null, k), EPSILON);
            }
        }
    }
}
