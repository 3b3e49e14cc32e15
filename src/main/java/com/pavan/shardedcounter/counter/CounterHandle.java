package com.pavan.shardedcounter.counter;

/**
 * Operations on a single, fixed counter name.
 *
 * <pre>
 * CounterHandle&lt;String&gt; users = counter.forName("users");
 * users.inc();
 * double total = users.count();
 * </pre>
 *
 * @param <K> the type of counter names
 */
public class CounterHandle<K> {

    private final ShardedCounter<K> counter;
    private final K name;

    CounterHandle(ShardedCounter<K> counter, K name) {
        this.counter = counter;
        this.name = name;
    }

    public K getName() {
        return name;
    }

    public int add(double delta) {
        return counter.add(name, delta);
    }

    public int subtract(double delta) {
        return counter.subtract(name, delta);
    }

    public int inc() {
        return counter.inc(name);
    }

    public int dec() {
        return counter.dec(name);
    }

    /**
     * Exact value. Reads every shard, so it contends with all writers of this counter.
     */
    public double count() {
        return counter.count(name);
    }

    public double estimateCount() {
        return counter.estimateCount(name);
    }

    public double estimateCount(int readFromShards) {
        return counter.estimateCount(name, null, readFromShards);
    }

    public double rebalance() {
        return counter.rebalance(name);
    }

    public int reset() {
        return counter.reset(name);
    }
}
