package com.pavan.shardedcounter.store;

import java.io.Serializable;

/**
 * One physical partition of a logical counter.
 * Immutable; the store replaces the record on every mutation.
 *
 * @param <K> the type of counter names
 */
public final class Shard<K> implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ShardId<K> id;
    private final double value;

    public Shard(K name, int shardIndex, double value) {
        this(new ShardId<>(name, shardIndex), value);
    }

    public Shard(ShardId<K> id, double value) {
        this.id = id;
        this.value = value;
    }

    public ShardId<K> getId() {
        return id;
    }

    public K getName() {
        return id.getName();
    }

    public int getShardIndex() {
        return id.getShardIndex();
    }

    public double getValue() {
        return value;
    }

    /**
     * Returns a copy of this shard holding the given value.
     */
    public Shard<K> withValue(double newValue) {
        return new Shard<>(id, newValue);
    }

    @Override
    public String toString() {
        return "Shard{" +
                "id=" + id +
                ", value=" + value +
                '}';
    }
}
