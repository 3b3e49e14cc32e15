package com.pavan.shardedcounter.store;

import java.io.Serializable;
import java.util.Objects;

/**
 * Primary key of a shard record: the owning counter's name plus the shard index.
 * Two ids are equal when both the names are equal (structurally, for composite keys)
 * and the indices match.
 *
 * @param <K> the type of counter names
 */
public final class ShardId<K> implements Serializable {

    private static final long serialVersionUID = 1L;

    private final K name;
    private final int shardIndex;

    public ShardId(K name, int shardIndex) {
        this.name = Objects.requireNonNull(name, "name");
        this.shardIndex = shardIndex;
    }

    public K getName() {
        return name;
    }

    public int getShardIndex() {
        return shardIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ShardId)) {
            return false;
        }
        ShardId<?> other = (ShardId<?>) o;
        return shardIndex == other.shardIndex && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + shardIndex;
    }

    @Override
    public String toString() {
        return name + "#" + shardIndex;
    }
}
