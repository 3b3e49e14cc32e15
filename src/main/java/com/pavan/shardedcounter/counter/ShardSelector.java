package com.pavan.shardedcounter.counter;

/**
 * Chooses the shard index an individual update writes to.
 * Stateless apart from the draws it takes from its random source.
 */
public class ShardSelector {

    private final ShardRandom random;

    public ShardSelector(ShardRandom random) {
        this.random = random;
    }

    /**
     * Returns the pinned shard when one is supplied, otherwise a uniform draw from
     * {@code [0, shardCount)}.
     *
     * @param shardCount the configured number of shards, must be positive
     * @param pinnedShard a caller-remembered shard index, or null
     * @return the shard index to write to
     */
    public int select(int shardCount, Integer pinnedShard) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + shardCount);
        }
        if (pinnedShard != null) {
            if (pinnedShard < 0 || pinnedShard >= shardCount) {
                throw new IllegalArgumentException(
                    "Pinned shard " + pinnedShard + " is outside [0, " + shardCount + ")");
            }
            return pinnedShard;
        }
        return random.nextInt(shardCount);
    }
}
