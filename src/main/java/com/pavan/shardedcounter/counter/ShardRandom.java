package com.pavan.shardedcounter.counter;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of uniform random integers used to pick write shards and to shuffle shard indices
 * for sampled reads. Not required to be cryptographically secure.
 */
@FunctionalInterface
public interface ShardRandom {

    /**
     * Returns a uniformly distributed value in {@code [0, bound)}.
     *
     * @param bound the exclusive upper bound, must be positive
     */
    int nextInt(int bound);

    /**
     * Thread-local randomness, suitable for production use from many threads.
     */
    static ShardRandom threadLocal() {
        return bound -> ThreadLocalRandom.current().nextInt(bound);
    }

    /**
     * Deterministic sequence for a given seed.
     */
    static ShardRandom seeded(long seed) {
        Random random = new Random(seed);
        return random::nextInt;
    }
}
