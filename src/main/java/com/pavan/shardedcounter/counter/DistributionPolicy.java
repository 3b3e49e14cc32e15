package com.pavan.shardedcounter.counter;

/**
 * How a rebalance splits a counter's total across its shards.
 * Every policy returns allotments that sum to the total and lie within 1 of {@code total / shardCount}.
 */
public enum DistributionPolicy {

    /**
     * Every shard receives {@code total / shardCount}; shard values may be fractional.
     */
    EVEN {
        @Override
        public double[] distribute(double total, int shardCount) {
            double[] values = new double[checkShardCount(shardCount)];
            double share = total / shardCount;
            for (int i = 0; i < shardCount; i++) {
                values[i] = share;
            }
            return values;
        }
    },

    /**
     * Every shard receives {@code floor(total / shardCount)} and the remainder is handed out in
     * unit steps from shard 0 upwards. Integral totals stay integral in every shard; a fractional
     * remainder leaves its fractional part on the last shard that receives a step.
     * Infinite and NaN totals have no remainder and are split like {@link #EVEN}.
     */
    INTEGRAL {
        @Override
        public double[] distribute(double total, int shardCount) {
            if (!Double.isFinite(total)) {
                return EVEN.distribute(total, shardCount);
            }
            double[] values = new double[checkShardCount(shardCount)];
            double base = Math.floor(total / shardCount);
            double remainder = total - base * shardCount;
            double step = Math.signum(remainder);
            for (int i = 0; i < shardCount; i++) {
                values[i] = base;
                if (remainder != 0) {
                    // The last shard absorbs whatever rounding left behind.
                    double portion = Math.abs(remainder) < 1 || i == shardCount - 1 ? remainder : step;
                    values[i] += portion;
                    remainder -= portion;
                }
            }
            return values;
        }
    };

    /**
     * Computes the value each shard index {@code 0..shardCount-1} should hold.
     *
     * @param total the counter's exact total
     * @param shardCount the target number of shards, must be positive
     */
    public abstract double[] distribute(double total, int shardCount);

    static int checkShardCount(int shardCount) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + shardCount);
        }
        return shardCount;
    }
}
