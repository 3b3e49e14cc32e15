package com.pavan.shardedcounter.config;

import com.pavan.shardedcounter.counter.CounterOptions;
import com.pavan.shardedcounter.counter.DistributionPolicy;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ShardedCounterPropertiesTest {
    
    @Test
    void testDefaults() {
        ShardedCounterProperties properties = new ShardedCounterProperties();
        CounterOptions<String> options = properties.toCounterOptions();
        
        assertEquals(16, options.getDefaultShardCount());
        assertEquals(1, options.getReadFromShards());
        assertEquals(DistributionPolicy.EVEN, options.getDistributionPolicy());
        assertEquals(6380, properties.getServer().getPort());
        assertTrue(properties.getSnapshot().isEnabled());
    }
    
    @Test
    void testToCounterOptions() {
        ShardedCounterProperties properties = new ShardedCounterProperties();
        properties.setDefaultShardCount(4);
        properties.setReadFromShards(2);
        properties.setMaxShardCount(32);
        properties.setDistributionPolicy(DistributionPolicy.INTEGRAL);
        properties.setShards(Map.of("beans", 10));
        
        CounterOptions<String> options = properties.toCounterOptions();
        
        assertEquals(10, options.shardCountFor("beans"));
        assertEquals(4, options.shardCountFor("friends"));
        assertEquals(2, options.getReadFromShards());
        assertEquals(32, options.getMaxShardCount());
        assertEquals(DistributionPolicy.INTEGRAL, options.getDistributionPolicy());
    }
    
    @Test
    void testInvalidValuesAreRejected() {
        ShardedCounterProperties properties = new ShardedCounterProperties();
        properties.setShards(Map.of("beans", 0));
        
        assertThrows(IllegalArgumentException.class, properties::toCounterOptions);
        
        properties.setShards(Map.of("beans", 64));
        properties.setMaxShardCount(32);
        assertThrows(IllegalArgumentException.class, properties::toCounterOptions);
    }
}
