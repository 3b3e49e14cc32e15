package com.pavan.shardedcounter.server;

import com.pavan.shardedcounter.metrics.StatsCollector;
import com.pavan.shardedcounter.store.InMemoryShardStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * REST controller for exposing live metrics.
 */
@RestController
public class StatsController {
    
    private final InMemoryShardStore<String> store;
    private final StatsCollector stats;
    private final NettyServer nettyServer;
    
    @Autowired
    public StatsController(InMemoryShardStore<String> store, StatsCollector stats, NettyServer nettyServer) {
        this.store = store;
        this.stats = stats;
        this.nettyServer = nettyServer;
    }
    
    /**
     * GET /stats - Returns live metrics in JSON format
     */
    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        Map<String, Object> response = new HashMap<>();
        response.put("server", getServerInfo());
        response.put("store", getStoreInfo());
        response.put("operations", getOperationStats());
        return response;
    }
    
    /**
     * GET /health - Simple health check endpoint
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("nettyServer", nettyServer.isRunning() ? "RUNNING" : "STOPPED");
        response.put("shardRecords", store.size());
        response.put("timestamp", System.currentTimeMillis());
        return response;
    }
    
    private Map<String, Object> getServerInfo() {
        Map<String, Object> serverInfo = new HashMap<>();
        
        NettyServer.ServerStats serverStats = nettyServer.getStats();
        serverInfo.put("totalConnections", serverStats.totalConnections);
        serverInfo.put("activeConnections", serverStats.activeConnections);
        serverInfo.put("totalCommands", serverStats.totalCommands);
        serverInfo.put("running", nettyServer.isRunning());
        serverInfo.put("port", nettyServer.getPort());
        
        return serverInfo;
    }
    
    private Map<String, Object> getStoreInfo() {
        Map<String, Object> storeInfo = new HashMap<>();
        
        int counters = store.names().size();
        int shardRecords = store.size();
        storeInfo.put("counters", counters);
        storeInfo.put("shardRecords", shardRecords);
        storeInfo.put("averageShardsPerCounter",
            counters == 0 ? 0.0 : Math.round((double) shardRecords / counters * 100.0) / 100.0);
        
        return storeInfo;
    }
    
    private Map<String, Object> getOperationStats() {
        Map<String, Object> operations = new HashMap<>();
        
        StatsCollector.StatsSnapshot snapshot = stats.getSnapshot();
        operations.put("adds", snapshot.totalAdds);
        operations.put("counts", snapshot.totalCounts);
        operations.put("estimates", snapshot.totalEstimates);
        operations.put("rebalances", snapshot.totalRebalances);
        operations.put("resets", snapshot.totalResets);
        operations.put("totalOperations", snapshot.getTotalOperations());
        operations.put("shardReads", snapshot.shardReads);
        operations.put("shardWrites", snapshot.shardWrites);
        operations.put("shardScans", snapshot.shardScans);
        operations.put("shardsCreated", snapshot.shardsCreated);
        operations.put("shardsDeleted", snapshot.shardsDeleted);
        operations.put("uptimeMillis", snapshot.uptimeMillis);
        
        return operations;
    }
}
