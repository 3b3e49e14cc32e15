package com.pavan.shardedcounter.server;

import com.pavan.shardedcounter.counter.ShardedCounter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * REST controller for the web console.
 * Provides HTTP endpoints that run counter operations.
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class WebConsoleController {
    
    private final ShardedCounter<String> counter;
    
    @Autowired
    public WebConsoleController(ShardedCounter<String> counter) {
        this.counter = counter;
    }
    
    /**
     * ADD - body {"delta": 5, "shards": 3, "shard": 1}; only delta is required
     */
    @PostMapping("/counters/{name}/add")
    public Map<String, Object> add(@PathVariable String name, @RequestBody Map<String, Object> request) {
        Map<String, Object> response = new HashMap<>();
        try {
            Object delta = request.get("delta");
            if (!(delta instanceof Number)) {
                response.put("success", false);
                response.put("message", "Numeric delta is required");
                return response;
            }
            
            Integer shards = optionalInt(request.get("shards"));
            Integer pinned = optionalInt(request.get("shard"));
            int shardIndex = counter.add(name, ((Number) delta).doubleValue(), shards, pinned);
            
            response.put("success", true);
            response.put("shard", shardIndex);
            response.put("command", "ADD " + name + " " + delta);
        } catch (Exception e) {
            response.put("success", false);
            response.put("message", "Error: " + e.getMessage());
        }
        return response;
    }
    
    /**
     * COUNT - exact value of a counter
     */
    @GetMapping("/counters/{name}")
    public Map<String, Object> count(@PathVariable String name) {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("success", true);
            response.put("name", name);
            response.put("count", counter.count(name));
            response.put("command", "COUNT " + name);
        } catch (Exception e) {
            response.put("success", false);
            response.put("message", "Error: " + e.getMessage());
        }
        return response;
    }
    
    /**
     * ESTIMATE - sampled value of a counter
     */
    @GetMapping("/counters/{name}/estimate")
    public Map<String, Object> estimate(@PathVariable String name,
                                        @RequestParam(required = false) Integer readFromShards,
                                        @RequestParam(required = false) Integer shards) {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("success", true);
            response.put("name", name);
            response.put("estimate", counter.estimateCount(name, shards, readFromShards));
            response.put("command", "ESTIMATE " + name);
        } catch (Exception e) {
            response.put("success", false);
            response.put("message", "Error: " + e.getMessage());
        }
        return response;
    }
    
    /**
     * REBALANCE - spread a counter evenly over its shards
     */
    @PostMapping("/counters/{name}/rebalance")
    public Map<String, Object> rebalance(@PathVariable String name,
                                         @RequestParam(required = false) Integer shards) {
        Map<String, Object> response = new HashMap<>();
        try {
            double total = counter.rebalance(name, shards);
            response.put("success", true);
            response.put("total", total);
            response.put("message", "OK");
            response.put("command", "REBALANCE " + name);
        } catch (Exception e) {
            response.put("success", false);
            response.put("message", "Error: " + e.getMessage());
        }
        return response;
    }
    
    /**
     * RESET - delete every shard of a counter
     */
    @DeleteMapping("/counters/{name}")
    public Map<String, Object> reset(@PathVariable String name) {
        Map<String, Object> response = new HashMap<>();
        try {
            int deleted = counter.reset(name);
            response.put("success", true);
            response.put("deleted", deleted);
            response.put("message", "OK");
            response.put("command", "RESET " + name);
        } catch (Exception e) {
            response.put("success", false);
            response.put("message", "Error: " + e.getMessage());
        }
        return response;
    }
    
    /**
     * PING command - Test connection
     */
    @GetMapping("/ping")
    public Map<String, Object> ping() {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "PONG");
        response.put("timestamp", System.currentTimeMillis());
        return response;
    }
    
    private static Integer optionalInt(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Expected an integer but got '" + value + "'");
        }
        double number = ((Number) value).doubleValue();
        if (number != Math.rint(number) || number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Expected an integer but got '" + value + "'");
        }
        return (int) number;
    }
}
