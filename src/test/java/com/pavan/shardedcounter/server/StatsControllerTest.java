package com.pavan.shardedcounter.server;

import com.pavan.shardedcounter.counter.ShardedCounter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.TestPropertySource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for StatsController REST endpoints.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@TestPropertySource(properties = {
    "spring.main.banner-mode=off",
    "logging.level.org.springframework=WARN",
    "shardedcounter.server.port=0",
    "shardedcounter.snapshot.enabled=false"
})
class StatsControllerTest {
    
    @LocalServerPort
    private int port;
    
    @Autowired
    private TestRestTemplate restTemplate;
    
    @Autowired
    private ShardedCounter<String> counter;
    
    @Test
    void testHealthEndpoint() {
        ResponseEntity<Map> response = restTemplate.getForEntity(
            "http://localhost:" + port + "/health", Map.class);
        
        assertEquals(HttpStatus.OK, response.getStatusCode());
        
        Map<String, Object> body = response.getBody();
        assertNotNull(body);
        assertEquals("UP", body.get("status"));
        assertEquals("RUNNING", body.get("nettyServer"));
        assertTrue(body.containsKey("shardRecords"));
        assertTrue(body.containsKey("timestamp"));
    }
    
    @Test
    void testStatsEndpoint() {
        counter.add("stats-beans", 10, 4);
        counter.add("stats-beans", 5, 4);
        counter.rebalance("stats-beans", 4);
        counter.count("stats-beans");
        
        ResponseEntity<Map> response = restTemplate.getForEntity(
            "http://localhost:" + port + "/stats", Map.class);
        
        assertEquals(HttpStatus.OK, response.getStatusCode());
        
        Map<String, Object> body = response.getBody();
        assertNotNull(body);
        
        @SuppressWarnings("unchecked")
        Map<String, Object> server = (Map<String, Object>) body.get("server");
        assertTrue(server.containsKey("totalConnections"));
        assertTrue(server.containsKey("activeConnections"));
        assertTrue(server.containsKey("totalCommands"));
        assertEquals(true, server.get("running"));
        assertTrue((Integer) server.get("port") > 0);
        
        @SuppressWarnings("unchecked")
        Map<String, Object> storeInfo = (Map<String, Object>) body.get("store");
        assertTrue((Integer) storeInfo.get("counters") >= 1);
        assertTrue((Integer) storeInfo.get("shardRecords") >= 4);
        assertTrue(storeInfo.containsKey("averageShardsPerCounter"));
        
        @SuppressWarnings("unchecked")
        Map<String, Object> operations = (Map<String, Object>) body.get("operations");
        assertTrue(((Number) operations.get("adds")).longValue() >= 2);
        assertTrue(((Number) operations.get("counts")).longValue() >= 1);
        assertTrue(((Number) operations.get("rebalances")).longValue() >= 1);
        assertTrue(((Number) operations.get("shardWrites")).longValue() >= 6);
        assertTrue(operations.containsKey("uptimeMillis"));
    }
    
    @Test
    void testStatsEndpointResponseFormat() {
        ResponseEntity<String> response = restTemplate.getForEntity(
            "http://localhost:" + port + "/stats", String.class);
        
        assertEquals(HttpStatus.OK, response.getStatusCode());
        
        String jsonResponse = response.getBody();
        assertNotNull(jsonResponse);
        assertTrue(jsonResponse.contains("\"server\""));
        assertTrue(jsonResponse.contains("\"store\""));
        assertTrue(jsonResponse.contains("\"operations\""));
    }
}
