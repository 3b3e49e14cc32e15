package com.pavan.shardedcounter;

import com.pavan.shardedcounter.config.ShardedCounterProperties;
import com.pavan.shardedcounter.counter.CounterOptions;
import com.pavan.shardedcounter.counter.ShardRandom;
import com.pavan.shardedcounter.counter.ShardedCounter;
import com.pavan.shardedcounter.metrics.StatsCollector;
import com.pavan.shardedcounter.server.NettyServer;
import com.pavan.shardedcounter.snapshot.SnapshotManager;
import com.pavan.shardedcounter.store.InMemoryShardStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.io.IOException;

@SpringBootApplication
@EnableConfigurationProperties(ShardedCounterProperties.class)
public class ShardedCounterApplication implements CommandLineRunner, DisposableBean {

	private static final Logger logger = LoggerFactory.getLogger(ShardedCounterApplication.class);
	
	private final ShardedCounterProperties properties;
	private final StatsCollector stats;
	private final InMemoryShardStore<String> store;
	
	private NettyServer server;
	private SnapshotManager snapshotManager;

	public ShardedCounterApplication(ShardedCounterProperties properties) {
		this.properties = properties;
		this.stats = new StatsCollector();
		this.store = new InMemoryShardStore<>(stats);
	}

	public static void main(String[] args) {
		SpringApplication.run(ShardedCounterApplication.class, args);
	}

	@Override
	public void run(String... args) throws Exception {
		printBanner();
		initializeSnapshotManager();
		startServer();
		printStartupInfo();
	}
	
	private void printBanner() {
		logger.info("=".repeat(60));
		logger.info("  ShardedCounter");
		logger.info("  High-throughput counters with sampled reads");
		logger.info("=".repeat(60));
		CounterOptions<String> options = shardedCounter().getOptions();
		logger.info("  - Default shard count: {}", options.getDefaultShardCount());
		logger.info("  - Read-from-shards for estimates: {}", options.getReadFromShards());
		logger.info("  - Rebalance policy: {}", options.getDistributionPolicy());
		logger.info("  - Per-counter shard counts: {}", options.getShardsByName());
		logger.info("  - Max shard count: {}", options.getMaxShardCount());
	}
	
	private void initializeSnapshotManager() throws IOException {
		ShardedCounterProperties.Snapshot config = properties.getSnapshot();
		if (!config.isEnabled()) {
			logger.info("Snapshots disabled, counters live in memory only");
			return;
		}
		logger.info("Initializing SnapshotManager...");
		logger.info("  - Snapshot directory: {}", config.getDirectory());
		
		snapshotManager = new SnapshotManager(config.getDirectory());
		
		boolean loaded = snapshotManager.loadLatestSnapshot(store);
		if (loaded) {
			logger.info("Loaded latest snapshot: {} counters, {} shard records",
				store.names().size(), store.size());
		} else {
			logger.info("No existing snapshot found, starting with empty store");
		}
		
		if (config.getIntervalSeconds() > 0) {
			snapshotManager.startPeriodicSnapshots(store, config.getIntervalSeconds(), config.getKeep());
			logger.info("Periodic snapshots enabled (interval: {} seconds, keep: {})",
				config.getIntervalSeconds(), config.getKeep());
		}
	}
	
	private void startServer() {
		logger.info("Starting counter protocol server...");
		logger.info("  - Port: {}", properties.getServer().getPort());
		logger.info("  - Worker threads: {}", properties.getServer().getWorkerThreads());
		
		nettyServer().start();
	}
	
	private void printStartupInfo() {
		logger.info("=".repeat(60));
		logger.info("ShardedCounter is ready to accept connections!");
		logger.info("");
		logger.info("Counter protocol (TCP): localhost:{}", server.getPort());
		logger.info("  - ADD name delta [shards [pin]] : Add to a counter, replies with the shard used");
		logger.info("  - INCR name / DECR name         : Add 1 / subtract 1");
		logger.info("  - COUNT name                    : Exact value (reads every shard)");
		logger.info("  - ESTIMATE name [read [shards]] : Sampled value");
		logger.info("  - REBALANCE name [shards]       : Spread the value evenly over the shards");
		logger.info("  - RESET name                    : Delete every shard of a counter");
		logger.info("  - STATS / PING / QUIT");
		logger.info("");
		logger.info("REST API (HTTP): GET /stats, GET /health, /api/counters/{name}");
		logger.info("=".repeat(60));
	}
	
	@Override
	public void destroy() {
		logger.info("=".repeat(60));
		logger.info("Shutting down ShardedCounter...");
		
		if (server != null && server.isRunning()) {
			server.stop();
		}
		
		if (snapshotManager != null) {
			try {
				if (snapshotManager.isSnapshotRunning()) {
					snapshotManager.stopPeriodicSnapshots();
				}
				logger.info("Saving final snapshot...");
				snapshotManager.saveSnapshot(store);
				logger.info("Final snapshot saved ({} shard records)", store.size());
			} catch (IOException e) {
				logger.error("Failed to save final snapshot: {}", e.getMessage());
			}
		}
		
		logger.info("Final statistics: {}", stats);
		logger.info("ShardedCounter shutdown complete.");
		logger.info("=".repeat(60));
	}
	
	@Bean
	public StatsCollector statsCollector() {
		return stats;
	}
	
	@Bean
	public InMemoryShardStore<String> shardStore() {
		return store;
	}
	
	@Bean
	public ShardedCounter<String> shardedCounter() {
		return new ShardedCounter<>(store, properties.toCounterOptions(), ShardRandom.threadLocal(), stats);
	}
	
	@Bean
	public NettyServer nettyServer() {
		if (server == null) {
			ShardedCounterProperties.Server config = properties.getServer();
			server = new NettyServer(shardedCounter(), config.getPort(), config.getWorkerThreads());
		}
		return server;
	}
}
