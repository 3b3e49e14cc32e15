package com.pavan.shardedcounter.snapshot;

import com.pavan.shardedcounter.store.InMemoryShardStore;
import com.pavan.shardedcounter.store.Shard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Manages periodic snapshots of an InMemoryShardStore to disk in compact binary form.
 * A snapshot holds the current shard records only; earlier values are not kept.
 */
public class SnapshotManager {
    
    private static final Logger logger = LoggerFactory.getLogger(SnapshotManager.class);
    
    private final Path snapshotDirectory;
    private ScheduledExecutorService snapshotExecutor;
    private ScheduledFuture<?> snapshotTask;
    private volatile boolean snapshotRunning;
    
    private static final String SNAPSHOT_FILE_PREFIX = "snapshot-";
    private static final String SNAPSHOT_FILE_EXTENSION = ".bin";
    private static final long DEFAULT_SNAPSHOT_INTERVAL_SECONDS = 30;
    
    /**
     * Creates a SnapshotManager with the specified snapshot directory.
     *
     * @param snapshotDirectory directory where snapshots will be stored
     * @throws IOException if directory cannot be created
     */
    public SnapshotManager(String snapshotDirectory) throws IOException {
        this.snapshotDirectory = Paths.get(snapshotDirectory);
        Files.createDirectories(this.snapshotDirectory);
        this.snapshotRunning = false;
    }
    
    /**
     * Starts automatic periodic snapshots every 30 seconds.
     *
     * @param store the store to snapshot
     * @throws IllegalStateException if snapshots are already running
     */
    public synchronized <K> void startPeriodicSnapshots(InMemoryShardStore<K> store) {
        startPeriodicSnapshots(store, DEFAULT_SNAPSHOT_INTERVAL_SECONDS);
    }
    
    /**
     * Starts automatic periodic snapshots with custom interval.
     *
     * @param store the store to snapshot
     * @param intervalSeconds interval between snapshots in seconds
     * @throws IllegalStateException if snapshots are already running
     */
    public synchronized <K> void startPeriodicSnapshots(InMemoryShardStore<K> store, long intervalSeconds) {
        startPeriodicSnapshots(store, intervalSeconds, Integer.MAX_VALUE);
    }
    
    /**
     * Starts automatic periodic snapshots, pruning all but the newest {@code keepCount}
     * snapshot files after each save.
     *
     * @param store the store to snapshot
     * @param intervalSeconds interval between snapshots in seconds
     * @param keepCount number of snapshot files to retain
     * @throws IllegalStateException if snapshots are already running
     */
    public synchronized <K> void startPeriodicSnapshots(InMemoryShardStore<K> store, long intervalSeconds,
                                                        int keepCount) {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("Snapshot interval must be positive");
        }
        if (keepCount < 1) {
            throw new IllegalArgumentException("Keep count must be at least 1");
        }
        if (snapshotRunning) {
            throw new IllegalStateException("Periodic snapshots are already running");
        }
        
        snapshotExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "Snapshot-Manager");
            thread.setDaemon(true);
            return thread;
        });
        
        snapshotTask = snapshotExecutor.scheduleAtFixedRate(
            () -> {
                try {
                    saveSnapshot(store);
                    cleanupOldSnapshots(keepCount);
                } catch (Exception e) {
                    logger.error("Error during periodic snapshot", e);
                }
            },
            intervalSeconds,
            intervalSeconds,
            TimeUnit.SECONDS
        );
        
        snapshotRunning = true;
    }
    
    /**
     * Stops automatic periodic snapshots.
     *
     * @throws IllegalStateException if snapshots are not running
     */
    public synchronized void stopPeriodicSnapshots() {
        if (!snapshotRunning) {
            throw new IllegalStateException("Periodic snapshots are not running");
        }
        
        if (snapshotTask != null) {
            snapshotTask.cancel(false);
            snapshotTask = null;
        }
        
        if (snapshotExecutor != null) {
            snapshotExecutor.shutdown();
            try {
                if (!snapshotExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    snapshotExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                snapshotExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            snapshotExecutor = null;
        }
        
        snapshotRunning = false;
    }
    
    /**
     * Checks if periodic snapshots are running.
     */
    public boolean isSnapshotRunning() {
        return snapshotRunning;
    }
    
    /**
     * Saves a snapshot of the store to disk. The file is written under a temporary name
     * and moved into place, so a reader never sees a partial snapshot.
     *
     * @param store the store to snapshot
     * @return the path to the saved snapshot file
     * @throws IOException if snapshot cannot be saved
     */
    public <K> Path saveSnapshot(InMemoryShardStore<K> store) throws IOException {
        long timestamp = System.currentTimeMillis();
        String filename = SNAPSHOT_FILE_PREFIX + timestamp + SNAPSHOT_FILE_EXTENSION;
        Path snapshotFile = snapshotDirectory.resolve(filename);
        Path tempFile = snapshotDirectory.resolve(filename + ".tmp");

        SnapshotData<K> snapshotData = new SnapshotData<>();
        snapshotData.timestamp = timestamp;
        snapshotData.shards = new ArrayList<>(store.captureSnapshot());
        try (ObjectOutputStream out = new ObjectOutputStream(
            new BufferedOutputStream(Files.newOutputStream(tempFile)))) {
            out.writeObject(snapshotData);
        }

        try {
            Files.move(tempFile, snapshotFile,
                StandardCopyOption.ATOMIC_MOVE,
                StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException atomicMoveFailure) {
            Files.move(tempFile, snapshotFile, StandardCopyOption.REPLACE_EXISTING);
        }

        logger.debug("Saved snapshot {} with {} shard records", snapshotFile, snapshotData.shards.size());
        return snapshotFile;
    }
    
    /**
     * Loads the most recent snapshot from disk into the store.
     *
     * @param store the store to restore into
     * @return true if a snapshot was loaded, false if no snapshot exists
     * @throws IOException if snapshot cannot be loaded
     */
    public <K> boolean loadLatestSnapshot(InMemoryShardStore<K> store) throws IOException {
        File latestSnapshot = findLatestSnapshot();
        if (latestSnapshot == null) {
            return false;
        }
        
        return loadSnapshot(store, latestSnapshot.toPath());
    }
    
    /**
     * Loads a specific snapshot file into the store.
     *
     * @param store the store to restore into
     * @param snapshotFile the snapshot file to load
     * @return true if snapshot was loaded successfully
     * @throws IOException if snapshot cannot be loaded
     */
    @SuppressWarnings("unchecked")
    public <K> boolean loadSnapshot(InMemoryShardStore<K> store, Path snapshotFile) throws IOException {
        if (!Files.exists(snapshotFile)) {
            return false;
        }

        SnapshotData<K> snapshotData;
        try (ObjectInputStream in = new ObjectInputStream(
            new BufferedInputStream(Files.newInputStream(snapshotFile)))) {
            snapshotData = (SnapshotData<K>) in.readObject();
        } catch (ClassNotFoundException e) {
            throw new IOException("Failed to deserialize snapshot: " + snapshotFile, e);
        }
        
        store.restoreSnapshot(snapshotData.shards);
        logger.info("Loaded snapshot {} ({} shard records)", snapshotFile, snapshotData.shards.size());
        return true;
    }
    
    /**
     * Finds the most recent snapshot file.
     */
    private File findLatestSnapshot() {
        File[] files = listSnapshots();
        if (files == null || files.length == 0) {
            return null;
        }
        
        File latest = files[0];
        for (File file : files) {
            if (timestampOf(file) > timestampOf(latest)) {
                latest = file;
            }
        }
        
        return latest;
    }
    
    /**
     * Deletes old snapshots, keeping only the specified number of most recent ones.
     *
     * @param keepCount number of snapshots to keep
     * @return number of snapshots deleted
     */
    public int cleanupOldSnapshots(int keepCount) {
        if (keepCount < 0) {
            throw new IllegalArgumentException("Keep count must be non-negative");
        }
        
        File[] files = listSnapshots();
        if (files == null || files.length <= keepCount) {
            return 0;
        }
        
        // Newest first
        Arrays.sort(files, (a, b) -> Long.compare(timestampOf(b), timestampOf(a)));
        
        int deleted = 0;
        for (int i = keepCount; i < files.length; i++) {
            if (files[i].delete()) {
                deleted++;
            } else {
                logger.warn("Could not delete old snapshot {}", files[i]);
            }
        }
        
        return deleted;
    }
    
    /**
     * Save time encoded in the file name, or the modification time for names that do not parse.
     */
    private static long timestampOf(File file) {
        String name = file.getName();
        String digits = name.substring(SNAPSHOT_FILE_PREFIX.length(), name.length() - SNAPSHOT_FILE_EXTENSION.length());
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return file.lastModified();
        }
    }
    
    private File[] listSnapshots() {
        return snapshotDirectory.toFile().listFiles(
            (dir, name) -> name.startsWith(SNAPSHOT_FILE_PREFIX) &&
                          name.endsWith(SNAPSHOT_FILE_EXTENSION)
        );
    }
    
    /**
     * Data structure for binary snapshot serialization.
     */
    static class SnapshotData<K> implements Serializable {
        private static final long serialVersionUID = 1L;
        public long timestamp;
        public List<Shard<K>> shards;
        
        public SnapshotData() {
            this.shards = new ArrayList<>();
        }
    }
}
