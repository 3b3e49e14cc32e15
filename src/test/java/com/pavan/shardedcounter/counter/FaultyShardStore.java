package com.pavan.shardedcounter.counter;

import com.pavan.shardedcounter.store.InMemoryShardStore;
import com.pavan.shardedcounter.store.Shard;
import com.pavan.shardedcounter.store.ShardId;
import com.pavan.shardedcounter.store.ShardStore;
import com.pavan.shardedcounter.store.ShardStoreException;

import java.util.List;
import java.util.Optional;

/**
 * Store that delegates to an in-memory store but can be told to fail writes.
 */
class FaultyShardStore implements ShardStore<String> {

    final InMemoryShardStore<String> delegate = new InMemoryShardStore<>();
    private int writesBeforeFailure = -1;
    private boolean readsFail;

    /**
     * Lets {@code writes} more writes through, then fails every write.
     */
    void failWritesAfter(int writes) {
        this.writesBeforeFailure = writes;
    }

    void failReads() {
        this.readsFail = true;
    }

    void heal() {
        this.writesBeforeFailure = -1;
        this.readsFail = false;
    }

    @Override
    public Optional<Shard<String>> get(String name, int shardIndex) {
        checkRead();
        return delegate.get(name, shardIndex);
    }

    @Override
    public void put(String name, int shardIndex, double value) {
        checkWrite();
        delegate.put(name, shardIndex, value);
    }

    @Override
    public Shard<String> increment(String name, int shardIndex, double delta) {
        checkWrite();
        return delegate.increment(name, shardIndex, delta);
    }

    @Override
    public boolean delete(ShardId<String> id) {
        checkWrite();
        return delegate.delete(id);
    }

    @Override
    public List<Shard<String>> scan(String name) {
        checkRead();
        return delegate.scan(name);
    }

    private void checkRead() {
        if (readsFail) {
            throw new ShardStoreException("store unavailable");
        }
    }

    private void checkWrite() {
        if (writesBeforeFailure == 0) {
            throw new ShardStoreException("transaction conflict");
        }
        if (writesBeforeFailure > 0) {
            writesBeforeFailure--;
        }
    }
}
