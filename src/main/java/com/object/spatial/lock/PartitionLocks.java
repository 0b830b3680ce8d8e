package com.object.spatial.lock;

import com.object.spatial.core.model.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * One {@link ReentrantReadWriteLock} per root partition.
 *
 * <p>Operations on disjoint partitions never contend. Operations spanning several
 * partitions take their locks in ascending root-id order, so two such operations
 * cannot deadlock each other.</p>
 */
public class PartitionLocks {
    private static final Logger log = LoggerFactory.getLogger(PartitionLocks.class);

    private final ConcurrentHashMap<NodeId, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public PartitionLocks() {
        this(LockConfig.defaults());
    }

    public PartitionLocks(LockConfig config) {
        this.config = config;
    }

    /**
     * Runs {@code action} holding the read lock of one partition.
     */
    public <T> T read(NodeId root, Supplier<T> action) {
        Lock lock = lockFor(root).readLock();
        acquire(lock, root);
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} holding the write lock of one partition.
     */
    public <T> T write(NodeId root, Supplier<T> action) {
        return write(List.of(root), action);
    }

    /**
     * Runs {@code action} holding the write locks of every listed partition.
     */
    public <T> T write(Collection<NodeId> roots, Supplier<T> action) {
        List<Lock> held = new ArrayList<>();
        try {
            for (NodeId root : new TreeSet<>(roots)) {
                Lock lock = lockFor(root).writeLock();
                acquire(lock, root);
                held.add(lock);
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    /**
     * Returns true if the current thread holds the write lock of the partition.
     */
    public boolean isWriteLockedByCurrentThread(NodeId root) {
        ReentrantReadWriteLock lock = locks.get(root);
        return lock != null && lock.isWriteLockedByCurrentThread();
    }

    private ReentrantReadWriteLock lockFor(NodeId root) {
        return locks.computeIfAbsent(root, k -> new ReentrantReadWriteLock(config.fair()));
    }

    private void acquire(Lock lock, NodeId root) {
        try {
            if (!lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for partition " + root + " within " + config.timeoutMs() + "ms");
            }
            log.trace("Partition lock acquired: {}", root);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for partition " + root, e);
        }
    }
}
