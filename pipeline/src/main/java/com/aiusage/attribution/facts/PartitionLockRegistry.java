package com.aiusage.attribution.facts;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.SortedSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process locks per fact partition.
 *
 * Partitions are always acquired in sorted order, so two merges over
 * overlapping partitions cannot deadlock.
 */
@Component
@Slf4j
public class PartitionLockRegistry {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public PartitionLockRegistry(@Value("${attribution.merge.lock-timeout:5m}") Duration timeout) {
        this.timeout = timeout;
    }

    public <T> T withLocks(SortedSet<String> partitions, Supplier<T> work) {
        Deque<ReentrantLock> held = new ArrayDeque<>();
        try {
            for (String partition : partitions) {
                ReentrantLock lock = locks.computeIfAbsent(partition, key -> new ReentrantLock());
                if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new MergeConflictException("Timed out waiting for partition lock " + partition);
                }
                held.push(lock);
            }
            log.debug("Holding {} partition lock(s)", held.size());
            return work.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MergeConflictException("Interrupted while waiting for partition locks", e);
        } finally {
            while (!held.isEmpty()) {
                held.pop().unlock();
            }
        }
    }
}
