package com.example.tasksync.service.sync;

import com.example.tasksync.domain.UnitRef;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped in-process locks serializing sync work per unit.
 * <p>
 * Two units may share a stripe, which only costs some parallelism. Across
 * replicas the unique constraints on the sync record table take over.
 */
@Component
public class UnitLockRegistry {

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public UnitLockRegistry() {
        for (var i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(UnitRef ref, Supplier<T> work) {
        var lock = locks[Math.floorMod(ref.key().hashCode(), STRIPES)];
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
