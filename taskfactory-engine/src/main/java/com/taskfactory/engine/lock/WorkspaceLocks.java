package com.taskfactory.engine.lock;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair, reentrant lock per workspace. Phase moves, reorders, task
 * creation and deletion, queue scans and manual execution all hold it, so
 * WIP counts never race.
 */
public class WorkspaceLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String workspaceId, Supplier<T> action) {
        ReentrantLock lock = lockFor(workspaceId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String workspaceId, Runnable action) {
        withLock(workspaceId, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(String workspaceId) {
        ReentrantLock lock = locks.get(workspaceId);
        return lock != null && lock.isHeldByCurrentThread();
    }

    public void release(String workspaceId) {
        locks.remove(workspaceId);
    }

    private ReentrantLock lockFor(String workspaceId) {
        return locks.computeIfAbsent(workspaceId, ws -> new ReentrantLock(true));
    }
}
