package adcp.workflow.service;

import adcp.workflow.model.Task;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per media buy (else per task) mutual exclusion around adapter calls.
 * The engine never issues two concurrent adapter calls for one media buy.
 */
public final class ExecutionLocks {

    @FunctionalInterface
    public interface LockedCall<T, E extends Exception> {
        T call() throws E;
    }

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public static String mediaBuyKey(String mediaBuyId) {
        return "mb:" + mediaBuyId;
    }

    public static String keyFor(Task task) {
        return task.mediaBuyId() != null ? mediaBuyKey(task.mediaBuyId()) : "task:" + task.id();
    }

    public <T, E extends Exception> T withLock(String key, LockedCall<T, E> call) throws E {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return call.call();
        } finally {
            lock.unlock();
        }
    }
}
