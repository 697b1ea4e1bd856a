package com.taskmentor.tracker;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes all work for one user: conversational turns, REST mutations and scheduler jobs.
 * Different users never contend. A user's lock is dropped once no thread holds or waits for it.
 */
@Component
public class UserLockRegistry {

    private final Map<String, UserLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String userId, Supplier<T> action) {
        UserLock entry = locks.compute(userId, (key, current) -> {
            UserLock held = current != null ? current : new UserLock();
            held.users++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(userId, (key, current) -> --current.users == 0 ? null : current);
        }
    }

    public void runLocked(String userId, Runnable action) {
        withLock(userId, () -> {
            action.run();
            return null;
        });
    }

    int trackedUsers() {
        return locks.size();
    }

    /**
     * Holder and waiter count is only touched inside the map's compute functions.
     */
    private static final class UserLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
