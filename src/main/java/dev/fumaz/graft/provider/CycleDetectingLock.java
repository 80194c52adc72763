package dev.fumaz.graft.provider;

import dev.fumaz.graft.exception.CircularDependencyException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A reentrant lock that refuses to wait when waiting would close a cycle across threads.
 * <p>
 * Every blocked thread records the lock it waits for. Before each wait slice the chain of owners is followed; if it
 * leads back to the calling thread, a {@link CircularDependencyException} naming the locks on the chain is raised
 * instead of deadlocking.
 */
final class CycleDetectingLock {

    private static final long WAIT_SLICE_MILLIS = 10;
    private static final ConcurrentMap<Thread, CycleDetectingLock> WAITING = new ConcurrentHashMap<>();

    private final @NotNull String id;
    private final OwnedLock lock = new OwnedLock();

    CycleDetectingLock(@NotNull String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    void lock() throws InterruptedException {
        if (lock.tryLock()) {
            return;
        }

        Thread current = Thread.currentThread();
        WAITING.put(current, this);

        try {
            while (!lock.tryLock(WAIT_SLICE_MILLIS, TimeUnit.MILLISECONDS)) {
                List<String> cycle = findCycle(current);

                if (cycle != null) {
                    throw new CircularDependencyException(cycle);
                }
            }
        } finally {
            WAITING.remove(current);
        }
    }

    void unlock() {
        lock.unlock();
    }

    // [held by current, ..., this, held by current]
    private @Nullable List<String> findCycle(@NotNull Thread current) {
        List<String> walked = new ArrayList<>();
        Set<CycleDetectingLock> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        CycleDetectingLock next = this;

        while (next != null && seen.add(next)) {
            Thread owner = next.lock.owner();

            if (owner == null) {
                return null;
            }

            if (owner == current) {
                List<String> cycle = new ArrayList<>(walked.size() + 2);
                cycle.add(next.id);
                cycle.addAll(walked);
                cycle.add(next.id);
                return cycle;
            }

            walked.add(next.id);
            next = WAITING.get(owner);
        }

        return null;
    }

    private static final class OwnedLock extends ReentrantLock {

        private static final long serialVersionUID = 1L;

        @Nullable Thread owner() {
            return getOwner();
        }

    }

}
