package com.ryuqq.loadguard.adapter.inmemory.store;

import com.ryuqq.loadguard.core.model.TaskHandle;
import com.ryuqq.loadguard.core.spi.TaskStore;
import com.ryuqq.loadguard.core.statemachine.TaskState;
import com.ryuqq.loadguard.core.task.TaskStatus;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link TaskStore} SPI.
 *
 * <p>Task snapshots are immutable {@link TaskStatus} records held in a {@link ConcurrentHashMap}.
 * State changes go through {@link ConcurrentHashMap#computeIfPresent}, which runs the
 * compare-and-set atomically per handle, so a cancel racing with a worker start lets exactly one win.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * TaskStore store = new InMemoryTaskStore();
 * store.create(TaskStatus.pending(handle, now));
 *
 * Optional&lt;TaskStatus&gt; running = store.transitionIf(handle, TaskState.PENDING, s -&gt; s.toRunning(now));
 * </pre>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Finished records accumulate until {@link #removeFinishedBefore(long)} is called</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentHashMap<TaskHandle, TaskStatus> tasks;

    /**
     * Creates a new InMemoryTaskStore with empty storage.
     */
    public InMemoryTaskStore() {
        this.tasks = new ConcurrentHashMap<>();
    }

    @Override
    public void create(TaskStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status.state() != TaskState.PENDING) {
            throw new IllegalArgumentException("new task must be PENDING, but was: " + status.state());
        }

        TaskStatus existing = tasks.putIfAbsent(status.handle(), status);
        if (existing != null) {
            throw new IllegalStateException("Task already exists for handle: " + status.handle());
        }
    }

    @Override
    public Optional<TaskStatus> find(TaskHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        return Optional.ofNullable(tasks.get(handle));
    }

    @Override
    public Optional<TaskStatus> transitionIf(TaskHandle handle, TaskState expected, UnaryOperator<TaskStatus> mutation) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }
        if (mutation == null) {
            throw new IllegalArgumentException("mutation cannot be null");
        }

        TaskStatus[] applied = new TaskStatus[1];
        TaskStatus current = tasks.computeIfPresent(handle, (key, status) -> {
            if (status.state() != expected) {
                return status;
            }
            TaskStatus next = mutation.apply(status);
            if (next == null || !next.handle().equals(key)) {
                throw new IllegalStateException("mutation must return a snapshot for the same handle: " + key);
            }
            applied[0] = next;
            return next;
        });

        if (current == null) {
            throw new IllegalStateException("No task found for handle: " + handle);
        }
        return Optional.ofNullable(applied[0]);
    }

    @Override
    public boolean remove(TaskHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        return tasks.remove(handle) != null;
    }

    @Override
    public int removeFinishedBefore(long finishedBeforeMillis) {
        int removed = 0;
        for (Map.Entry<TaskHandle, TaskStatus> entry : tasks.entrySet()) {
            TaskStatus status = entry.getValue();
            if (status.isTerminal()
                && status.finishedAtMillis() < finishedBeforeMillis
                && tasks.remove(entry.getKey(), status)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return tasks.size();
    }

    @Override
    public void clear() {
        tasks.clear();
    }
}
