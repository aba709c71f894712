package com.deepansh.graphagent.llm;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed, priority-ordered list of model backends plus the shared "current" cursor.
 *
 * The list never changes after startup. The cursor only moves forward (circularly)
 * when the dispatcher rotates away from an exhausted backend; it is never reset
 * to the highest-priority entry after a success.
 */
@Slf4j
public class ModelBackendRegistry {

    private final List<ModelBackend> backends;
    private final AtomicInteger cursor;

    public ModelBackendRegistry(List<ModelBackend> backends, String defaultBackend) {
        if (backends.isEmpty()) {
            throw new IllegalArgumentException("At least one model backend must be configured");
        }
        this.backends = List.copyOf(backends);
        this.cursor = new AtomicInteger(indexOf(defaultBackend));
    }

    public int size() {
        return backends.size();
    }

    public List<ModelBackend> all() {
        return backends;
    }

    public int currentIndex() {
        return cursor.get();
    }

    public ModelBackend current() {
        return backends.get(cursor.get());
    }

    public ModelBackend get(int index) {
        return backends.get(index);
    }

    public ModelBackend byName(String name) {
        return backends.get(indexOf(name));
    }

    /**
     * Moves the cursor from {@code fromIndex} to the next backend.
     * A no-op when another call already rotated away from {@code fromIndex}.
     *
     * @return the index the cursor points at afterwards
     */
    public int advanceFrom(int fromIndex) {
        int next = (fromIndex + 1) % backends.size();
        if (cursor.compareAndSet(fromIndex, next)) {
            log.info("Backend cursor rotated: {} -> {}", backends.get(fromIndex).name(), backends.get(next).name());
        }
        return cursor.get();
    }

    private int indexOf(String name) {
        if (name == null || name.isBlank()) {
            return 0;
        }
        for (int i = 0; i < backends.size(); i++) {
            if (backends.get(i).name().equals(name)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Unknown model backend: " + name);
    }
}
