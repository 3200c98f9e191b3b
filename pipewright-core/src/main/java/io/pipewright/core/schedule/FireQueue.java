package io.pipewright.core.schedule;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// FIFO of fire events waiting for the active run of a job to finish.
///
/// Applies the {@link BacklogPolicy}: under {@link BacklogPolicy#COLLAPSE}
/// at most one event is pending and a newer one replaces it; under
/// {@link BacklogPolicy#QUEUE_ALL} up to `capacity` events are kept and
/// overflow evicts the oldest.
///
/// @implNote **Not thread-safe**. {@link ScheduledJob} guards every access
/// with its own lock.
public final class FireQueue {

    private final Deque<FireEvent> pending = new ArrayDeque<>();
    private final int capacity;

    /// Creates a queue.
    ///
    /// @param policy backlog policy, not null
    /// @param maxPendingFires bound used by {@link BacklogPolicy#QUEUE_ALL}, positive
    public FireQueue(BacklogPolicy policy, int maxPendingFires) {
        Objects.requireNonNull(policy, "policy must not be null");
        if (maxPendingFires < 1) {
            throw new IllegalArgumentException("maxPendingFires must be positive");
        }
        this.capacity = policy == BacklogPolicy.COLLAPSE ? 1 : maxPendingFires;
    }

    /// Enqueues an event.
    ///
    /// @param event fire event, not null
    /// @return the event evicted to make room, empty if nothing was dropped
    public Optional<FireEvent> offer(FireEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        FireEvent evicted = pending.size() >= capacity ? pending.pollFirst() : null;
        pending.addLast(event);
        return Optional.ofNullable(evicted);
    }

    /// Removes the oldest pending event.
    ///
    /// @return oldest event, empty if none is pending
    public Optional<FireEvent> poll() {
        return Optional.ofNullable(pending.pollFirst());
    }

    /// Removes every pending event.
    ///
    /// @return removed events, oldest first, never null
    public List<FireEvent> clear() {
        List<FireEvent> removed = new ArrayList<>(pending);
        pending.clear();
        return removed;
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
