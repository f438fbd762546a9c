package com.marketpulse.history;

import com.marketpulse.domain.model.MarketSnapshot;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded FIFO of past snapshots used for rule lookback.
 *
 * <p>Holds at most {@code capacity} entries; appending to a full window evicts the
 * oldest. Rules receive an immutable copy via {@link #snapshots()}, taken before the
 * current cycle's snapshot is appended, so the window never contains the snapshot
 * being evaluated.
 */
public class HistoryWindow {

    private final int capacity;
    private final Deque<MarketSnapshot> snapshots;

    public HistoryWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.snapshots = new ArrayDeque<>(capacity);
    }

    public synchronized void append(MarketSnapshot snapshot) {
        if (snapshots.size() == capacity) {
            snapshots.pollFirst();
        }
        snapshots.addLast(snapshot);
    }

    /** Immutable copy, oldest first. */
    public synchronized List<MarketSnapshot> snapshots() {
        return List.copyOf(snapshots);
    }

    public synchronized Optional<MarketSnapshot> latest() {
        return Optional.ofNullable(snapshots.peekLast());
    }

    public synchronized int size() {
        return snapshots.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
