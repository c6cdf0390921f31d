package com.arbiter.observation;

import com.arbiter.domain.model.SymbolObservation;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity ring of one symbol's most recent accepted observations.
 *
 * <p>Slots are preallocated; appending past capacity overwrites the oldest entry. Windows are
 * always "the last n entries", newest first. Thread-safe per instance.
 */
final class PrimitiveRingBuffer {

    private final SymbolObservation[] slots;
    private int next;
    private int size;

    PrimitiveRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.slots = new SymbolObservation[capacity];
    }

    synchronized void append(SymbolObservation observation) {
        slots[next] = observation;
        next = (next + 1) % slots.length;
        if (size < slots.length) {
            size++;
        }
    }

    synchronized int size() {
        return size;
    }

    synchronized Long lastObservedAt() {
        return size == 0 ? null : newest(0).getObservedAtMillis();
    }

    /** Up to {@code window} newest observations, newest first. */
    synchronized List<SymbolObservation> latest(int window) {
        int n = Math.min(Math.max(window, 0), size);
        List<SymbolObservation> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            result.add(newest(i));
        }
        return result;
    }

    /** i-th newest entry, 0 = most recent. Caller holds the lock. */
    private SymbolObservation newest(int i) {
        int index = Math.floorMod(next - 1 - i, slots.length);
        return slots[index];
    }

    synchronized WindowAggregate aggregate(String primitive, int window) {
        List<SymbolObservation> entries = latest(window);
        long count = 0;
        BigDecimal sum = BigDecimal.ZERO;
        for (SymbolObservation entry : entries) {
            BigDecimal value = entry.getPrimitives().get(primitive);
            if (value != null) {
                count++;
                sum = sum.add(value);
            }
        }
        return new WindowAggregate(primitive, entries.size(), count, sum);
    }
}
