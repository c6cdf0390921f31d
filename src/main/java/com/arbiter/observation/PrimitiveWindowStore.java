package com.arbiter.observation;

import com.arbiter.config.ObservationProperties;
import com.arbiter.domain.model.SymbolObservation;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Per-symbol windows of recent observations that passed the integrity checks.
 *
 * <p>Read-only numeric aggregates for the strategy layer and the last accepted timestamp for the
 * regression check. Keyed by symbol only; nothing is stored under an interpreted name.
 */
@Component
public class PrimitiveWindowStore {

    private final Map<String, PrimitiveRingBuffer> buffers = new ConcurrentHashMap<>();
    private final int capacity;

    public PrimitiveWindowStore(ObservationProperties properties) {
        this.capacity = properties.getWindowCapacity();
    }

    public void record(SymbolObservation observation) {
        buffers.computeIfAbsent(observation.getSymbol(), s -> new PrimitiveRingBuffer(capacity))
                .append(observation);
    }

    /** Timestamp of the newest accepted observation, null if none. */
    public Long lastObservedAt(String symbol) {
        PrimitiveRingBuffer buffer = buffers.get(symbol);
        return buffer != null ? buffer.lastObservedAt() : null;
    }

    public WindowAggregate aggregate(String symbol, String primitive, int window) {
        PrimitiveRingBuffer buffer = buffers.get(symbol);
        if (buffer == null) {
            return new WindowAggregate(primitive, 0, 0, BigDecimal.ZERO);
        }
        return buffer.aggregate(primitive, window);
    }

    /** Up to {@code window} newest observations of {@code symbol}, newest first. */
    public List<SymbolObservation> latest(String symbol, int window) {
        PrimitiveRingBuffer buffer = buffers.get(symbol);
        return buffer != null ? buffer.latest(window) : List.of();
    }

    public int size(String symbol) {
        PrimitiveRingBuffer buffer = buffers.get(symbol);
        return buffer != null ? buffer.size() : 0;
    }

    public int getCapacity() {
        return capacity;
    }
}
