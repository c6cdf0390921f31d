package com.arbiter.arbitration;

import com.arbiter.domain.enums.MandateOrigin;
import com.arbiter.domain.enums.MandateType;
import com.arbiter.domain.model.Mandate;
import com.arbiter.domain.model.Position;

/**
 * Mandates the engine synthesizes. Trigger ids are derived from origin, symbol, cycle and type
 * ({@code invariant:BTCUSDT:42:EXIT}), so replaying a cycle reproduces them exactly.
 */
public final class SyntheticMandates {

    private SyntheticMandates() {}

    public static Mandate forced(Position position, MandateType type, long cycleId) {
        return create(MandateOrigin.INVARIANT, "invariant", position, type, cycleId);
    }

    public static Mandate haltExit(Position position, long cycleId) {
        return create(MandateOrigin.HALT, "halt", position, MandateType.EXIT, cycleId);
    }

    public static Mandate integrityRestriction(Position position, MandateType type, long cycleId) {
        if (!type.isRestriction()) {
            throw new IllegalArgumentException("Integrity mandates are restrictions only, was " + type);
        }
        return create(MandateOrigin.INTEGRITY, "integrity", position, type, cycleId);
    }

    private static Mandate create(
            MandateOrigin origin, String prefix, Position position, MandateType type, long cycleId) {
        return Mandate.builder()
                .triggerId(prefix + ":" + position.getSymbol() + ":" + cycleId + ":" + type)
                .type(type)
                .symbol(position.getSymbol())
                .direction(position.getDirection())
                .origin(origin)
                .expiresAfterCycle(cycleId)
                .build();
    }
}
