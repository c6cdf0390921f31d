package com.arbiter.core.engine;

import com.arbiter.domain.model.Mandate;
import com.arbiter.domain.model.SymbolObservation;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * External inputs of one evaluation cycle. The cycle timestamp is supplied here, never read from
 * the clock inside the engine, so a cycle can be replayed.
 */
@Value
@Builder
public class CycleInput {

    long cycleId;

    long cycleTimestampMillis;

    /** Observations keyed by symbol. A symbol without an entry fails the integrity checks. */
    @Singular
    Map<String, SymbolObservation> observations;

    /** Proposed mandates keyed by symbol. */
    @Singular
    Map<String, List<Mandate>> mandates;
}
