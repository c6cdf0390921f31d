package com.arbiter.domain.model;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Numeric facts observed for one symbol in one cycle.
 *
 * <p>Primitives are counts, rates, distances and volumes keyed by a neutral name. Values
 * are numbers only, so interpreted labels cannot be carried as values; names are checked
 * against an interpretation vocabulary by the
 * {@link com.arbiter.observation.PrimitiveIntegrityChecker}.
 */
@Value
@Builder
public class SymbolObservation {

    String symbol;

    BigDecimal markPrice;

    /** Observation time supplied by the observation layer, in epoch millis. */
    long observedAtMillis;

    @Singular
    Map<String, BigDecimal> primitives;
}
