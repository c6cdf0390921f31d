package com.arbiter.observation;

import com.arbiter.domain.model.SymbolObservation;
import java.util.Map;

/**
 * Contract of the external observation layer. Supplies, once per cycle, the numeric primitives
 * and mark price of every symbol under evaluation.
 *
 * <p>Primitives are counts, rates, distances and volumes. Interpreted labels are outside the
 * contract; an observation carrying one fails the integrity check for its symbol.
 */
public interface ObservationSource {

    /**
     * @param cycleId the cycle being evaluated
     * @return observations keyed by symbol
     * @throws com.arbiter.exception.DataIntegrityException when no snapshot can be produced at all;
     *         the cycle then runs without observations. Exceptions with a terminal error code
     *         abort the cycle.
     */
    Map<String, SymbolObservation> observe(long cycleId);
}
