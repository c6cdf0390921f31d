package com.arbiter.strategy;

import com.arbiter.domain.model.Mandate;
import com.arbiter.domain.model.SymbolObservation;
import java.util.List;
import java.util.Map;

/**
 * Contract of the external strategy/condition layer.
 *
 * <p>Called once per cycle with the cycle's numeric observations and returns the proposed
 * mandates for every symbol. Proposals are untrusted: each one is validated against
 * {@link MandateValidator} and then filtered by lifecycle admissibility and the risk
 * invariants exactly like the engine's own forced mandates.
 *
 * <p>Implementations must use {@link com.arbiter.domain.enums.MandateOrigin#STRATEGY}, give
 * every mandate a trigger id unique within its symbol and cycle, and set
 * {@code expiresAfterCycle} no later than the cycle they were proposed in unless they mean
 * to re-propose the same mandate.
 */
public interface MandateSource {

    /**
     * @param cycleId      the cycle being evaluated
     * @param observations numeric observations keyed by symbol
     * @return proposed mandates keyed by symbol; symbols without proposals may be absent
     */
    Map<String, List<Mandate>> propose(long cycleId, Map<String, SymbolObservation> observations);
}
