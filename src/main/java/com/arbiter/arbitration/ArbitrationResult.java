package com.arbiter.arbitration;

import com.arbiter.domain.enums.DiscardReason;
import com.arbiter.domain.enums.PositionState;
import com.arbiter.domain.model.Mandate;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Sole output of arbitration for one symbol in one cycle: the selected mandate or NO_ACTION,
 * every discarded mandate with its reason, and the mandates the engine injected.
 *
 * <p>Fully determined by the arbitration inputs, so it can be replayed and compared byte for byte.
 */
@Value
@Builder(toBuilder = true)
public class ArbitrationResult {

    long cycleId;

    String symbol;

    PositionState positionState;

    /** Null means NO_ACTION. */
    Mandate selected;

    @Builder.Default
    List<DiscardedMandate> discarded = List.of();

    /** Synthetic mandates (forced, halt, integrity) added before ranking. */
    @Builder.Default
    List<Mandate> injected = List.of();

    public boolean isNoAction() {
        return selected == null;
    }

    /**
     * The selected mandate could not be turned into an intent. The result becomes NO_ACTION;
     * no other mandate is substituted in the same cycle.
     */
    public ArbitrationResult withSizingInfeasible() {
        if (selected == null) {
            return this;
        }
        List<DiscardedMandate> all = new ArrayList<>(discarded);
        all.add(DiscardedMandate.of(selected, DiscardReason.SIZING_INFEASIBLE));
        return toBuilder().selected(null).discarded(List.copyOf(all)).build();
    }
}
