package com.arbiter.arbitration;

import com.arbiter.domain.model.Mandate;
import com.arbiter.domain.model.Position;
import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Total order used to rank surviving mandates, highest first:
 * <ol>
 *   <li>authority: EXIT &gt; REDUCE &gt; BLOCK &gt; HOLD &gt; ADD &gt; ENTER</li>
 *   <li>origin: HALT &gt; INVARIANT &gt; INTEGRITY &gt; STRATEGY</li>
 *   <li>requested reduction, larger first (REDUCE only, zero otherwise)</li>
 *   <li>trigger id, ascending</li>
 * </ol>
 * Trigger ids are unique within a symbol's cycle, so the order never ties.
 */
public final class MandateOrdering {

    private MandateOrdering() {}

    public static Comparator<Mandate> forPosition(Position position) {
        Comparator<Mandate> byAuthority = Comparator.comparingInt(Mandate::getAuthorityRank);
        Comparator<Mandate> byOrigin = Comparator.comparingInt(m -> m.getOrigin().getPrecedence());
        Comparator<Mandate> byReduction =
                Comparator.comparing((Mandate m) -> m.requestedReduction(position), BigDecimal::compareTo);
        Comparator<Mandate> byTriggerId = Comparator.comparing(Mandate::getTriggerId);

        return byAuthority.reversed()
                .thenComparing(byOrigin.reversed())
                .thenComparing(byReduction.reversed())
                .thenComparing(byTriggerId);
    }

    /** Input order used before any filtering: trigger id ascending, missing ids first. */
    public static Comparator<Mandate> byTriggerId() {
        return Comparator.comparing(Mandate::getTriggerId, Comparator.nullsFirst(Comparator.naturalOrder()));
    }
}
