package com.arbiter.core.engine;

import com.arbiter.domain.model.ExecutionIntent;
import java.util.List;
import lombok.Value;

/** Per-symbol decisions of one cycle, ordered by symbol. */
@Value
public class CycleResult {

    long cycleId;

    /** Halt state every symbol of this cycle was arbitrated under. */
    boolean haltActive;

    List<SymbolDecision> decisions;

    /** Emitted intents, at most one per symbol, in symbol order. */
    public List<ExecutionIntent> intents() {
        return decisions.stream()
                .filter(SymbolDecision::hasIntent)
                .map(SymbolDecision::getIntent)
                .toList();
    }

    public SymbolDecision decisionFor(String symbol) {
        return decisions.stream()
                .filter(d -> d.getSymbol().equals(symbol))
                .findFirst()
                .orElse(null);
    }
}
