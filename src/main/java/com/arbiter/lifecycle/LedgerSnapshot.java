package com.arbiter.lifecycle;

import com.arbiter.domain.model.AccountSnapshot;
import com.arbiter.domain.model.Position;
import java.util.Map;
import lombok.Value;

/**
 * Positions and account equity read atomically at the start of a cycle. Positions are keyed
 * by symbol in sorted order; symbols without an entry are FLAT.
 */
@Value
public class LedgerSnapshot {

    Map<String, Position> positions;

    AccountSnapshot account;

    public Position positionOf(String symbol) {
        Position position = positions.get(symbol);
        return position != null ? position : Position.flat(symbol);
    }
}
