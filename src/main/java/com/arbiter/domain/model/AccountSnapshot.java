package com.arbiter.domain.model;

import java.math.BigDecimal;
import java.util.Objects;
import lombok.Value;

/**
 * Account equity as of the start of a cycle.
 *
 * <p>Read once per cycle and passed by value into every per-symbol pipeline. The next
 * snapshot is produced only by {@link #afterExecution(BigDecimal, BigDecimal)}, which
 * the position ledger calls for confirmed execution reports.
 */
@Value
public class AccountSnapshot {

    BigDecimal equity;

    /** Incremented once per applied execution report. */
    long sequence;

    public static AccountSnapshot of(BigDecimal equity) {
        return new AccountSnapshot(Objects.requireNonNull(equity, "equity"), 0L);
    }

    public AccountSnapshot afterExecution(BigDecimal realizedPnl, BigDecimal fee) {
        BigDecimal pnl = realizedPnl != null ? realizedPnl : BigDecimal.ZERO;
        BigDecimal cost = fee != null ? fee : BigDecimal.ZERO;
        return new AccountSnapshot(equity.add(pnl).subtract(cost), sequence + 1);
    }

    public boolean isSolvent() {
        return equity.signum() > 0;
    }
}
