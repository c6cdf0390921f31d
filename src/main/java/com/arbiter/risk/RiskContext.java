package com.arbiter.risk;

import com.arbiter.domain.model.AccountSnapshot;
import com.arbiter.domain.model.Position;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Immutable inputs of one symbol's evaluation in one cycle. */
@Value
@Builder(toBuilder = true)
public class RiskContext {

    long cycleId;

    Position position;

    AccountSnapshot account;

    RiskEnvelope envelope;

    @Builder.Default
    PortfolioFacts facts = PortfolioFacts.empty();

    /** Mark price from the cycle's observation. Null when the observation is unusable. */
    BigDecimal markPrice;

    public String getSymbol() {
        return position.getSymbol();
    }

    /** Mark price, falling back to the entry price when no mark was observed. */
    public BigDecimal referencePrice() {
        return markPrice != null ? markPrice : position.getEntryPrice();
    }
}
