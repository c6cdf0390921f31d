package com.arbiter.risk;

import com.arbiter.domain.model.AccountSnapshot;
import com.arbiter.domain.model.Position;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes the read-only {@link PortfolioFacts} for a cycle from the ledger snapshot and
 * the cycle's mark prices.
 *
 * <p>Runs once, before any symbol is evaluated. Portfolio-level caps reach the per-symbol
 * pipelines only through these precomputed facts; there is no live cross-symbol query.
 * A position without a mark this cycle is valued at its entry price.
 */
@Component
public class PortfolioFactsCalculator {

    private static final Logger log = LoggerFactory.getLogger(PortfolioFactsCalculator.class);

    public PortfolioFacts compute(
            Map<String, Position> positions,
            Map<String, BigDecimal> markPrices,
            AccountSnapshot account,
            RiskEnvelope envelope) {
        // Sorted so the facts (and the audit built from them) do not depend on map iteration order
        Map<String, BigDecimal> bySymbol = new TreeMap<>();
        BigDecimal total = BigDecimal.ZERO;

        for (Position position : new TreeMap<>(positions).values()) {
            if (!position.hasExposure()) {
                continue;
            }
            BigDecimal price = markPrices.get(position.getSymbol());
            if (price == null) {
                price = position.getEntryPrice();
                log.warn("No mark for {} this cycle, valuing exposure at entry price {}", position.getSymbol(), price);
            }
            if (price == null) {
                continue;
            }
            BigDecimal notional = position.notional(price);
            bySymbol.put(position.getSymbol(), notional);
            total = total.add(notional);
        }

        PortfolioFacts.PortfolioFactsBuilder builder =
                PortfolioFacts.builder().totalNotional(total).notionalBySymbol(bySymbol);

        if (!account.isSolvent()) {
            // Every ratio is undefined; deny all risk increases and let the evaluator force exits
            return builder.accountCapReached(true)
                    .hardCeilingBreached(total.signum() > 0)
                    .breachDetail(total.signum() > 0 ? "equity " + account.getEquity() + " with open exposure" : null)
                    .build();
        }

        BigDecimal equity = account.getEquity();
        List<String> breaches = new ArrayList<>();

        builder.accountCapReached(total.compareTo(envelope.getMaxAccountExposure().multiply(equity)) >= 0);
        if (total.compareTo(envelope.getHardExposureCeiling().multiply(equity)) > 0) {
            breaches.add("total notional " + total + " above hard ceiling " + envelope.getHardExposureCeiling() + "x");
        }

        for (CorrelationGroup group : envelope.getCorrelationGroups()) {
            BigDecimal groupNotional = BigDecimal.ZERO;
            for (String symbol : group.getSymbols()) {
                groupNotional = groupNotional.add(bySymbol.getOrDefault(symbol, BigDecimal.ZERO));
            }
            builder.groupNotional(group.getName(), groupNotional);

            if (groupNotional.compareTo(group.getMaxExposure().multiply(equity)) >= 0) {
                builder.deniedSymbols(group.getSymbols());
            }
            if (group.getHardCeiling() != null
                    && groupNotional.compareTo(group.getHardCeiling().multiply(equity)) > 0) {
                breaches.add("group " + group.getName() + " notional " + groupNotional + " above hard ceiling "
                        + group.getHardCeiling() + "x");
            }
        }

        if (!breaches.isEmpty()) {
            builder.hardCeilingBreached(true).breachDetail(String.join("; ", breaches));
        }
        return builder.build();
    }
}
