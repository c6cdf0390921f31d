package com.arbiter.strategy;

import com.arbiter.domain.enums.MandateOrigin;
import com.arbiter.domain.model.Mandate;
import com.arbiter.exception.MalformedMandateException;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Structural contract for strategy-originated mandates. A mandate that breaks it is discarded
 * as malformed before any lifecycle or risk check runs.
 *
 * <p>Risk-dependent checks (stop side, scope usefulness, caps) belong to the invariant
 * evaluator, not here.
 */
@Component
public class MandateValidator {

    /** Trigger id prefixes reserved for mandates the engine synthesizes. */
    public static final List<String> RESERVED_PREFIXES = List.of("invariant:", "halt:", "integrity:");

    /**
     * @throws MalformedMandateException on the first broken rule
     */
    public void validate(Mandate mandate) {
        String triggerId = mandate.getTriggerId();
        if (triggerId == null || triggerId.isBlank()) {
            throw new MalformedMandateException(triggerId, "Missing trigger id");
        }
        if (mandate.getType() == null) {
            throw new MalformedMandateException(triggerId, "Missing mandate type");
        }
        if (mandate.getSymbol() == null || mandate.getSymbol().isBlank()) {
            throw new MalformedMandateException(triggerId, "Missing symbol");
        }
        if (mandate.getDirection() == null || mandate.getOrigin() == null) {
            throw new MalformedMandateException(triggerId, "Missing direction or origin");
        }
        if (mandate.getOrigin() != MandateOrigin.STRATEGY) {
            throw new MalformedMandateException(triggerId, "Strategy mandates cannot claim origin " + mandate.getOrigin());
        }
        for (String prefix : RESERVED_PREFIXES) {
            if (triggerId.startsWith(prefix)) {
                throw new MalformedMandateException(triggerId, "Trigger id uses reserved prefix " + prefix);
            }
        }

        requirePositiveIfPresent(mandate, mandate.getStopPrice(), "stopPrice");
        requirePositiveIfPresent(mandate, mandate.getLimitPrice(), "limitPrice");

        switch (mandate.getType()) {
            case ENTER -> {
                if (!mandate.getDirection().isDirectional()) {
                    throw new MalformedMandateException(triggerId, "ENTER requires LONG or SHORT");
                }
                requireNoScope(mandate);
            }
            case ADD -> requireNoScope(mandate);
            case REDUCE -> {
                if (mandate.getLimitPrice() != null || mandate.getStopPrice() != null) {
                    throw new MalformedMandateException(triggerId, "REDUCE carries only a scope");
                }
            }
            case EXIT, HOLD, BLOCK -> {
                if (mandate.getScopeFraction() != null
                        || mandate.getStopPrice() != null
                        || mandate.getLimitPrice() != null) {
                    throw new MalformedMandateException(
                            triggerId, mandate.getType() + " carries no sizing or pricing fields");
                }
            }
        }
    }

    private static void requireNoScope(Mandate mandate) {
        if (mandate.getScopeFraction() != null) {
            throw new MalformedMandateException(
                    mandate.getTriggerId(), mandate.getType() + " does not take a reduction scope");
        }
    }

    private static void requirePositiveIfPresent(Mandate mandate, BigDecimal value, String field) {
        if (value != null && value.signum() <= 0) {
            throw new MalformedMandateException(mandate.getTriggerId(), field + " must be positive, was " + value);
        }
    }
}
