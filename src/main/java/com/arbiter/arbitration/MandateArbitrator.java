package com.arbiter.arbitration;

import com.arbiter.domain.enums.Direction;
import com.arbiter.domain.enums.DiscardReason;
import com.arbiter.domain.enums.MandateType;
import com.arbiter.domain.enums.PositionState;
import com.arbiter.domain.enums.VerdictType;
import com.arbiter.domain.model.Mandate;
import com.arbiter.domain.model.Position;
import com.arbiter.exception.MalformedMandateException;
import com.arbiter.lifecycle.PositionStateMachine;
import com.arbiter.risk.InvariantEvaluator;
import com.arbiter.risk.InvariantVerdict;
import com.arbiter.risk.PositionAssessment;
import com.arbiter.risk.RiskContext;
import com.arbiter.strategy.MandateValidator;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Selects at most one mandate per symbol per cycle.
 *
 * <p>Pipeline, applied to the proposals sorted by trigger id:
 * <ol>
 *   <li>Contract: malformed, wrong symbol, expired and duplicate mandates are discarded.</li>
 *   <li>Halt: every non-EXIT mandate is suppressed and an EXIT is injected.</li>
 *   <li>Data integrity: ENTER/ADD/REDUCE are discarded and a BLOCK (HOLD when BLOCK is
 *       inadmissible) is injected.</li>
 *   <li>Lifecycle: mandates the current state does not admit, or whose own preconditions
 *       exclude it, are discarded.</li>
 *   <li>Forced: a FORCE_REDUCE/FORCE_EXIT assessment of the position injects a synthetic
 *       mandate that no strategy mandate can suppress.</li>
 *   <li>Direction: ENTER LONG and ENTER SHORT in the same cycle cancel each other.</li>
 *   <li>Invariants: strategy mandates that are not ALLOW are discarded. Synthetic mandates
 *       are not re-evaluated.</li>
 *   <li>Ranking by {@link MandateOrdering}; the first wins, the rest lose on authority.</li>
 * </ol>
 *
 * <p>Pure: no I/O, no mutation, no clock, no randomness, nothing read from other symbols.
 */
@Service
public class MandateArbitrator {

    private static final Logger log = LoggerFactory.getLogger(MandateArbitrator.class);

    private static final Set<MandateType> BLOCKED_WITHOUT_DATA =
            EnumSet.of(MandateType.ENTER, MandateType.ADD, MandateType.REDUCE);

    private final InvariantEvaluator invariantEvaluator;
    private final PositionStateMachine stateMachine;
    private final MandateValidator mandateValidator;

    public MandateArbitrator(
            InvariantEvaluator invariantEvaluator,
            PositionStateMachine stateMachine,
            MandateValidator mandateValidator) {
        this.invariantEvaluator = invariantEvaluator;
        this.stateMachine = stateMachine;
        this.mandateValidator = mandateValidator;
    }

    public ArbitrationResult arbitrate(ArbitrationContext context, List<Mandate> proposed) {
        RiskContext risk = context.getRisk();
        Position position = risk.getPosition();
        PositionState state = position.getState();
        long cycleId = context.getCycleId();

        List<DiscardedMandate> discarded = new ArrayList<>();
        List<Mandate> injected = new ArrayList<>();

        List<Mandate> sorted = new ArrayList<>(proposed);
        sorted.sort(MandateOrdering.byTriggerId());

        // ---- Contract ----

        List<Mandate> remaining = new ArrayList<>();
        Set<String> seenTriggerIds = new HashSet<>();
        for (Mandate mandate : sorted) {
            try {
                mandateValidator.validate(mandate);
            } catch (MalformedMandateException e) {
                discarded.add(DiscardedMandate.malformed(mandate, e.getMessage()));
                continue;
            }
            if (!seenTriggerIds.add(mandate.getTriggerId())) {
                discarded.add(DiscardedMandate.malformed(mandate, "Duplicate trigger id"));
            } else if (!context.getSymbol().equals(mandate.getSymbol())) {
                discarded.add(DiscardedMandate.of(mandate, DiscardReason.SYMBOL_MISMATCH));
            } else if (mandate.isExpiredAt(cycleId)) {
                discarded.add(DiscardedMandate.of(mandate, DiscardReason.EXPIRED));
            } else {
                remaining.add(mandate);
            }
        }

        // ---- Halt and data integrity ----

        if (context.isHaltActive()) {
            remaining = discardWhere(remaining, discarded, m -> m.getType() != MandateType.EXIT,
                    DiscardReason.HALT_SUPPRESSED);
            if (!position.isFlat() && stateMachine.isAdmissible(state, MandateType.EXIT)) {
                injected.add(SyntheticMandates.haltExit(position, cycleId));
            }
        } else if (!context.isDataIntact()) {
            remaining = discardWhere(remaining, discarded, m -> BLOCKED_WITHOUT_DATA.contains(m.getType()),
                    DiscardReason.DATA_INTEGRITY);
            if (stateMachine.isAdmissible(state, MandateType.BLOCK)) {
                injected.add(SyntheticMandates.integrityRestriction(position, MandateType.BLOCK, cycleId));
            } else if (stateMachine.isAdmissible(state, MandateType.HOLD)) {
                injected.add(SyntheticMandates.integrityRestriction(position, MandateType.HOLD, cycleId));
            }
        }

        // ---- Lifecycle ----

        List<Mandate> admissible = new ArrayList<>();
        for (Mandate mandate : remaining) {
            if (!stateMachine.isAdmissible(state, mandate.getType())) {
                discarded.add(DiscardedMandate.of(mandate, DiscardReason.STATE_INADMISSIBLE));
            } else if (!mandate.admitsState(state)) {
                discarded.add(DiscardedMandate.of(mandate, DiscardReason.PRECONDITION_UNMET));
            } else {
                admissible.add(mandate);
            }
        }

        // ---- Forced mandates ----

        if (!context.isHaltActive()) {
            PositionAssessment assessment = invariantEvaluator.assess(risk);
            if (assessment.isForced()) {
                MandateType forcedType = assessment.getForced().forcedMandateType();
                // Without trustworthy data a reduction cannot be sized; only a forced exit survives
                boolean sizable = context.isDataIntact() || assessment.getForced() == VerdictType.FORCE_EXIT;
                if (sizable && stateMachine.isAdmissible(state, forcedType)) {
                    injected.add(SyntheticMandates.forced(position, forcedType, cycleId));
                    log.warn("{} cycle {}: forced {} injected: {}",
                            context.getSymbol(), cycleId, forcedType, assessment.getViolations());
                }
            }
        }

        // ---- Directional ambiguity ----

        boolean enterLong = admissible.stream().anyMatch(m -> isEnter(m, Direction.LONG));
        boolean enterShort = admissible.stream().anyMatch(m -> isEnter(m, Direction.SHORT));
        if (enterLong && enterShort) {
            admissible = discardWhere(admissible, discarded, m -> m.getType() == MandateType.ENTER,
                    DiscardReason.DIRECTIONAL_AMBIGUITY);
        }

        // ---- Invariants ----

        List<Mandate> candidates = new ArrayList<>(injected);
        for (Mandate mandate : admissible) {
            InvariantVerdict verdict = invariantEvaluator.evaluate(risk, mandate);
            if (verdict.isAllowed()) {
                candidates.add(mandate);
            } else {
                log.debug("{} cycle {}: {} {} -> {}",
                        context.getSymbol(), cycleId, mandate.getType(), mandate.getTriggerId(), verdict);
                discarded.add(DiscardedMandate.denied(mandate, verdict.getViolations()));
            }
        }

        // ---- Ranking ----

        candidates.sort(MandateOrdering.forPosition(position));
        Mandate selected = candidates.isEmpty() ? null : candidates.get(0);
        for (int i = 1; i < candidates.size(); i++) {
            discarded.add(DiscardedMandate.of(candidates.get(i), DiscardReason.LOWER_AUTHORITY));
        }

        ArbitrationResult result = ArbitrationResult.builder()
                .cycleId(cycleId)
                .symbol(context.getSymbol())
                .positionState(state)
                .selected(selected)
                .discarded(List.copyOf(discarded))
                .injected(List.copyOf(injected))
                .build();

        if (log.isDebugEnabled()) {
            log.debug("{} cycle {} ({}): selected {}, {} discarded",
                    context.getSymbol(), cycleId, state,
                    selected != null ? selected.getType() + " " + selected.getTriggerId() : "NO_ACTION",
                    discarded.size());
        }
        return result;
    }

    private static boolean isEnter(Mandate mandate, Direction direction) {
        return mandate.getType() == MandateType.ENTER && mandate.getDirection() == direction;
    }

    private static List<Mandate> discardWhere(
            List<Mandate> mandates,
            List<DiscardedMandate> discarded,
            Predicate<Mandate> condition,
            DiscardReason reason) {
        List<Mandate> kept = new ArrayList<>();
        for (Mandate mandate : mandates) {
            if (condition.test(mandate)) {
                discarded.add(DiscardedMandate.of(mandate, reason));
            } else {
                kept.add(mandate);
            }
        }
        return kept;
    }
}
