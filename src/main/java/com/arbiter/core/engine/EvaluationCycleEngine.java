package com.arbiter.core.engine;

import com.arbiter.arbitration.ArbitrationContext;
import com.arbiter.arbitration.ArbitrationResult;
import com.arbiter.arbitration.MandateArbitrator;
import com.arbiter.config.EngineProperties;
import com.arbiter.domain.enums.HaltCause;
import com.arbiter.domain.enums.MandateOrigin;
import com.arbiter.domain.enums.PositionState;
import com.arbiter.domain.model.ExecutionIntent;
import com.arbiter.domain.model.Mandate;
import com.arbiter.domain.model.Position;
import com.arbiter.domain.model.SymbolObservation;
import com.arbiter.event.RiskEvent;
import com.arbiter.event.RiskEventType;
import com.arbiter.event.RiskLevel;
import com.arbiter.halt.HaltController;
import com.arbiter.intent.ExecutionIntentConstructor;
import com.arbiter.lifecycle.LedgerSnapshot;
import com.arbiter.lifecycle.PositionLedger;
import com.arbiter.observability.ArbitrationAuditLog;
import com.arbiter.observability.AuditRecord;
import com.arbiter.observability.EngineMetricsService;
import com.arbiter.observation.IntegrityReport;
import com.arbiter.observation.PrimitiveIntegrityChecker;
import com.arbiter.observation.PrimitiveWindowStore;
import com.arbiter.risk.PortfolioFacts;
import com.arbiter.risk.PortfolioFactsCalculator;
import com.arbiter.risk.RiskContext;
import com.arbiter.risk.RiskEnvelope;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs one evaluation cycle over every symbol.
 *
 * <p>Phases:
 * <ol>
 *   <li><b>Snapshot:</b> ledger positions and account read once.</li>
 *   <li><b>Portfolio facts:</b> cross-symbol exposure computed once from the snapshot and the
 *       cycle's marks.</li>
 *   <li><b>Integrity:</b> every symbol's observation checked in symbol order; accepted
 *       observations enter the primitive window.</li>
 *   <li><b>Halt triggers:</b> FAILED positions, hard ceiling breaches and sustained integrity
 *       loss latch the halt. The halt state is then read once for the whole cycle.</li>
 *   <li><b>Per-symbol pipelines:</b> arbitration and intent construction, in parallel across
 *       symbols on the {@code symbolExecutor} pool. A pipeline reads only immutable inputs.</li>
 *   <li><b>Collection:</b> results joined in symbol order, audited, counted.</li>
 * </ol>
 *
 * <p>Symbols evaluated: those observed, those with proposals and those with a non-FLAT position,
 * so a held position is evaluated even when nothing was observed or proposed for it.
 *
 * <p>The ledger is never written here. Intents change positions only after the execution adapter
 * confirms them.
 */
@Service
public class EvaluationCycleEngine {

    private static final Logger log = LoggerFactory.getLogger(EvaluationCycleEngine.class);

    private final PositionLedger positionLedger;
    private final PortfolioFactsCalculator portfolioFactsCalculator;
    private final PrimitiveIntegrityChecker integrityChecker;
    private final PrimitiveWindowStore windowStore;
    private final MandateArbitrator mandateArbitrator;
    private final ExecutionIntentConstructor intentConstructor;
    private final HaltController haltController;
    private final ArbitrationAuditLog auditLog;
    private final EngineMetricsService metricsService;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final RiskEnvelope riskEnvelope;
    private final EngineProperties engineProperties;
    private final Executor symbolExecutor;

    /** Consecutive cycles each symbol failed the integrity checks. */
    private final Map<String, Integer> integrityFailureStreaks = new ConcurrentHashMap<>();

    public EvaluationCycleEngine(
            PositionLedger positionLedger,
            PortfolioFactsCalculator portfolioFactsCalculator,
            PrimitiveIntegrityChecker integrityChecker,
            PrimitiveWindowStore windowStore,
            MandateArbitrator mandateArbitrator,
            ExecutionIntentConstructor intentConstructor,
            HaltController haltController,
            ArbitrationAuditLog auditLog,
            EngineMetricsService metricsService,
            ApplicationEventPublisher applicationEventPublisher,
            RiskEnvelope riskEnvelope,
            EngineProperties engineProperties,
            @Qualifier("symbolExecutor") Executor symbolExecutor) {
        this.positionLedger = positionLedger;
        this.portfolioFactsCalculator = portfolioFactsCalculator;
        this.integrityChecker = integrityChecker;
        this.windowStore = windowStore;
        this.mandateArbitrator = mandateArbitrator;
        this.intentConstructor = intentConstructor;
        this.haltController = haltController;
        this.auditLog = auditLog;
        this.metricsService = metricsService;
        this.applicationEventPublisher = applicationEventPublisher;
        this.riskEnvelope = riskEnvelope;
        this.engineProperties = engineProperties;
        this.symbolExecutor = symbolExecutor;
    }

    public CycleResult runCycle(CycleInput input) {
        long started = System.nanoTime();
        long cycleId = input.getCycleId();

        // ---- Snapshot and portfolio facts ----

        LedgerSnapshot snapshot = positionLedger.snapshot();
        Map<String, BigDecimal> marks = usableMarks(input.getObservations());
        PortfolioFacts facts =
                portfolioFactsCalculator.compute(snapshot.getPositions(), marks, snapshot.getAccount(), riskEnvelope);

        SortedSet<String> symbols = symbolsOf(input, snapshot);

        // ---- Integrity ----

        // Streaks only count consecutive evaluated cycles; a symbol that left the inputs starts over.
        integrityFailureStreaks.keySet().retainAll(symbols);
        Map<String, IntegrityReport> integrity = new TreeMap<>();
        for (String symbol : symbols) {
            SymbolObservation observation = input.getObservations().get(symbol);
            IntegrityReport report = integrityChecker.check(
                    symbol, observation, input.getCycleTimestampMillis(), windowStore.lastObservedAt(symbol));
            integrity.put(symbol, report);
            if (report.isIntact()) {
                windowStore.record(observation);
                integrityFailureStreaks.remove(symbol);
            } else {
                onIntegrityFailure(cycleId, report);
            }
        }

        // ---- Halt triggers ----

        checkHaltTriggers(cycleId, snapshot, facts);
        boolean haltActive = haltController.isActive();

        // ---- Per-symbol pipelines ----

        Map<String, CompletableFuture<SymbolDecision>> pending = new LinkedHashMap<>();
        for (String symbol : symbols) {
            RiskContext risk = RiskContext.builder()
                    .cycleId(cycleId)
                    .position(snapshot.positionOf(symbol))
                    .account(snapshot.getAccount())
                    .envelope(riskEnvelope)
                    .facts(facts)
                    .markPrice(marks.get(symbol))
                    .build();
            ArbitrationContext context = ArbitrationContext.builder()
                    .risk(risk)
                    .dataIntact(integrity.get(symbol).isIntact())
                    .haltActive(haltActive)
                    .build();
            List<Mandate> proposed = input.getMandates().getOrDefault(symbol, List.of());
            IntegrityReport report = integrity.get(symbol);
            pending.put(symbol, CompletableFuture.supplyAsync(
                    () -> evaluateSymbol(context, proposed, report), symbolExecutor));
        }

        // ---- Collection ----

        List<SymbolDecision> decisions = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<SymbolDecision>> entry : pending.entrySet()) {
            SymbolDecision decision = entry.getValue().join();
            decisions.add(decision);
            publishForcedEvents(decision.getArbitration());
            auditLog.record(AuditRecord.builder()
                    .cycleId(cycleId)
                    .cycleTimestampMillis(input.getCycleTimestampMillis())
                    .symbol(decision.getSymbol())
                    .dataIntact(decision.getIntegrity().isIntact())
                    .integrityIssues(decision.getIntegrity().getIssues())
                    .haltActive(haltActive)
                    .arbitration(decision.getArbitration())
                    .intent(decision.getIntent())
                    .build());
        }

        CycleResult result = new CycleResult(cycleId, haltActive, List.copyOf(decisions));
        metricsService.recordCycle(Duration.ofNanos(System.nanoTime() - started));
        log.info("Cycle {}: {} symbols, {} intents{}",
                cycleId, decisions.size(), result.intents().size(), haltActive ? " (HALT)" : "");
        return result;
    }

    // ---- Per-symbol pipeline ----

    SymbolDecision evaluateSymbol(ArbitrationContext context, List<Mandate> proposed, IntegrityReport integrity) {
        ArbitrationResult arbitration = mandateArbitrator.arbitrate(context, proposed);
        Mandate selected = arbitration.getSelected();
        if (selected == null || selected.getType().isRestriction()) {
            return new SymbolDecision(context.getSymbol(), integrity, arbitration, null);
        }

        Optional<ExecutionIntent> intent = intentConstructor.construct(context.getRisk(), selected);
        if (intent.isEmpty()) {
            return new SymbolDecision(context.getSymbol(), integrity, arbitration.withSizingInfeasible(), null);
        }
        return new SymbolDecision(context.getSymbol(), integrity, arbitration, intent.get());
    }

    // ---- Halt triggers ----

    private void checkHaltTriggers(long cycleId, LedgerSnapshot snapshot, PortfolioFacts facts) {
        for (Position position : snapshot.getPositions().values()) {
            if (position.getState() == PositionState.FAILED) {
                haltController.activate(HaltCause.FAILED_POSITION, position.getSymbol(),
                        "position in FAILED at cycle start", cycleId);
            }
        }
        if (facts.isHardCeilingBreached()) {
            haltController.activate(HaltCause.CORRELATED_BREACH, null, facts.getBreachDetail(), cycleId);
        }
        for (Map.Entry<String, Integer> streak : new TreeMap<>(integrityFailureStreaks).entrySet()) {
            if (streak.getValue() >= engineProperties.getIntegrityHaltThreshold()) {
                haltController.activate(HaltCause.DATA_FEED_INTEGRITY_LOSS, streak.getKey(),
                        streak.getValue() + " consecutive cycles failing integrity checks", cycleId);
            }
        }
    }

    private void onIntegrityFailure(long cycleId, IntegrityReport report) {
        int streak = integrityFailureStreaks.merge(report.getSymbol(), 1, Integer::sum);
        log.warn("{} cycle {}: integrity failure #{}: {}", report.getSymbol(), cycleId, streak, report.getDetails());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cycleId", cycleId);
        details.put("issues", report.getIssues());
        details.put("consecutiveFailures", streak);
        applicationEventPublisher.publishEvent(new RiskEvent(
                this, RiskEventType.INTEGRITY_FAILURE, RiskLevel.WARNING, report.getSymbol(),
                String.join("; ", report.getDetails()), details));
    }

    private void publishForcedEvents(ArbitrationResult arbitration) {
        for (Mandate injected : arbitration.getInjected()) {
            if (injected.getOrigin() != MandateOrigin.INVARIANT) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("cycleId", arbitration.getCycleId());
            details.put("mandateType", injected.getType().name());
            details.put("triggerId", injected.getTriggerId());
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this, RiskEventType.FORCED_MANDATE, RiskLevel.WARNING, arbitration.getSymbol(),
                    "Forced " + injected.getType() + " injected", details));
        }
    }

    // ---- Helpers ----

    /** Marks that can value exposure: present and positive. */
    private static Map<String, BigDecimal> usableMarks(Map<String, SymbolObservation> observations) {
        Map<String, BigDecimal> marks = new TreeMap<>();
        observations.forEach((symbol, observation) -> {
            if (observation != null && observation.getMarkPrice() != null && observation.getMarkPrice().signum() > 0) {
                marks.put(symbol, observation.getMarkPrice());
            }
        });
        return marks;
    }

    private static SortedSet<String> symbolsOf(CycleInput input, LedgerSnapshot snapshot) {
        SortedSet<String> symbols = new TreeSet<>(input.getObservations().keySet());
        symbols.addAll(input.getMandates().keySet());
        snapshot.getPositions().values().stream()
                .filter(p -> !p.isFlat())
                .forEach(p -> symbols.add(p.getSymbol()));
        return symbols;
    }
}
