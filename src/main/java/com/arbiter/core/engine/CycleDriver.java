package com.arbiter.core.engine;

import com.arbiter.config.EngineProperties;
import com.arbiter.domain.model.ExecutionIntent;
import com.arbiter.domain.model.Mandate;
import com.arbiter.domain.model.SymbolObservation;
import com.arbiter.exception.BaseException;
import com.arbiter.observation.ObservationSource;
import com.arbiter.strategy.MandateSource;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Connects the engine to its ports: pulls observations and mandates, runs the cycle and hands
 * the intents to the execution adapter.
 *
 * <p>The ports are supplied by the deployment. Until all three are present, cycles are skipped.
 * A snapshot that cannot be read at all runs the cycle with no observations, so every symbol
 * fails the integrity checks and held positions are still evaluated for forced exits.
 */
@Component
public class CycleDriver {

    private static final Logger log = LoggerFactory.getLogger(CycleDriver.class);

    private final EvaluationCycleEngine engine;
    private final ObjectProvider<ObservationSource> observationSource;
    private final ObjectProvider<MandateSource> mandateSource;
    private final ObjectProvider<ExecutionIntentSink> intentSink;
    private final EngineProperties engineProperties;

    private final AtomicLong cycleSequence = new AtomicLong();

    public CycleDriver(
            EvaluationCycleEngine engine,
            ObjectProvider<ObservationSource> observationSource,
            ObjectProvider<MandateSource> mandateSource,
            ObjectProvider<ExecutionIntentSink> intentSink,
            EngineProperties engineProperties) {
        this.engine = engine;
        this.observationSource = observationSource;
        this.mandateSource = mandateSource;
        this.intentSink = intentSink;
        this.engineProperties = engineProperties;
    }

    @Scheduled(fixedDelayString = "${arbiter.engine.cycle-interval-ms:1000}")
    public void scheduledCycle() {
        if (!engineProperties.isSchedulingEnabled()) {
            return;
        }
        runOnce();
    }

    /**
     * Runs one cycle end to end.
     *
     * @return the cycle result, null if a port is missing
     */
    public synchronized CycleResult runOnce() {
        ObservationSource observations = observationSource.getIfAvailable();
        MandateSource mandates = mandateSource.getIfAvailable();
        ExecutionIntentSink sink = intentSink.getIfAvailable();
        if (observations == null || mandates == null || sink == null) {
            log.warn("Cycle skipped: observation source, mandate source or intent sink not configured");
            return null;
        }

        long cycleId = cycleSequence.incrementAndGet();
        long cycleTimestamp = Instant.now().toEpochMilli();

        Map<String, SymbolObservation> observed;
        try {
            observed = observations.observe(cycleId);
        } catch (BaseException e) {
            if (e.getErrorCode().isTerminal()) {
                throw e;
            }
            log.error("Cycle {}: observation snapshot unreadable ({}), evaluating without observations: {}",
                    cycleId, e.getErrorCode().getCode(), e.getMessage());
            observed = Map.of();
        }

        Map<String, List<Mandate>> proposed;
        try {
            proposed = mandates.propose(cycleId, observed);
        } catch (RuntimeException e) {
            log.error("Cycle {}: mandate source failed, evaluating without proposals", cycleId, e);
            proposed = Map.of();
        }

        CycleResult result = engine.runCycle(CycleInput.builder()
                .cycleId(cycleId)
                .cycleTimestampMillis(cycleTimestamp)
                .observations(observed)
                .mandates(proposed)
                .build());

        for (ExecutionIntent intent : result.intents()) {
            sink.submit(intent);
        }
        return result;
    }

    public long lastCycleId() {
        return cycleSequence.get();
    }
}
