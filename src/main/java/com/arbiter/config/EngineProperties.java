package com.arbiter.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Evaluation cycle settings.
 *
 * <p>Properties prefix: {@code arbiter.engine.*}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "arbiter.engine")
public class EngineProperties {

    /** Account equity the ledger starts the session with. */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal initialEquity = new BigDecimal("10000");

    /** Workers evaluating symbols in parallel within one cycle. */
    @Min(1)
    private int workerPoolSize = 4;

    /** Audit records kept in memory (newest first). */
    @Min(1)
    private int auditBufferSize = 1000;

    /** Consecutive integrity failures on one symbol that count as data-feed loss and halt the engine. */
    @Min(1)
    private int integrityHaltThreshold = 3;

    /** Run {@code CycleDriver} on a fixed delay. Off by default; cycles are then driven by the caller. */
    private boolean schedulingEnabled = false;

    /** Delay between scheduled cycles. */
    @Min(1)
    private long cycleIntervalMs = 1000;
}
