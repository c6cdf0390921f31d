package com.arbiter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Risk caps bound from application.properties, converted once into the immutable
 * {@link com.arbiter.risk.RiskEnvelope} by {@link RiskConfig}.
 *
 * <p>Properties prefix: {@code arbiter.risk.*}. Exposures and leverage are multiples of
 * equity; buffers and rates are fractions.
 *
 * <p>Defaults:
 * <ul>
 *   <li>maxRiskPerTrade: 0.01 (1% of equity lost at stop)</li>
 *   <li>maxAccountExposure: 3.0, maxSymbolExposure: 2.0, maxEffectiveLeverage: 2.0</li>
 *   <li>minLiquidationBuffer: 0.10 (10% of mark), maintenanceMarginRate: 0.005</li>
 *   <li>hardExposureCeiling: 4.0 (halt above this)</li>
 * </ul>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "arbiter.risk")
public class RiskEnvelopeProperties {

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal maxRiskPerTrade = new BigDecimal("0.01");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal maxAccountExposure = new BigDecimal("3.0");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal maxSymbolExposure = new BigDecimal("2.0");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal minLiquidationBuffer = new BigDecimal("0.10");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal maxEffectiveLeverage = new BigDecimal("2.0");

    @NotNull
    @DecimalMin("0")
    private BigDecimal maintenanceMarginRate = new BigDecimal("0.005");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal hardExposureCeiling = new BigDecimal("4.0");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal quantityStep = new BigDecimal("0.001");

    @Valid
    private List<Group> correlationGroups = new ArrayList<>();

    @Data
    public static class Group {

        @NotBlank
        private String name;

        @NotEmpty
        private List<String> symbols = new ArrayList<>();

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal maxExposure;

        /** Optional. Group exposure above it halts the engine. */
        private BigDecimal hardCeiling;
    }
}
