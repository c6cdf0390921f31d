package com.arbiter.config;

import com.arbiter.risk.CorrelationGroup;
import com.arbiter.risk.RiskEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the session's {@link RiskEnvelope} bean from {@link RiskEnvelopeProperties}.
 *
 * <p>The envelope is validated once here; inconsistent caps fail startup with an
 * {@link com.arbiter.exception.InvalidConfigurationException}. It is never modified afterwards.
 */
@Configuration
public class RiskConfig {

    private static final Logger log = LoggerFactory.getLogger(RiskConfig.class);

    @Bean
    public RiskEnvelope riskEnvelope(RiskEnvelopeProperties properties) {
        RiskEnvelope.RiskEnvelopeBuilder builder = RiskEnvelope.builder()
                .maxRiskPerTrade(properties.getMaxRiskPerTrade())
                .maxAccountExposure(properties.getMaxAccountExposure())
                .maxSymbolExposure(properties.getMaxSymbolExposure())
                .minLiquidationBuffer(properties.getMinLiquidationBuffer())
                .maxEffectiveLeverage(properties.getMaxEffectiveLeverage())
                .maintenanceMarginRate(properties.getMaintenanceMarginRate())
                .hardExposureCeiling(properties.getHardExposureCeiling())
                .quantityStep(properties.getQuantityStep());

        for (RiskEnvelopeProperties.Group group : properties.getCorrelationGroups()) {
            builder.correlationGroup(CorrelationGroup.builder()
                    .name(group.getName())
                    .symbols(group.getSymbols())
                    .maxExposure(group.getMaxExposure())
                    .hardCeiling(group.getHardCeiling())
                    .build());
        }

        RiskEnvelope envelope = builder.build().validate();
        log.info(
                "Risk envelope loaded: riskPerTrade={} leverage={} symbolExposure={} accountExposure={} "
                        + "liquidationBuffer={} hardCeiling={} groups={}",
                envelope.getMaxRiskPerTrade(),
                envelope.getMaxEffectiveLeverage(),
                envelope.getMaxSymbolExposure(),
                envelope.getMaxAccountExposure(),
                envelope.getMinLiquidationBuffer(),
                envelope.getHardExposureCeiling(),
                envelope.getCorrelationGroups().size());
        return envelope;
    }
}
