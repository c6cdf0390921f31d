package com.arbiter.observation;

import com.arbiter.config.ObservationProperties;
import com.arbiter.domain.enums.IntegrityIssue;
import com.arbiter.domain.model.SymbolObservation;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Checks that a symbol's observation is complete, current and free of interpretation.
 *
 * <p>Failures:
 * <ul>
 *   <li>no observation, or no positive mark price</li>
 *   <li>a required primitive missing</li>
 *   <li>observation older than {@code arbiter.observation.max-primitive-age-ms} at the cycle timestamp</li>
 *   <li>observation timestamp before the last one accepted into the primitive window</li>
 *   <li>a primitive name containing an interpretation term (signal, support, bullish, ...)</li>
 * </ul>
 *
 * <p>Stateless; the last accepted timestamp comes from {@link PrimitiveWindowStore}.
 */
@Component
public class PrimitiveIntegrityChecker {

    /** Terms that carry interpretation rather than measurement. Matched per name token. */
    static final Set<String> INTERPRETATION_TERMS = Set.of(
            "signal", "strength", "confidence", "quality", "health", "ready", "valid", "good", "bad",
            "stale", "fresh", "live", "active", "flowing", "pressure", "baseline", "opportunity", "bias",
            "setup", "weak", "strong", "support", "resistance", "validated", "confirmed", "normal",
            "abnormal", "significant", "momentum", "reversal", "bullish", "bearish", "absorption",
            "exhaustion", "sentiment", "prediction");

    /** Multi-token interpretation phrases, as joined tokens. */
    static final Set<String> INTERPRETATION_PHRASES = Set.of("liquidity_zone", "smart_money", "order_block");

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^a-z0-9]+");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");

    private final ObservationProperties properties;
    private final Set<String> forbiddenTerms;

    public PrimitiveIntegrityChecker(ObservationProperties properties) {
        this.properties = properties;
        Set<String> terms = new TreeSet<>(INTERPRETATION_TERMS);
        properties.getForbiddenTerms().forEach(term -> terms.add(term.toLowerCase(Locale.ROOT)));
        this.forbiddenTerms = terms;
    }

    /**
     * @param observation         the symbol's observation this cycle, null if none arrived
     * @param cycleTimestampMillis timestamp of the cycle being evaluated
     * @param lastAcceptedMillis  timestamp of the newest observation in the symbol's window, null if empty
     */
    public IntegrityReport check(
            String symbol, SymbolObservation observation, long cycleTimestampMillis, Long lastAcceptedMillis) {
        List<IntegrityIssue> issues = new ArrayList<>();
        List<String> details = new ArrayList<>();

        if (observation == null) {
            issues.add(IntegrityIssue.MISSING_SNAPSHOT);
            details.add("no observation for " + symbol);
            return new IntegrityReport(symbol, List.copyOf(issues), List.copyOf(details));
        }

        BigDecimal mark = observation.getMarkPrice();
        if (mark == null || mark.signum() <= 0) {
            issues.add(IntegrityIssue.MISSING_MARK_PRICE);
            details.add("mark price " + mark);
        }

        Map<String, BigDecimal> primitives = observation.getPrimitives();
        for (String required : properties.getRequiredPrimitives()) {
            if (primitives.get(required) == null) {
                issues.add(IntegrityIssue.MISSING_PRIMITIVE);
                details.add("missing primitive " + required);
            }
        }

        long age = cycleTimestampMillis - observation.getObservedAtMillis();
        if (age > properties.getMaxPrimitiveAgeMs()) {
            issues.add(IntegrityIssue.STALE_PRIMITIVES);
            details.add("observation age " + age + "ms above " + properties.getMaxPrimitiveAgeMs() + "ms");
        }

        if (lastAcceptedMillis != null && observation.getObservedAtMillis() < lastAcceptedMillis) {
            issues.add(IntegrityIssue.TIMESTAMP_REGRESSION);
            details.add("observed at " + observation.getObservedAtMillis() + " before last " + lastAcceptedMillis);
        }

        for (String name : new TreeSet<>(primitives.keySet())) {
            String term = interpretationTerm(name);
            if (term != null) {
                issues.add(IntegrityIssue.INTERPRETED_LABEL);
                details.add("primitive " + name + " carries interpretation term '" + term + "'");
            }
        }

        return new IntegrityReport(symbol, List.copyOf(issues), List.copyOf(details));
    }

    /** First interpretation term found in a primitive name, null when the name is purely descriptive. */
    String interpretationTerm(String name) {
        String normalized = CAMEL_BOUNDARY.matcher(name).replaceAll("$1_$2").toLowerCase(Locale.ROOT);
        String[] tokens = TOKEN_SEPARATOR.split(normalized);
        for (int i = 0; i < tokens.length; i++) {
            if (forbiddenTerms.contains(tokens[i])) {
                return tokens[i];
            }
            if (i + 1 < tokens.length && INTERPRETATION_PHRASES.contains(tokens[i] + "_" + tokens[i + 1])) {
                return tokens[i] + "_" + tokens[i + 1];
            }
        }
        return null;
    }
}
