package com.arbiter.event;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the engine detects a risk condition: a forced mandate, an integrity failure,
 * a FAILED position or a halt.
 *
 * <p>Risk events carry the type of condition, its severity level, a message and a details map
 * with condition-specific numbers (e.g. the measured leverage and the cap, the halt cause).
 * Details hold facts only, never interpretation.
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String symbol;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String symbol, String message) {
        this(source, eventType, level, symbol, message, null);
    }

    public RiskEvent(
            Object source,
            RiskEventType eventType,
            RiskLevel level,
            String symbol,
            String message,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.symbol = symbol;
        this.message = message;
        this.details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    /** Affected symbol; null for engine-wide events (halt, reset). */
    public String getSymbol() {
        return symbol;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
