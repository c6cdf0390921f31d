package com.arbiter.event;

import com.arbiter.domain.model.Position;
import com.arbiter.lifecycle.LifecycleTransition;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the position ledger when a confirmed execution report changes a position.
 *
 * <p>Carries the position after the report and the lifecycle edges taken to reach it
 * (empty for in-state changes such as an ADD fill).
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final List<LifecycleTransition> transitions;

    public PositionEvent(Object source, Position position, List<LifecycleTransition> transitions) {
        super(source);
        this.position = position;
        this.transitions = transitions != null ? List.copyOf(transitions) : List.of();
    }

    public Position getPosition() {
        return position;
    }

    public List<LifecycleTransition> getTransitions() {
        return transitions;
    }
}
