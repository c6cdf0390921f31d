package com.arbiter.lifecycle;

import com.arbiter.domain.model.Position;
import java.util.List;
import lombok.Value;

/**
 * Position after an execution report and the edges taken to reach it. Empty transitions
 * mean the report changed the position in place (ADD_FILLED, partial exit fill).
 */
@Value
public class TransitionResult {

    Position position;
    List<LifecycleTransition> transitions;
}
