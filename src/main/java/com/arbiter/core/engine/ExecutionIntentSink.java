package com.arbiter.core.engine;

import com.arbiter.domain.model.ExecutionIntent;

/**
 * Execution adapter boundary. Receives each emitted intent once; confirmed results come back
 * through {@link com.arbiter.lifecycle.PositionLedger#onExecutionReport}.
 */
public interface ExecutionIntentSink {

    void submit(ExecutionIntent intent);
}
