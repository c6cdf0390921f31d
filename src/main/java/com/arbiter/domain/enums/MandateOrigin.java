package com.arbiter.domain.enums;

/**
 * Who put a mandate into the cycle. Strategy mandates are untrusted input;
 * the other origins are synthesized by the engine and outrank strategy mandates of the same type.
 */
public enum MandateOrigin {
    STRATEGY(0),
    INTEGRITY(1),
    INVARIANT(2),
    HALT(3);

    private final int precedence;

    MandateOrigin(int precedence) {
        this.precedence = precedence;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isSynthetic() {
        return this != STRATEGY;
    }
}
