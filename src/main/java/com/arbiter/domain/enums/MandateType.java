package com.arbiter.domain.enums;

/**
 * Action class a mandate asks permission for.
 *
 * <p>The authority rank is fixed and global: EXIT &gt; REDUCE &gt; BLOCK &gt; HOLD &gt; ADD &gt; ENTER.
 * Ranks are distinct, so two mandates of different types never tie.
 */
public enum MandateType {
    ENTER(1),
    ADD(2),
    HOLD(3),
    BLOCK(4),
    REDUCE(5),
    EXIT(6);

    private final int authority;

    MandateType(int authority) {
        this.authority = authority;
    }

    public int getAuthority() {
        return authority;
    }

    /** ENTER and ADD grow exposure; everything else keeps or shrinks it. */
    public boolean isRiskIncreasing() {
        return this == ENTER || this == ADD;
    }

    /** HOLD and BLOCK are restrictions: selecting them never produces an execution intent. */
    public boolean isRestriction() {
        return this == HOLD || this == BLOCK;
    }
}
