package com.arbiter.domain.enums;

public enum PriceType {
    MARKET,
    LIMIT,
    STOP
}
