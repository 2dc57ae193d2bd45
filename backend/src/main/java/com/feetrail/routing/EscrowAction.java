package com.feetrail.routing;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EscrowAction {
    ASSIGNED,
    REASSIGNED,
    NOOP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
