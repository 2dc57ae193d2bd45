package com.feetrail.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of fee-vault event a distribution record was decoded from. Serialized by its wire name.
 */
public enum FeeEventType {
    DEPOSIT("deposit"),
    ESCROW("escrow"),
    DEV_ASSIGNED("dev_assigned"),
    EXPIRED("expired"),
    DEV_CLAIMED("dev_claimed"),
    PROTOCOL_CLAIMED("protocol_claimed");

    private final String wireName;

    FeeEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<FeeEventType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
