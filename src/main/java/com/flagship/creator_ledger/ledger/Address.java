package com.flagship.creator_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

/**
 * Opaque account identifier supplied by the ledger runtime.
 * The ledger never authenticates or interprets it; it is only compared for equality,
 * so values with surrounding whitespace are rejected rather than normalized.
 */
@Value
public class Address {
    String value;

    private Address(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Address must not be blank");
        }
        if (!value.equals(value.strip())) {
            throw new IllegalArgumentException("Address must not have leading or trailing whitespace");
        }
        this.value = value;
    }

    @JsonCreator
    public static Address of(String value) {
        return new Address(value);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
