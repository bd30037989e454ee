package com.flagship.creator_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

/**
 * Identifier of a content record.
 * Assigned by the ledger from a dense counter starting at 0; never reused.
 */
@Value
public class ContentId {
    long value;

    private ContentId(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Content id must not be negative: " + value);
        }
        this.value = value;
    }

    @JsonCreator
    public static ContentId of(long value) {
        return new ContentId(value);
    }

    @JsonValue
    public long getValue() {
        return value;
    }

    public ContentId next() {
        return new ContentId(value + 1);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
