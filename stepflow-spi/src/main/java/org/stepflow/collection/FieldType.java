package org.stepflow.collection;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum FieldType {
    STRING, INTEGER, DOUBLE, LONG, BOOLEAN, DATE, TIMESTAMP,
    ARRAY_STRING, ARRAY_INTEGER, ARRAY_DOUBLE, ARRAY_LONG, ARRAY_BOOLEAN, ARRAY_DATE, ARRAY_TIMESTAMP;

    private static final FieldType values[] = values();

    @JsonCreator
    public static FieldType fromString(String key) {
        return key == null ? null : FieldType.valueOf(key.toUpperCase());
    }

    public boolean isArray() {
        return ordinal() > 6;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == DOUBLE || this == LONG;
    }

    public FieldType getArrayElementType() {
        if (!isArray()) {
            throw new IllegalStateException("type is not array");
        }

        return values[ordinal() - 7];
    }

    public FieldType convertToArrayType() {
        if (isArray()) {
            throw new IllegalStateException("type is already array");
        }

        return values[ordinal() + 7];
    }
}
