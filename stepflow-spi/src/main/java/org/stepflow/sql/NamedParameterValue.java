package org.stepflow.sql;

import org.stepflow.collection.FieldType;

import java.util.Objects;

public class NamedParameterValue {
    public final FieldType type;
    public final Object value;

    public NamedParameterValue(FieldType type, Object value) {
        this.type = type;
        this.value = value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NamedParameterValue)) {
            return false;
        }
        NamedParameterValue that = (NamedParameterValue) o;
        return type == that.type && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type + ":" + value;
    }
}
