package org.stepflow.collection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

import static org.stepflow.util.ValidationUtil.checkNotNull;

public class SchemaField {
    private final String name;
    private final FieldType type;

    @JsonCreator
    public SchemaField(@JsonProperty("name") String name,
                       @JsonProperty("type") FieldType type) {
        this.name = checkNotNull(name, "name");
        this.type = checkNotNull(type, "type");
    }

    @JsonProperty
    public String getName() {
        return name;
    }

    @JsonProperty
    public FieldType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchemaField)) {
            return false;
        }

        SchemaField that = (SchemaField) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "SchemaField{" +
                "name='" + name + '\'' +
                ", type=" + type +
                '}';
    }
}
