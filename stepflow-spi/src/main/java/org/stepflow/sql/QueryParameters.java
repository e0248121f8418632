package org.stepflow.sql;

import com.google.common.collect.ImmutableMap;
import org.stepflow.collection.FieldType;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Values bound while a query is being built. Filled by a single thread, then frozen before the query
 * is handed to a {@link org.stepflow.report.QueryExecutor}.
 */
public class QueryParameters {
    private final Map<String, NamedParameterValue> values = new LinkedHashMap<>();
    private boolean frozen;

    public String bind(String name, FieldType type, Object value) {
        checkState(!frozen, "parameters are already frozen");
        checkArgument(name.matches("^[A-Za-z_][A-Za-z0-9_]*$"), "invalid parameter name: %s", name);
        NamedParameterValue parameter = new NamedParameterValue(type, value);
        NamedParameterValue existing = values.putIfAbsent(name, parameter);
        checkArgument(existing == null || existing.equals(parameter), "parameter %s is already bound to another value", name);
        return name;
    }

    public QueryParameters freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Map<String, NamedParameterValue> asMap() {
        return ImmutableMap.copyOf(values);
    }

    public NamedParameterValue get(String name) {
        return values.get(name);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
