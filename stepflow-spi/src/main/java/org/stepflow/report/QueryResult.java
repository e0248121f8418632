package org.stepflow.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.stepflow.collection.SchemaField;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public class QueryResult {
    public static final String QUERY_ID = "queryId";
    private static final QueryResult EMPTY = new QueryResult(ImmutableList.of(), ImmutableList.of());
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final List<SchemaField> metadata;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final List<List<Object>> result;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final QueryError error;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final Map<String, Object> properties;

    private QueryResult(List<SchemaField> metadata, List<List<Object>> result, QueryError error, Map<String, Object> properties) {
        this.metadata = metadata;
        this.result = result;
        this.error = error;
        this.properties = properties;
    }

    public QueryResult(List<SchemaField> metadata, List<List<Object>> result) {
        this(metadata, result, null, null);
    }

    public QueryResult(List<SchemaField> metadata, List<List<Object>> result, Map<String, Object> properties) {
        this(metadata, result, null, properties);
    }

    public static QueryResult errorResult(QueryError error) {
        return new QueryResult(null, null, error, null);
    }

    public static QueryResult errorResult(QueryError error, String query) {
        return new QueryResult(null, null, error, ImmutableMap.of("query", query));
    }

    public static QueryResult empty() {
        return EMPTY;
    }

    public QueryError getError() {
        return error;
    }

    public Map<String, Object> getProperties() {
        return properties == null ? ImmutableMap.of() : properties;
    }

    public boolean isFailed() {
        return error != null;
    }

    /**
     * Each row is a list that holds the values for the columns defined in {@link #getMetadata()}.
     */
    public List<List<Object>> getResult() {
        return result;
    }

    public List<SchemaField> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "QueryResult{" +
                (error == null ? "" : "error=" + error) +
                ", result=" + (result == null ? "" : Joiner.on(", ").join(result)) +
                ", metadata=" + (metadata == null ? "" : metadata) +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryResult)) {
            return false;
        }

        QueryResult that = (QueryResult) o;
        return Objects.equals(metadata, that.metadata)
                && Objects.equals(result, that.result)
                && Objects.equals(error, that.error)
                && Objects.equals(properties, that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, result, error, properties);
    }
}
