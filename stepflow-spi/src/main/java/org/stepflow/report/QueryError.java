package org.stepflow.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class QueryError {
    public final String message;
    public final Integer errorCode;

    @JsonCreator
    public QueryError(
            @JsonProperty("message") String message,
            @JsonProperty("errorCode") Integer errorCode) {
        this.message = message;
        this.errorCode = errorCode;
    }

    public static QueryError create(String message) {
        return new QueryError(message, null);
    }

    @Override
    public String toString() {
        return "QueryError{" +
                "message='" + message + '\'' +
                ", errorCode=" + errorCode +
                '}';
    }
}
