package org.stepflow.util;

import io.netty.handler.codec.http.HttpResponseStatus;

public class StepflowException
        extends RuntimeException {
    private final HttpResponseStatus statusCode;

    public StepflowException(String message, HttpResponseStatus statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public StepflowException(String message, HttpResponseStatus statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public StepflowException(HttpResponseStatus statusCode) {
        this(statusCode.reasonPhrase(), statusCode);
    }

    public HttpResponseStatus getStatusCode() {
        return statusCode;
    }
}
