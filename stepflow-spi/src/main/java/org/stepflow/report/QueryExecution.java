package org.stepflow.report;

import java.util.concurrent.CompletableFuture;

public interface QueryExecution {
    static QueryExecution completedQueryExecution(QueryResult result) {
        return new QueryExecution() {
            @Override
            public boolean isFinished() {
                return true;
            }

            @Override
            public CompletableFuture<QueryResult> getResult() {
                return CompletableFuture.completedFuture(result);
            }

            @Override
            public void kill() {
            }
        };
    }

    boolean isFinished();

    /**
     * Completes with a failed {@link QueryResult} when the store rejects the query, or exceptionally
     * when the store cannot be reached at all.
     */
    CompletableFuture<QueryResult> getResult();

    void kill();
}
