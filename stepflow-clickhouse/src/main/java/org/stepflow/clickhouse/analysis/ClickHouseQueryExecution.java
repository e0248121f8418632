package org.stepflow.clickhouse.analysis;

import com.google.common.collect.ImmutableMap;
import com.google.common.io.CharStreams;
import com.google.common.util.concurrent.ListenableFuture;
import io.airlift.http.client.HttpClient;
import io.airlift.http.client.HttpUriBuilder;
import io.airlift.http.client.Request;
import io.airlift.http.client.Response;
import io.airlift.http.client.ResponseHandler;
import io.airlift.log.Logger;
import org.stepflow.clickhouse.ClickHouseConfig;
import org.stepflow.collection.FieldType;
import org.stepflow.collection.SchemaField;
import org.stepflow.report.QueryExecution;
import org.stepflow.report.QueryResult;
import org.stepflow.sql.NamedParameterValue;
import org.stepflow.sql.QueryParameters;
import org.stepflow.util.JsonHelper;
import org.stepflow.util.StepflowException;

import java.io.IOException;
import java.io.InputStreamReader;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static io.airlift.http.client.StaticBodyGenerator.createStaticBodyGenerator;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_GATEWAY;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.ZoneOffset.UTC;

public class ClickHouseQueryExecution
        implements QueryExecution {
    private static final Logger LOGGER = Logger.get(ClickHouseQueryExecution.class);

    public static final String FORMAT = "JSONCompact";
    public static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter RESULT_DATE_TIME_FORMATTER = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();
    private static final Pattern CLICKHOUSE_TYPE_PATTERN = Pattern.compile("^([A-Za-z0-9]+)\\((.+)\\)$");

    private final CompletableFuture<ClickHouseQueryResult> response;
    private final CompletableFuture<QueryResult> result;
    private final String queryId;

    public ClickHouseQueryExecution(HttpClient httpClient, ClickHouseConfig config, String query, QueryParameters parameters) {
        this.queryId = UUID.randomUUID().toString();

        HttpUriBuilder uri = HttpUriBuilder.uriBuilderFrom(config.getAddress())
                .addParameter("query_id", queryId)
                .addParameter("date_time_output_format", "iso");
        for (Map.Entry<String, NamedParameterValue> parameter : parameters.asMap().entrySet()) {
            uri.addParameter("param_" + parameter.getKey(), formatParameter(parameter.getValue()));
        }

        Request.Builder request = Request.builder()
                .setUri(uri.build())
                .setMethod("POST")
                .setBodyGenerator(createStaticBodyGenerator(query + "\nFORMAT " + FORMAT, UTF_8));
        if (config.getUser() != null) {
            String credentials = config.getUser() + ":" + (config.getPassword() == null ? "" : config.getPassword());
            request.setHeader("Authorization", "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(UTF_8)));
        }

        this.response = convertCompletableFuture(httpClient.executeAsync(request.build(), new QueryResponseHandler()));
        this.result = response.thenApply(ClickHouseQueryExecution::getSuccessfulQueryResult);
    }

    public String getQueryId() {
        return queryId;
    }

    /**
     * Text form of a bound value as the ClickHouse HTTP interface expects it in a {@code param_} field.
     */
    public static String formatParameter(NamedParameterValue parameter) {
        Object value = parameter.value;
        if (value == null) {
            return "\\N";
        }
        if (parameter.type.isArray()) {
            FieldType elementType = parameter.type.getArrayElementType();
            return ((Collection<?>) value).stream()
                    .map(item -> formatArrayItem(elementType, item))
                    .collect(Collectors.joining(",", "[", "]"));
        }
        switch (parameter.type) {
            case TIMESTAMP:
                return DATE_TIME_FORMATTER.format(toInstant(value).atOffset(UTC));
            case STRING:
                return escapeText(value.toString());
            default:
                return value.toString();
        }
    }

    private static String formatArrayItem(FieldType type, Object item) {
        switch (type) {
            case STRING:
                return "'" + item.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
            case TIMESTAMP:
                return "'" + DATE_TIME_FORMATTER.format(toInstant(item).atOffset(UTC)) + "'";
            default:
                return item.toString();
        }
    }

    // parameters are read in the escaped text format, a backslash in a LIKE pattern must survive it
    private static String escapeText(String value) {
        return value.replace("\\", "\\\\").replace("\t", "\\t").replace("\n", "\\n");
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(UTC);
        }
        throw new IllegalArgumentException("Not a timestamp: " + value);
    }

    static <T> CompletableFuture<T> convertCompletableFuture(final ListenableFuture<T> listenableFuture) {
        CompletableFuture<T> completable = new CompletableFuture<T>() {
            @Override
            public boolean cancel(boolean mayInterruptIfRunning) {
                // propagate cancel to the listenable future
                boolean result = listenableFuture.cancel(mayInterruptIfRunning);
                super.cancel(mayInterruptIfRunning);
                return result;
            }
        };

        listenableFuture.addListener(() -> {
            try {
                completable.complete(listenableFuture.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                completable.completeExceptionally(e);
            } catch (ExecutionException e) {
                completable.completeExceptionally(e.getCause());
            } catch (RuntimeException e) {
                completable.completeExceptionally(e);
            }
        }, Runnable::run);
        return completable;
    }

    public static FieldType parseClickhouseType(String type) {
        switch (type) {
            case "UInt64":
            case "Int64":
            case "UInt32":
                return FieldType.LONG;
            case "Int32":
            case "UInt16":
            case "Int16":
            case "UInt8":
            case "Int8":
                return FieldType.INTEGER;
            case "Float32":
            case "Float64":
                return FieldType.DOUBLE;
            case "String":
            case "UUID":
                return FieldType.STRING;
            case "Bool":
                return FieldType.BOOLEAN;
            case "DateTime":
                return FieldType.TIMESTAMP;
            case "Date":
            case "Date32":
                return FieldType.DATE;
            default:
                Matcher matcher = CLICKHOUSE_TYPE_PATTERN.matcher(type);
                if (matcher.find()) {
                    String actualType = matcher.group(1);
                    String argument = matcher.group(2);
                    switch (actualType) {
                        case "Nullable":
                        case "LowCardinality":
                            return parseClickhouseType(argument);
                        case "FixedString":
                        case "Enum8":
                        case "Enum16":
                            return FieldType.STRING;
                        case "DateTime":
                        case "DateTime64":
                            return FieldType.TIMESTAMP;
                        case "Decimal":
                        case "Decimal32":
                        case "Decimal64":
                            return FieldType.DOUBLE;
                        case "Array":
                            return parseClickhouseType(argument).convertToArrayType();
                        default:
                            throw new IllegalStateException("The parametrized type cannot be identified: " + type);
                    }
                } else {
                    throw new IllegalStateException("The type cannot be identified: " + type);
                }
        }
    }

    @Override
    public boolean isFinished() {
        return result.isDone();
    }

    private static QueryResult getSuccessfulQueryResult(ClickHouseQueryResult queryResult) {
        List<SchemaField> columns = queryResult.meta.stream()
                .map(f -> new SchemaField(f.name, parseClickhouseType(f.type)))
                .collect(Collectors.toList());

        ImmutableMap.Builder<String, Object> properties = ImmutableMap.builder();
        properties.put("rows", queryResult.rows);
        if (queryResult.statistics != null) {
            properties.put("elapsed", queryResult.statistics.elapsed);
            properties.put("rowsRead", queryResult.statistics.rowsRead);
        }

        return new QueryResult(columns, transformResultData(columns, queryResult.data), properties.build());
    }

    static List<List<Object>> transformResultData(List<SchemaField> columns, List<List<Object>> data) {
        List<List<Object>> rows = new ArrayList<>(data.size());
        for (List<Object> row : data) {
            List<Object> values = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                values.add(convert(columns.get(i).getType(), row.get(i)));
            }
            rows.add(values);
        }
        return rows;
    }

    private static Object convert(FieldType type, Object value) {
        if (value == null) {
            return null;
        }
        if (type.isArray()) {
            FieldType elementType = type.getArrayElementType();
            return ((List<?>) value).stream()
                    .map(item -> convert(elementType, item))
                    .collect(Collectors.toList());
        }

        switch (type) {
            case STRING:
                return value.toString();
            case LONG:
                return value instanceof Number ? ((Number) value).longValue() : Long.parseLong(value.toString());
            case INTEGER:
                return value instanceof Number ? ((Number) value).intValue() : Integer.parseInt(value.toString());
            case DOUBLE:
                return value instanceof Number ? ((Number) value).doubleValue() : parseDouble(value.toString());
            case BOOLEAN:
                return value instanceof Boolean ? value : value.toString().equals("true") || value.toString().equals("1");
            case TIMESTAMP:
                return parseTimestamp(value.toString());
            case DATE:
                return LocalDate.parse(value.toString());
            default:
                return value;
        }
    }

    private static double parseDouble(String value) {
        switch (value) {
            case "nan":
                return Double.NaN;
            case "inf":
            case "+inf":
                return Double.POSITIVE_INFINITY;
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            default:
                return Double.parseDouble(value);
        }
    }

    private static Instant parseTimestamp(String value) {
        if (value.endsWith("Z")) {
            return Instant.parse(value);
        }
        return LocalDateTime.parse(value, RESULT_DATE_TIME_FORMATTER).toInstant(UTC);
    }

    @Override
    public CompletableFuture<QueryResult> getResult() {
        return result;
    }

    @Override
    public void kill() {
        if (!result.isDone()) {
            LOGGER.debug("Cancelling ClickHouse query %s", queryId);
            // cancelling the request future aborts the HTTP call, the result stage fails with it
            response.cancel(true);
        }
    }

    private static class QueryResponseHandler
            implements ResponseHandler<ClickHouseQueryResult, RuntimeException> {
        @Override
        public ClickHouseQueryResult handleException(Request request, Exception exception)
                throws RuntimeException {
            LOGGER.error(exception, "Unable to reach ClickHouse at %s", request.getUri().getHost());
            throw new StepflowException("Unable to reach ClickHouse: " + exception.getMessage(), INTERNAL_SERVER_ERROR, exception);
        }

        @Override
        public ClickHouseQueryResult handle(Request request, Response response)
                throws RuntimeException {
            if (response.getStatusCode() != 200) {
                try {
                    String message = CharStreams.toString(new InputStreamReader(response.getInputStream(), UTF_8));
                    message = message.split(", Stack trace", 2)[0].trim();
                    throw new StepflowException(message, BAD_GATEWAY);
                } catch (IOException e) {
                    throw new StepflowException("ClickHouse returned status " + response.getStatusCode(), BAD_GATEWAY, e);
                }
            }

            try {
                return JsonHelper.read(response.getInputStream(), ClickHouseQueryResult.class);
            } catch (IOException e) {
                LOGGER.error(e, "An error occurred while reading query results");
                throw new StepflowException("An error occurred while reading query results: " + e.getMessage(),
                        INTERNAL_SERVER_ERROR, e);
            }
        }
    }
}
