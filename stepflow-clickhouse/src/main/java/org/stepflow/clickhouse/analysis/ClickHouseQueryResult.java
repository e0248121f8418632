package org.stepflow.clickhouse.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of a {@code FORMAT JSONCompact} response.
 */
class ClickHouseQueryResult {
    public final List<ClickHouseColumn> meta;
    public final List<List<Object>> data;
    public final long rows;
    public final Statistics statistics;

    @JsonCreator
    ClickHouseQueryResult(
            @JsonProperty("meta") List<ClickHouseColumn> meta,
            @JsonProperty("data") List<List<Object>> data,
            @JsonProperty("rows") long rows,
            @JsonProperty("statistics") Statistics statistics) {
        this.meta = meta;
        this.data = data;
        this.rows = rows;
        this.statistics = statistics;
    }

    public static class Statistics {
        public final double elapsed;
        public final long rowsRead;
        public final long bytesRead;

        @JsonCreator
        public Statistics(@JsonProperty("elapsed") double elapsed,
                          @JsonProperty("rows_read") long rowsRead,
                          @JsonProperty("bytes_read") long bytesRead) {
            this.elapsed = elapsed;
            this.rowsRead = rowsRead;
            this.bytesRead = bytesRead;
        }
    }

    public static class ClickHouseColumn {
        public final String name;
        public final String type;

        @JsonCreator
        public ClickHouseColumn(@JsonProperty("name") String name,
                                @JsonProperty("type") String type) {
            this.name = name;
            this.type = type;
        }
    }
}
