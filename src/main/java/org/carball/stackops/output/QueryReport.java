package org.carball.stackops.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.exception.StackOpsException;
import org.carball.stackops.model.query.ResultRecord;
import org.carball.stackops.query.QueryResult;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON rendering of a query result, with a small metadata block in front of the records.
 */
@Slf4j
public class QueryReport {

    private final QueryResult result;
    private final Instant timestamp;
    private final ObjectMapper objectMapper;

    public QueryReport(QueryResult result) {
        this(result, Clock.systemUTC());
    }

    public QueryReport(QueryResult result, Clock clock) {
        this.result = result;
        this.timestamp = clock.instant();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new StackOpsException("Failed to generate JSON report", e);
        }
    }

    private ReportData buildReportData() {
        ReportData data = new ReportData();
        data.setQueryMetadata(new QueryMetadata(timestamp, result.getResourceType().getDisplayName(),
                result.getColumns(), result.size(), result.getGroupedBy()));
        if (result.isGrouped()) {
            data.setGroups(result.toGroups());
        } else {
            data.setRecords(result.toList());
        }
        if (!result.getWarnings().isEmpty()) {
            data.setWarnings(result.getWarnings());
        }
        return data;
    }

    @lombok.Data
    private static class ReportData {
        @JsonProperty("query_metadata")
        private QueryMetadata queryMetadata;
        private List<ResultRecord> records;
        private Map<String, List<ResultRecord>> groups;
        private List<String> warnings;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class QueryMetadata {
        private Instant timestamp;
        @JsonProperty("resource_type")
        private String resourceType;
        private List<String> properties;
        @JsonProperty("record_count")
        private int recordCount;
        @JsonProperty("grouped_by")
        private String groupedBy;
    }
}
