package org.carball.stackops.model.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-facing description of one query: what to list, how to filter it and what to output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryRequest {

    @JsonProperty("resource_type")
    private String resourceType;

    @Builder.Default
    private List<FilterSpec> filters = new ArrayList<>();

    @JsonProperty("raw_filters")
    @Builder.Default
    private Map<String, Object> rawFilters = new LinkedHashMap<>();

    @Builder.Default
    private List<String> properties = new ArrayList<>();

    @JsonProperty("group_by")
    private String groupBy;

    @JsonProperty("sort_by")
    private String sortBy;

    @JsonProperty("sort_order")
    private String sortOrder;

    @JsonProperty("pretty_print")
    private boolean prettyPrint;
}
