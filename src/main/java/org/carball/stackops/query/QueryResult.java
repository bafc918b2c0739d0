package org.carball.stackops.query;

import lombok.Getter;
import org.carball.stackops.model.query.ResultRecord;
import org.carball.stackops.model.resource.ResourceType;
import org.carball.stackops.output.QueryReport;
import org.carball.stackops.output.ResultTableRenderer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projected records of one execution, flat or grouped. Groups partition the records
 * and keep the order in which each key first appeared.
 */
@Getter
public class QueryResult {

    private final ResourceType resourceType;
    private final List<String> columns;
    private final List<ResultRecord> records;
    private final String groupedBy;
    private final Map<String, List<ResultRecord>> groups;
    private final List<String> warnings = new ArrayList<>();

    QueryResult(ResourceType resourceType, List<String> columns, List<ResultRecord> records,
                String groupedBy, Map<String, List<ResultRecord>> groups) {
        this.resourceType = resourceType;
        this.columns = List.copyOf(columns);
        this.records = List.copyOf(records);
        this.groupedBy = groupedBy;
        if (groups == null) {
            this.groups = null;
        } else {
            Map<String, List<ResultRecord>> copy = new LinkedHashMap<>();
            groups.forEach((key, members) -> copy.put(key, List.copyOf(members)));
            this.groups = Collections.unmodifiableMap(copy);
        }
    }

    public List<ResultRecord> toList() {
        return records;
    }

    public Map<String, List<ResultRecord>> toGroups() {
        if (groups == null) {
            throw new IllegalStateException("Result is not grouped; use groupBy before running the query");
        }
        return groups;
    }

    public boolean isGrouped() {
        return groups != null;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public String toTable(boolean prettyPrint) {
        return new ResultTableRenderer(prettyPrint
                ? ResultTableRenderer.Style.GRID
                : ResultTableRenderer.Style.PLAIN).render(this);
    }

    public String toJson() {
        return new QueryReport(this).toJson();
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }
}
