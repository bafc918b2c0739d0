package org.carball.stackops.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.query.handler.ClientSideHandlerDateTime;

import java.time.format.DateTimeFormatter;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public class QueryEngineConfig {

    // Pushdown
    @JsonProperty("server_side_filters")
    @Builder.Default
    private boolean serverSideFilters = true;

    @JsonProperty("verify_server_side_filters")
    @Builder.Default
    private boolean verifyServerSideFilters = true;

    @JsonProperty("max_listing_calls")
    @Builder.Default
    private int maxListingCalls = 20;

    // Evaluation
    @JsonProperty("datetime_format")
    @Builder.Default
    private String dateTimeFormat = ClientSideHandlerDateTime.DEFAULT_FORMAT;

    // Output
    @JsonProperty("pretty_print")
    @Builder.Default
    private boolean prettyPrint = false;

    @JsonProperty("output_format")
    @Builder.Default
    private OutputFormat outputFormat = OutputFormat.TABLE;

    // Checks
    @JsonProperty("deleting_machine_minutes")
    @Builder.Default
    private int deletingMachineMinutes = 10;

    @JsonProperty("stale_snapshot_days")
    @Builder.Default
    private int staleSnapshotDays = 30;

    @JsonProperty("down_floating_ip_days")
    @Builder.Default
    private int downFloatingIpDays = 7;

    public static QueryEngineConfig defaults() {
        return QueryEngineConfig.builder().build();
    }

    /**
     * Logs warnings for values that are accepted but probably not what the operator meant.
     */
    public void validate() {
        if (maxListingCalls < 1) {
            log.warn("Max listing calls ({}) should be at least 1; ANY_IN filters will never be pushed down",
                    maxListingCalls);
        }

        if (!serverSideFilters && !verifyServerSideFilters) {
            log.warn("Server-side filters are disabled, so verify_server_side_filters has no effect");
        }

        if (serverSideFilters && !verifyServerSideFilters) {
            log.warn("Pushed-down filters will not be re-checked locally; results depend on the API honouring them");
        }

        if (dateTimeFormat == null || dateTimeFormat.isBlank()) {
            log.warn("No datetime format configured; the default '{}' will be used",
                    ClientSideHandlerDateTime.DEFAULT_FORMAT);
        } else {
            try {
                DateTimeFormatter.ofPattern(dateTimeFormat);
            } catch (IllegalArgumentException e) {
                log.warn("Datetime format '{}' is not a valid pattern; datetime filters without a format will fail",
                        dateTimeFormat);
            }
        }

        if (deletingMachineMinutes <= 0) {
            log.warn("Deleting machine threshold ({} minutes) should be positive", deletingMachineMinutes);
        }

        if (staleSnapshotDays <= 0) {
            log.warn("Stale snapshot threshold ({} days) should be positive", staleSnapshotDays);
        }

        if (downFloatingIpDays <= 0) {
            log.warn("Down floating IP threshold ({} days) should be positive", downFloatingIpDays);
        }

        log.debug("Using engine config - pushdown: {}, verify: {}, max calls: {}, format: {}",
                serverSideFilters, verifyServerSideFilters, maxListingCalls, dateTimeFormat);
    }

    public String getConfigurationSummary() {
        return String.format("Pushdown: %s | Verify: %s | Max calls: %d | Output: %s%s",
                serverSideFilters ? "on" : "off", verifyServerSideFilters ? "on" : "off",
                maxListingCalls, outputFormat.getDisplayName(), prettyPrint ? " (pretty)" : "");
    }
}
