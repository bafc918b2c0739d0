package org.carball.stackops.checks;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A ticket to be raised for one resource flagged by a check.
 */
@Value
@Builder
public class TicketRequest {
    String check;

    @JsonProperty("resource_id")
    String resourceId;

    String title;
    String body;

    @Singular("dataEntry")
    Map<String, Object> data;

    @JsonProperty("created_at")
    Instant createdAt;
}
