package org.carball.stackops.model.resource;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Compute server (Nova). Timestamps are kept as the API returns them and parsed by the presets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Server implements CloudResource {
    private String id;
    private String name;
    private String description;
    private String status;

    @JsonProperty("flavor_id")
    private String flavorId;

    @JsonProperty("image_id")
    private String imageId;

    @JsonProperty("hypervisor_hostname")
    private String hypervisorHostname;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;
}
