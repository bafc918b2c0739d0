package org.carball.stackops.model.resource;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Octavia load balancer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoadBalancer implements CloudResource {
    private String id;
    private String name;
    private String description;
    private String provider;

    @JsonProperty("provisioning_status")
    private String provisioningStatus;

    @JsonProperty("operating_status")
    private String operatingStatus;

    @JsonProperty("vip_address")
    private String vipAddress;

    @JsonProperty("flavor_id")
    private String flavorId;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;
}
