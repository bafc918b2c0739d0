package org.carball.stackops.model.resource;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FloatingIp implements CloudResource {
    private String id;
    private String name;
    private String description;
    private String status;

    @JsonProperty("floating_ip_address")
    private String floatingIpAddress;

    @JsonProperty("fixed_ip_address")
    private String fixedIpAddress;

    @JsonProperty("port_id")
    private String portId;

    @JsonProperty("router_id")
    private String routerId;

    @JsonProperty("floating_network_id")
    private String floatingNetworkId;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;
}
