package org.carball.stackops.model.resource;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Block storage (Cinder) snapshot. Size is in GiB.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VolumeSnapshot implements CloudResource {
    private String id;
    private String name;
    private String description;
    private String status;
    private Integer size;

    @JsonProperty("volume_id")
    private String volumeId;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;
}
