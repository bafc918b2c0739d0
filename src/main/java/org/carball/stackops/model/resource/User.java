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
public class User implements CloudResource {
    private String id;
    private String name;
    private String email;
    private String description;
    private Boolean enabled;

    @JsonProperty("domain_id")
    private String domainId;
}
