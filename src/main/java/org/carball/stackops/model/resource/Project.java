package org.carball.stackops.model.resource;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Keystone project. The contact email is a custom attribute set by cloud operators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Project implements CloudResource {
    private String id;
    private String name;
    private String description;
    private String email;
    private Boolean enabled;

    @JsonProperty("domain_id")
    private String domainId;

    @JsonProperty("parent_id")
    private String parentId;
}
