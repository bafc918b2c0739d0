package org.carball.stackops.model.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Textual filter request, as read from a query file: property name, preset name and named arguments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FilterSpec {
    private String property;
    private String preset;

    @Builder.Default
    private Map<String, Object> args = new LinkedHashMap<>();
}
