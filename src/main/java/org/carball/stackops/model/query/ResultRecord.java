package org.carball.stackops.model.query;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projection of one matched resource: property name to value, in selection order.
 */
@EqualsAndHashCode
public final class ResultRecord {

    private final LinkedHashMap<String, Object> values;

    public ResultRecord(Map<String, Object> values) {
        this.values = new LinkedHashMap<>(values);
    }

    public Object get(String propertyName) {
        return values.get(propertyName);
    }

    public boolean containsProperty(String propertyName) {
        return values.containsKey(propertyName);
    }

    public List<String> propertyNames() {
        return List.copyOf(values.keySet());
    }

    @JsonAnyGetter
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
