package org.carball.stackops.query;

import org.carball.stackops.model.property.AuxiliaryData;
import org.carball.stackops.model.property.ResourceProperty;
import org.carball.stackops.model.query.ResultRecord;
import org.carball.stackops.model.query.SortOrder;
import org.carball.stackops.model.resource.CloudResource;
import org.carball.stackops.query.mapping.QueryMapping;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Output side of a query: which properties to project, in which order, and whether
 * to sort or group the projected records.
 */
public class QueryOutput<R extends CloudResource> {

    public static final String NO_GROUP = "(none)";

    private final QueryMapping<R> mapping;
    private final Set<ResourceProperty<R>> selected = new LinkedHashSet<>();
    private ResourceProperty<R> sortProperty;
    private SortOrder sortOrder = SortOrder.ASC;
    private ResourceProperty<R> groupProperty;

    public QueryOutput(QueryMapping<R> mapping) {
        this.mapping = mapping;
    }

    @SafeVarargs
    public final QueryOutput<R> select(ResourceProperty<R>... properties) {
        for (ResourceProperty<R> property : properties) {
            selected.add(property);
        }
        return this;
    }

    public QueryOutput<R> select(String... propertyNames) {
        for (String name : propertyNames) {
            selected.add(mapping.resolveProperty(name));
        }
        return this;
    }

    public QueryOutput<R> selectAll() {
        selected.addAll(mapping.getProperties());
        return this;
    }

    public QueryOutput<R> sortBy(ResourceProperty<R> property, SortOrder order) {
        this.sortProperty = property;
        this.sortOrder = order == null ? SortOrder.ASC : order;
        return this;
    }

    public QueryOutput<R> sortBy(String propertyName, SortOrder order) {
        return sortBy(mapping.resolveProperty(propertyName), order);
    }

    public QueryOutput<R> groupBy(ResourceProperty<R> property) {
        this.groupProperty = property;
        return this;
    }

    public QueryOutput<R> groupBy(String propertyName) {
        return groupBy(mapping.resolveProperty(propertyName));
    }

    /**
     * Selected properties, or the resource type's defaults when nothing was selected.
     */
    public List<ResourceProperty<R>> getSelectedProperties() {
        if (selected.isEmpty()) {
            return mapping.getDefaultOutputProperties();
        }
        return List.copyOf(selected);
    }

    public QueryResult project(List<R> resources, AuxiliaryData auxiliaryData) {
        List<ResourceProperty<R>> properties = getSelectedProperties();
        List<String> columns = properties.stream()
                .map(ResourceProperty::getPropertyName)
                .collect(Collectors.toList());

        List<R> ordered = new ArrayList<>(resources);
        if (sortProperty != null) {
            ordered.sort(comparator(sortProperty, sortOrder, auxiliaryData));
        }

        List<ResultRecord> records = new ArrayList<>();
        Map<String, List<ResultRecord>> groups = groupProperty == null ? null : new LinkedHashMap<>();
        for (R resource : ordered) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (ResourceProperty<R> property : properties) {
                values.put(property.getPropertyName(), property.extract(resource, auxiliaryData));
            }
            ResultRecord record = new ResultRecord(values);
            records.add(record);
            if (groups != null) {
                groups.computeIfAbsent(groupKey(groupProperty.extract(resource, auxiliaryData)),
                        key -> new ArrayList<>()).add(record);
            }
        }

        String groupedBy = groupProperty == null ? null : groupProperty.getPropertyName();
        return new QueryResult(mapping.getResourceType(), columns, records, groupedBy, groups);
    }

    static String groupKey(Object value) {
        if (value == null) {
            return NO_GROUP;
        }
        String key = value.toString();
        return key.isEmpty() ? NO_GROUP : key;
    }

    private Comparator<R> comparator(ResourceProperty<R> property, SortOrder order, AuxiliaryData auxiliaryData) {
        Comparator<Object> values = QueryOutput::compareValues;
        if (order == SortOrder.DESC) {
            values = values.reversed();
        }
        Comparator<Object> nullsLast = Comparator.nullsLast(values);
        return (left, right) -> nullsLast.compare(
                property.extract(left, auxiliaryData), property.extract(right, auxiliaryData));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareValues(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof Comparable && left.getClass().isInstance(right)) {
            return ((Comparable) left).compareTo(right);
        }
        return left.toString().compareTo(right.toString());
    }
}
