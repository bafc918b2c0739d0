package org.carball.stackops.cloud;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.exception.TransportException;
import org.carball.stackops.model.resource.FloatingIp;
import org.carball.stackops.model.resource.LoadBalancer;
import org.carball.stackops.model.resource.Project;
import org.carball.stackops.model.resource.ResourceType;
import org.carball.stackops.model.resource.Server;
import org.carball.stackops.model.resource.User;
import org.carball.stackops.model.resource.VolumeSnapshot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads cloud resources from an exported snapshot file instead of calling the OpenStack APIs.
 * Native filters are applied the way the list APIs apply them: exact matches on fields,
 * {@code changes-since}/{@code changes-before} on {@code updated_at}, and a rejection for
 * any key the API would not recognise.
 */
@Slf4j
public class JsonFileCloudClient implements CloudClient {

    static final String CHANGES_SINCE = "changes-since";
    static final String CHANGES_BEFORE = "changes-before";
    static final String ALL_TENANTS = "all_tenants";
    private static final String UPDATED_AT = "updated_at";

    // Nova list filter names that differ from the field they match.
    private static final Map<String, String> SERVER_FILTER_FIELDS = Map.of(
            "uuid", "id",
            "flavor", "flavor_id",
            "image", "image_id");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonNode exportData;
    private final Map<ResourceType, Integer> listingCalls = new EnumMap<>(ResourceType.class);

    public JsonFileCloudClient(String filePath) throws IOException {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            throw new IOException("Cloud snapshot file not found: " + filePath);
        }

        String content = Files.readString(path);
        exportData = objectMapper.readTree(content);

        validateExportFormat();
        log.debug("Loaded cloud snapshot {} ({})", filePath, getExportMetadata().cloudName());
    }

    @Override
    public ResourceLister<Server> servers() {
        return filters -> list(ResourceType.SERVER, Server.class, filters);
    }

    @Override
    public ResourceLister<FloatingIp> floatingIps() {
        return filters -> list(ResourceType.FLOATING_IP, FloatingIp.class, filters);
    }

    @Override
    public ResourceLister<LoadBalancer> loadBalancers() {
        return filters -> list(ResourceType.LOAD_BALANCER, LoadBalancer.class, filters);
    }

    @Override
    public ResourceLister<VolumeSnapshot> volumeSnapshots() {
        return filters -> list(ResourceType.VOLUME_SNAPSHOT, VolumeSnapshot.class, filters);
    }

    @Override
    public ResourceLister<Project> projects() {
        return filters -> list(ResourceType.PROJECT, Project.class, filters);
    }

    @Override
    public ResourceLister<User> users() {
        return filters -> list(ResourceType.USER, User.class, filters);
    }

    @Override
    public AuxiliaryLookup<Project> projectLookup() {
        return id -> findById(ResourceType.PROJECT, Project.class, id);
    }

    @Override
    public AuxiliaryLookup<User> userLookup() {
        return id -> findById(ResourceType.USER, User.class, id);
    }

    /**
     * Number of listing calls made for a resource type since this client was created.
     */
    public int getListingCallCount(ResourceType type) {
        return listingCalls.getOrDefault(type, 0);
    }

    public ExportMetadata getExportMetadata() {
        JsonNode metadata = exportData.get("export_metadata");
        return new ExportMetadata(
                metadata.get("cloud_name").asText(),
                metadata.get("export_timestamp").asText(),
                metadata.has("region") ? metadata.get("region").asText() : null);
    }

    private void validateExportFormat() {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in cloud snapshot file");
        }

        JsonNode metadata = exportData.get("export_metadata");
        if (metadata == null) {
            throw new IllegalStateException("Missing export_metadata section in cloud snapshot file");
        }

        String[] requiredFields = {"cloud_name", "export_timestamp"};
        for (String field : requiredFields) {
            if (!metadata.has(field)) {
                throw new IllegalStateException("Missing required metadata field: " + field);
            }
        }

        for (ResourceType type : ResourceType.values()) {
            JsonNode collection = exportData.get(type.getCollectionName());
            if (collection != null && !collection.isArray()) {
                throw new IllegalStateException("Invalid " + type.getCollectionName() + " section in cloud snapshot file");
            }
        }
    }

    private <R> List<R> list(ResourceType type, Class<R> resourceClass, Map<String, Object> filters) {
        listingCalls.merge(type, 1, Integer::sum);
        Set<String> fields = fieldNames(resourceClass);
        Map<String, Object> effective = filters == null ? Map.of() : filters;
        for (String key : effective.keySet()) {
            if (!isKnownFilter(type, key, fields)) {
                throw new TransportException(String.format(
                        "Invalid filter '%s' for %s listing", key, type.getCollectionName()));
            }
        }

        List<R> results = new ArrayList<>();
        for (JsonNode node : collection(type)) {
            if (matches(type, node, effective)) {
                results.add(convert(node, resourceClass));
            }
        }
        log.debug("Listed {} {} with filters {}", results.size(), type.getCollectionName(), effective);
        return results;
    }

    private <R> Optional<R> findById(ResourceType type, Class<R> resourceClass, String id) {
        for (JsonNode node : collection(type)) {
            JsonNode nodeId = node.get("id");
            if (nodeId != null && nodeId.asText().equals(id)) {
                return Optional.of(convert(node, resourceClass));
            }
        }
        return Optional.empty();
    }

    private List<JsonNode> collection(ResourceType type) {
        List<JsonNode> nodes = new ArrayList<>();
        JsonNode collection = exportData.get(type.getCollectionName());
        if (collection != null) {
            collection.forEach(nodes::add);
        }
        return nodes;
    }

    private boolean isKnownFilter(ResourceType type, String key, Set<String> fields) {
        if (ALL_TENANTS.equals(key) || CHANGES_SINCE.equals(key) || CHANGES_BEFORE.equals(key)) {
            return type == ResourceType.SERVER;
        }
        return fields.contains(fieldFor(type, key));
    }

    private boolean matches(ResourceType type, JsonNode node, Map<String, Object> filters) {
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            String key = filter.getKey();
            if (ALL_TENANTS.equals(key)) {
                continue;
            }
            if (CHANGES_SINCE.equals(key) || CHANGES_BEFORE.equals(key)) {
                Instant bound = parseBound(key, filter.getValue());
                Instant updated = parseTimestamp(node.get(UPDATED_AT));
                if (updated == null) {
                    return false;
                }
                boolean inRange = CHANGES_SINCE.equals(key) ? !updated.isBefore(bound) : !updated.isAfter(bound);
                if (!inRange) {
                    return false;
                }
                continue;
            }
            JsonNode field = node.get(fieldFor(type, key));
            String actual = field == null || field.isNull() ? null : field.asText();
            String expected = filter.getValue() == null ? null : String.valueOf(filter.getValue());
            if (actual == null || !actual.equals(expected)) {
                return false;
            }
        }
        return true;
    }

    private static String fieldFor(ResourceType type, String key) {
        if (type == ResourceType.SERVER) {
            return SERVER_FILTER_FIELDS.getOrDefault(key, key);
        }
        return key;
    }

    private static Instant parseBound(String key, Object value) {
        try {
            return Instant.parse(String.valueOf(value));
        } catch (DateTimeParseException e) {
            throw new TransportException("Invalid timestamp for filter '" + key + "': " + value, e);
        }
    }

    private static Instant parseTimestamp(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable updated_at '{}' in snapshot", value.asText());
            return null;
        }
    }

    private <R> R convert(JsonNode node, Class<R> resourceClass) {
        try {
            return objectMapper.treeToValue(node, resourceClass);
        } catch (JsonProcessingException e) {
            throw new TransportException("Malformed " + resourceClass.getSimpleName() + " record in snapshot", e);
        }
    }

    private Set<String> fieldNames(Class<?> resourceClass) {
        JavaType javaType = objectMapper.constructType(resourceClass);
        return objectMapper.getDeserializationConfig().introspect(javaType).findProperties().stream()
                .map(BeanPropertyDefinition::getName)
                .collect(Collectors.toSet());
    }

    /**
     * Metadata about the cloud snapshot.
     */
    public record ExportMetadata(String cloudName, String exportTimestamp, String region) {
    }
}
