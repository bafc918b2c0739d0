package org.carball.stackops.query;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.cloud.AuxiliaryLookup;
import org.carball.stackops.cloud.CloudClient;
import org.carball.stackops.exception.LookupFailureException;
import org.carball.stackops.model.property.AuxiliaryData;
import org.carball.stackops.model.resource.Project;
import org.carball.stackops.model.resource.User;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Auxiliary lookups for a single execution. Each id is looked up at most once; a lookup
 * that fails or finds nothing is recorded, logged once and then answers empty.
 */
@Slf4j
public class LookupContext implements AuxiliaryData {

    private final AuxiliaryLookup<Project> projectLookup;
    private final AuxiliaryLookup<User> userLookup;
    private final Map<String, Optional<Project>> projects = new HashMap<>();
    private final Map<String, Optional<User>> users = new HashMap<>();
    private final List<LookupFailureException> failures = new ArrayList<>();
    private int lookupCount;

    public LookupContext(AuxiliaryLookup<Project> projectLookup, AuxiliaryLookup<User> userLookup) {
        this.projectLookup = projectLookup;
        this.userLookup = userLookup;
    }

    public static LookupContext forClient(CloudClient client) {
        return new LookupContext(client.projectLookup(), client.userLookup());
    }

    @Override
    public Optional<Project> project(String projectId) {
        return cached(projects, projectLookup, "project", projectId);
    }

    @Override
    public Optional<User> user(String userId) {
        return cached(users, userLookup, "user", userId);
    }

    public List<LookupFailureException> getFailures() {
        return List.copyOf(failures);
    }

    /**
     * Number of calls made to the underlying lookups.
     */
    public int getLookupCount() {
        return lookupCount;
    }

    private <A> Optional<A> cached(Map<String, Optional<A>> cache, AuxiliaryLookup<A> lookup,
                                   String kind, String id) {
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        Optional<A> known = cache.get(id);
        if (known != null) {
            return known;
        }

        Optional<A> result;
        lookupCount++;
        try {
            result = lookup.get(id);
            if (result == null || result.isEmpty()) {
                record(new LookupFailureException(String.format("No %s found with id '%s'", kind, id)));
                result = Optional.empty();
            }
        } catch (RuntimeException e) {
            record(new LookupFailureException(
                    String.format("Failed to look up %s '%s': %s", kind, id, e.getMessage()), e));
            result = Optional.empty();
        }
        cache.put(id, result);
        return result;
    }

    private void record(LookupFailureException failure) {
        failures.add(failure);
        log.warn("{}; derived properties will be empty", failure.getMessage());
    }
}
