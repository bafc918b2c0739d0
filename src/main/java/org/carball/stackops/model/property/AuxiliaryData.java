package org.carball.stackops.model.property;

import org.carball.stackops.model.resource.Project;
import org.carball.stackops.model.resource.User;

import java.util.Optional;
import java.util.function.Function;

/**
 * Cross-references available to derived properties. Implementations resolve
 * ids through the cloud and are scoped to a single query execution.
 */
public interface AuxiliaryData {

    AuxiliaryData NONE = new AuxiliaryData() {
        @Override
        public Optional<Project> project(String projectId) {
            return Optional.empty();
        }

        @Override
        public Optional<User> user(String userId) {
            return Optional.empty();
        }
    };

    Optional<Project> project(String projectId);

    Optional<User> user(String userId);

    default Object projectField(String projectId, Function<Project, ?> field) {
        return project(projectId).map(field).orElse(null);
    }

    default Object userField(String userId, Function<User, ?> field) {
        return user(userId).map(field).orElse(null);
    }
}
