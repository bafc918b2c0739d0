package org.carball.stackops.cloud;

import java.util.Optional;

/**
 * Fetches a single record by id, empty when it does not exist.
 */
@FunctionalInterface
public interface AuxiliaryLookup<A> {

    Optional<A> get(String id);
}
