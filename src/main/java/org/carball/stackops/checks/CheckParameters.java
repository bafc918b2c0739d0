package org.carball.stackops.checks;

import lombok.Builder;
import lombok.Value;

/**
 * Caller overrides for a check run. Unset values fall back to the engine configuration.
 */
@Value
@Builder
public class CheckParameters {
    Integer days;
    String projectId;

    public static CheckParameters defaults() {
        return CheckParameters.builder().build();
    }

    public int daysOr(int configured) {
        return days != null ? days : configured;
    }
}
