package org.javai.deployguard.transaction;

import java.time.Instant;
import java.util.Objects;

/**
 * A resource created inside a {@link DeploymentTransaction}, with the action that removes it.
 *
 * @param resourceType a free-form tag such as {@code workspace} or {@code role-assignment}
 * @param label human-readable name used in logs
 * @param resourceId the identifier the provider assigned
 * @param cleanup removes the resource
 * @param trackedAt when the resource was registered
 */
public record TrackedResource(
        String resourceType,
        String label,
        String resourceId,
        CleanupAction cleanup,
        Instant trackedAt
) {
    public static final String UNTYPED = "resource";

    public TrackedResource {
        Objects.requireNonNull(resourceType, "resourceType must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(resourceId, "resourceId must not be null");
        Objects.requireNonNull(cleanup, "cleanup must not be null");
        Objects.requireNonNull(trackedAt, "trackedAt must not be null");
    }

    @Override
    public String toString() {
        return resourceType + " '" + label + "' (" + resourceId + ")";
    }
}
