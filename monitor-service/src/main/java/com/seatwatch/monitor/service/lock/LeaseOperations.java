package com.seatwatch.monitor.service.lock;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Short-lived, non-blocking exclusive lease on a resource.
 * Allows for different lease implementations (Redis, in-memory for testing).
 */
public interface LeaseOperations {

    /**
     * Executes the action only if no other worker holds the lease on the resource.
     *
     * @param resourceId Resource to lease
     * @param action Action to execute while holding the lease
     * @return Result of action, or empty if the lease is held elsewhere
     */
    <T> Optional<T> executeIfLeased(String resourceId, Supplier<T> action);
}
