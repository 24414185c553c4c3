package com.seatwatch.monitor.service.cache;

import com.seatwatch.monitor.dto.LocationDirectory;

import java.util.Optional;

/**
 * Interface for the shared location directory store.
 * Allows for different store implementations (Redis, in-memory for testing).
 */
public interface LocationStoreOperations {

    /**
     * @return the stored directory, expired or not; empty if nothing is stored or the store is unreachable
     */
    Optional<LocationDirectory> load();

    void save(LocationDirectory directory);
}
