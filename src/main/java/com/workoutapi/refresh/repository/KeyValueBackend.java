package com.workoutapi.refresh.repository;

import java.time.Duration;
import java.util.Set;

/**
 * Shared key-value store used for idempotency keys.
 * Any call may fail independently with a runtime exception.
 *
 * Allows plug-and-play backend implementations.
 */
public interface KeyValueBackend {

    /**
     * Atomically sets the key with a TTL if it does not exist yet.
     *
     * @return true if the key was newly set, false if it already existed
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Delete a key. Deleting a missing key is not an error.
     */
    void delete(String key);

    /**
     * All keys starting with the given prefix.
     */
    Set<String> keysByPrefix(String prefix);

    /**
     * Round-trip to the backend; throws if it cannot be reached.
     */
    void ping();
}
