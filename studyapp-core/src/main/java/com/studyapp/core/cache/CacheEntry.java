package com.studyapp.core.cache;

/**
 * Cached value with the epoch millis it was stored at and its time-to-live.
 * An entry is valid while {@code now - timestamp < ttlMillis}.
 */
public record CacheEntry<T>(
    T data,
    long timestamp,
    long ttlMillis
) {
    public boolean isValidAt(long nowMillis) {
        return nowMillis - timestamp < ttlMillis;
    }
}
