package com.studyapp.core.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value cache for corpus slices and individual questions.
 * Expired entries behave as absent.
 */
public interface CorpusCache {
    
    /**
     * Returns the value for the key if present and not expired.
     */
    <T> Optional<T> get(String key);
    
    /**
     * Stores a value with the cache's default time-to-live.
     */
    <T> void put(String key, T value);
    
    <T> void put(String key, T value, Duration ttl);
    
    /**
     * Drops every entry regardless of its remaining time-to-live.
     */
    void clear();
    
    int size();
}
