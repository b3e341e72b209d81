package com.studyapp.core.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache that never retains anything; every lookup goes to the corpus.
 */
public class NoOpCorpusCache implements CorpusCache {
    
    @Override
    public <T> Optional<T> get(String key) {
        return Optional.empty();
    }
    
    @Override
    public <T> void put(String key, T value) {
    }
    
    @Override
    public <T> void put(String key, T value, Duration ttl) {
    }
    
    @Override
    public void clear() {
    }
    
    @Override
    public int size() {
        return 0;
    }
}
