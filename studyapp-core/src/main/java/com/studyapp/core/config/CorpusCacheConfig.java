package com.studyapp.core.config;

import com.studyapp.core.cache.CorpusCache;
import com.studyapp.core.cache.InMemoryCorpusCache;
import com.studyapp.core.cache.NoOpCorpusCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class CorpusCacheConfig {
    
    private final SearchProperties searchProperties;
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean
    public CorpusCache corpusCache(Clock clock) {
        SearchProperties.Cache cacheProperties = searchProperties.getCache();
        if (!cacheProperties.isEnabled()) {
            log.info("Corpus cache disabled, every search will read the question corpus");
            return new NoOpCorpusCache();
        }
        log.info("Initializing in-memory corpus cache | ttlMinutes={}", cacheProperties.getTtlMinutes());
        return new InMemoryCorpusCache(clock, Duration.ofMinutes(cacheProperties.getTtlMinutes()));
    }
}
