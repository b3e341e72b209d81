package com.studyapp.core.service;

import com.studyapp.core.cache.CorpusCacheKeys;
import com.studyapp.core.cache.InMemoryCorpusCache;
import com.studyapp.core.cache.MutableClock;
import com.studyapp.core.search.TestQuestions;
import com.studyapp.data.model.QuestionRecord;
import com.studyapp.data.repository.CorpusNotFoundException;
import com.studyapp.data.repository.QuestionCorpusRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuestionCorpusServiceTest {

    @Mock
    private QuestionCorpusRepository repository;

    private MutableClock clock;
    private InMemoryCorpusCache cache;
    private QuestionCorpusService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        cache = new InMemoryCorpusCache(clock, Duration.ofMinutes(15));
        service = new QuestionCorpusService(repository, cache);
    }

    @Test
    void resolveSlice_readsRepositoryOnceWhileCached() {
        when(repository.fetchCorpusSlice("aws", "saa-c03")).thenReturn(TestQuestions.corpus());

        List<QuestionRecord> first = service.resolveSlice("aws", "saa-c03");
        List<QuestionRecord> second = service.resolveSlice("aws", "saa-c03");

        assertEquals(3, first.size());
        assertSame(first, second);
        verify(repository, times(1)).fetchCorpusSlice("aws", "saa-c03");
        assertTrue(cache.get(CorpusCacheKeys.forExam("aws", "saa-c03")).isPresent());
    }

    @Test
    void resolveSlice_reloadsAfterTtl() {
        when(repository.fetchCorpusSlice(null, null)).thenReturn(TestQuestions.corpus());

        service.resolveSlice(null, null);
        clock.advance(Duration.ofMinutes(16));
        service.resolveSlice(null, null);

        verify(repository, times(2)).fetchCorpusSlice(null, null);
    }

    @Test
    void resolveSlice_returnsImmutableSnapshot() {
        List<QuestionRecord> source = new ArrayList<>(TestQuestions.corpus());
        when(repository.fetchCorpusSlice("aws", null)).thenReturn(source);

        List<QuestionRecord> slice = service.resolveSlice("aws", null);
        source.clear();

        assertEquals(3, slice.size());
        assertThrows(UnsupportedOperationException.class, () -> slice.add(TestQuestions.ec2Tagged()));
    }

    @Test
    void missingCorpus_degradesToEmptyAndIsNotCached() {
        when(repository.fetchCorpusSlice("gcp", null)).thenThrow(new CorpusNotFoundException("no gcp"));

        assertTrue(service.resolveSlice("gcp", null).isEmpty());
        assertTrue(service.resolveSlice("gcp", null).isEmpty());

        verify(repository, times(2)).fetchCorpusSlice("gcp", null);
        assertEquals(0, service.cachedEntries());
    }

    @Test
    void failingRepository_degradesToEmpty() {
        when(repository.fetchCorpusSlice(null, null)).thenThrow(new IllegalStateException("disk gone"));

        assertTrue(service.resolveSlice(null, null).isEmpty());
    }

    @Test
    void nullSlice_isTreatedAsEmpty() {
        when(repository.fetchCorpusSlice("aws", "empty")).thenReturn(null);

        assertTrue(service.resolveSlice("aws", "empty").isEmpty());
    }

    @Test
    void resolveQuestion_usesWarmFullCorpus() {
        when(repository.fetchCorpusSlice(null, null)).thenReturn(TestQuestions.corpus());
        service.resolveSlice(null, null);

        Optional<QuestionRecord> question = service.resolveQuestion("q-ecs");

        assertTrue(question.isPresent());
        verify(repository, never()).fetchQuestionById(anyString());
        assertTrue(cache.get(CorpusCacheKeys.forQuestion("q-ecs")).isPresent());
    }

    @Test
    void resolveQuestion_fallsBackToRepositoryAndCaches() {
        when(repository.fetchQuestionById("q-tag")).thenReturn(Optional.of(TestQuestions.ec2Tagged()));

        assertTrue(service.resolveQuestion("q-tag").isPresent());
        assertTrue(service.resolveQuestion("q-tag").isPresent());

        verify(repository, times(1)).fetchQuestionById("q-tag");
    }

    @Test
    void resolveQuestion_failureIsEmpty() {
        when(repository.fetchQuestionById("q-x")).thenThrow(new IllegalStateException("boom"));

        assertTrue(service.resolveQuestion("q-x").isEmpty());
    }

    @Test
    void clearCache_forcesReload() {
        when(repository.fetchCorpusSlice("aws", null)).thenReturn(TestQuestions.corpus());
        service.resolveSlice("aws", null);
        assertEquals(1, service.cachedEntries());

        service.clearCache();
        service.resolveSlice("aws", null);

        assertEquals(1, service.cachedEntries());
        verify(repository, times(2)).fetchCorpusSlice("aws", null);
    }
}
