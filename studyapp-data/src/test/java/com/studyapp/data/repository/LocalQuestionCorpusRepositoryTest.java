package com.studyapp.data.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studyapp.data.config.CorpusStorageProperties;
import com.studyapp.data.model.QuestionRecord;
import com.studyapp.data.model.QuestionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LocalQuestionCorpusRepositoryTest {

    @TempDir
    Path dataDir;

    private LocalQuestionCorpusRepository repository;

    @BeforeEach
    void setUp() throws IOException {
        CorpusStorageProperties properties = new CorpusStorageProperties();
        properties.setDirectory(dataDir.toString());
        repository = new LocalQuestionCorpusRepository(properties, new ObjectMapper().findAndRegisterModules());

        writeQuestions("aws", "saa-c03", "["
            + "{\"questionId\":\"aws-1\",\"questionText\":\"Which EC2 instance type?\",\"options\":[\"t3\",\"m5\"],"
            + "\"providerId\":\"wrong\",\"tags\":[\"ec2\"]},"
            + "{\"questionId\":\"aws-2\",\"questionText\":\"Object storage?\",\"options\":[\"S3\"],"
            + "\"difficulty\":\"hard\",\"type\":\"true_false\"},"
            + "{\"questionText\":\"No id here\",\"options\":[\"x\"]}"
            + "]");
        writeQuestions("aws", "dva-c02", "["
            + "{\"questionId\":\"aws-3\",\"questionText\":\"Lambda timeout?\",\"options\":[\"15 minutes\"]}"
            + "]");
        writeQuestions("azure", "az-900", "["
            + "{\"questionId\":\"az-1\",\"questionText\":\"What is a resource group?\",\"options\":[]}"
            + "]");
        Files.createDirectories(dataDir.resolve("questions/azure/empty-exam"));
    }

    private void writeQuestions(String provider, String exam, String json) throws IOException {
        Path examDir = Files.createDirectories(dataDir.resolve("questions").resolve(provider).resolve(exam));
        Files.writeString(examDir.resolve("questions.json"), json, StandardCharsets.UTF_8);
    }

    private List<String> ids(List<QuestionRecord> questions) {
        return questions.stream().map(QuestionRecord::getQuestionId).collect(Collectors.toList());
    }

    @Test
    @DisplayName("exam slice skips invalid records and forces provider/exam from the path")
    void examSlice_normalizesRecords() {
        List<QuestionRecord> questions = repository.fetchCorpusSlice("aws", "saa-c03");

        assertEquals(List.of("aws-1", "aws-2"), ids(questions));
        QuestionRecord first = questions.get(0);
        assertEquals("aws", first.getProviderId());
        assertEquals("saa-c03", first.getExamId());
        assertEquals(QuestionType.MULTIPLE_CHOICE, first.getType());
        assertEquals("intermediate", first.getDifficulty());

        QuestionRecord second = questions.get(1);
        assertEquals(QuestionType.TRUE_FALSE, second.getType());
        assertEquals("hard", second.getDifficulty());
    }

    @Test
    void providerSlice_walksExamsInOrder() {
        assertEquals(List.of("aws-3", "aws-1", "aws-2"), ids(repository.fetchCorpusSlice("aws", null)));
    }

    @Test
    @DisplayName("full corpus skips exam folders without a question file")
    void fullCorpus_includesEveryProvider() {
        assertEquals(List.of("aws-3", "aws-1", "aws-2", "az-1"), ids(repository.fetchCorpusSlice(null, null)));
    }

    @Test
    void missingProviderOrExam_throwsCorpusNotFound() {
        assertThrows(CorpusNotFoundException.class, () -> repository.fetchCorpusSlice("gcp", null));
        assertThrows(CorpusNotFoundException.class, () -> repository.fetchCorpusSlice("aws", "nope"));
    }

    @Test
    void pathTraversalIds_areRejected() {
        assertThrows(CorpusNotFoundException.class, () -> repository.fetchCorpusSlice("..", null));
        assertThrows(CorpusNotFoundException.class, () -> repository.fetchCorpusSlice("aws", "../azure"));
    }

    @Test
    void fetchQuestionById_searchesWholeCorpus() {
        Optional<QuestionRecord> found = repository.fetchQuestionById("az-1");

        assertTrue(found.isPresent());
        assertEquals("azure", found.get().getProviderId());
        assertTrue(repository.fetchQuestionById("missing").isEmpty());
    }

    @Test
    void missingStorageRoot_throwsForSlicesButNotForLookup() {
        CorpusStorageProperties properties = new CorpusStorageProperties();
        properties.setDirectory(dataDir.resolve("does-not-exist").toString());
        LocalQuestionCorpusRepository empty = new LocalQuestionCorpusRepository(properties, new ObjectMapper());

        assertThrows(CorpusNotFoundException.class, () -> empty.fetchCorpusSlice(null, null));
        assertTrue(empty.fetchQuestionById("aws-1").isEmpty());
    }

    @Test
    void malformedJson_failsWithRuntimeException() throws IOException {
        writeQuestions("broken", "exam", "{not json");

        RuntimeException ex = assertThrows(RuntimeException.class,
            () -> repository.fetchCorpusSlice("broken", "exam"));
        assertFalse(ex instanceof CorpusNotFoundException);
    }
}
