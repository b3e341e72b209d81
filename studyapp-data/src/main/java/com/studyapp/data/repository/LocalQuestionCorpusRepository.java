package com.studyapp.data.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studyapp.data.config.CorpusStorageProperties;
import com.studyapp.data.model.DifficultyLevel;
import com.studyapp.data.model.QuestionRecord;
import com.studyapp.data.model.QuestionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Question corpus stored on the local filesystem as
 * {@code <directory>/questions/<provider>/<exam>/questions.json}.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class LocalQuestionCorpusRepository implements QuestionCorpusRepository {
    
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-][A-Za-z0-9._-]*"); // No leading dot, so ".." never resolves upward
    private static final TypeReference<List<QuestionRecord>> QUESTION_LIST = new TypeReference<>() {};
    
    private final CorpusStorageProperties storageProperties;
    private final ObjectMapper objectMapper;
    
    @Override
    public List<QuestionRecord> fetchCorpusSlice(String providerId, String examId) {
        if (providerId != null && examId != null) {
            return loadExam(providerId, examId);
        }
        if (providerId != null) {
            return loadProvider(providerId);
        }
        return loadAll();
    }
    
    @Override
    public Optional<QuestionRecord> fetchQuestionById(String questionId) {
        if (questionId == null || !Files.isDirectory(questionsRoot())) {
            return Optional.empty();
        }
        return loadAll().stream()
            .filter(q -> questionId.equals(q.getQuestionId()))
            .findFirst();
    }
    
    private List<QuestionRecord> loadAll() {
        Path root = questionsRoot();
        if (!Files.isDirectory(root)) {
            throw new CorpusNotFoundException("Question storage not found: " + root);
        }
        List<QuestionRecord> questions = new ArrayList<>();
        for (String providerId : listChildDirectories(root)) {
            questions.addAll(loadProvider(providerId));
        }
        log.debug("[CORPUS] Loaded full corpus | questions={}", questions.size());
        return questions;
    }
    
    private List<QuestionRecord> loadProvider(String providerId) {
        Path providerDir = questionsRoot().resolve(requireSafeId(providerId));
        if (!Files.isDirectory(providerDir)) {
            throw new CorpusNotFoundException("No question data for provider: " + providerId);
        }
        List<QuestionRecord> questions = new ArrayList<>();
        for (String examId : listChildDirectories(providerDir)) {
            try {
                questions.addAll(loadExam(providerId, examId));
            } catch (CorpusNotFoundException e) {
                log.debug("[CORPUS] Skipping exam without question file | providerId={} | examId={}", providerId, examId);
            }
        }
        return questions;
    }
    
    private List<QuestionRecord> loadExam(String providerId, String examId) {
        Path file = questionsRoot()
            .resolve(requireSafeId(providerId))
            .resolve(requireSafeId(examId))
            .resolve(storageProperties.getQuestionFileName());
        
        if (!Files.isRegularFile(file)) {
            throw new CorpusNotFoundException("No question data for provider/exam: " + providerId + "/" + examId);
        }
        
        long startTime = System.currentTimeMillis();
        List<QuestionRecord> raw;
        try {
            raw = objectMapper.readValue(file.toFile(), QUESTION_LIST);
        } catch (IOException e) {
            log.error("[CORPUS] Failed to read question file | file={}", file, e);
            throw new RuntimeException("Failed to read question file: " + file, e);
        }
        
        List<QuestionRecord> valid = new ArrayList<>(raw.size());
        for (QuestionRecord question : raw) {
            if (question == null) {
                continue;
            }
            if (!isValid(question)) {
                log.warn("[CORPUS] Invalid question data | questionId={} | file={} | missingFields={}",
                    question.getQuestionId(), file, missingFields(question));
                continue;
            }
            valid.add(normalize(question, providerId, examId));
        }
        
        log.debug("[CORPUS] Loaded exam questions | providerId={} | examId={} | valid={} | skipped={} | durationMs={}",
            providerId, examId, valid.size(), raw.size() - valid.size(), System.currentTimeMillis() - startTime);
        return valid;
    }
    
    private boolean isValid(QuestionRecord question) {
        return missingFields(question).isEmpty();
    }
    
    private List<String> missingFields(QuestionRecord question) {
        Map<String, Boolean> missing = new LinkedHashMap<>();
        missing.put("questionId", question.getQuestionId() == null || question.getQuestionId().isBlank());
        missing.put("questionText", question.getQuestionText() == null || question.getQuestionText().isBlank());
        missing.put("options", question.getOptions() == null);
        return missing.entrySet().stream()
            .filter(Map.Entry::getValue)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }
    
    /**
     * Provider and exam come from the file path; missing type and difficulty get corpus defaults.
     */
    private QuestionRecord normalize(QuestionRecord question, String providerId, String examId) {
        return question.toBuilder()
            .providerId(providerId)
            .examId(examId)
            .type(question.getType() != null ? question.getType() : QuestionType.MULTIPLE_CHOICE)
            .difficulty(question.getDifficulty() != null ? question.getDifficulty() : DifficultyLevel.INTERMEDIATE.getLabel())
            .build();
    }
    
    private List<String> listChildDirectories(Path dir) {
        try (Stream<Path> children = Files.list(dir)) {
            return children
                .filter(Files::isDirectory)
                .map(path -> path.getFileName().toString())
                .filter(name -> SAFE_ID.matcher(name).matches())
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("[CORPUS] Failed to list directory | dir={}", dir, e);
            throw new RuntimeException("Failed to list question directory: " + dir, e);
        }
    }
    
    private String requireSafeId(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new CorpusNotFoundException("Invalid corpus identifier: " + id);
        }
        return id;
    }
    
    private Path questionsRoot() {
        return Paths.get(storageProperties.getDirectory()).resolve(storageProperties.getQuestionsFolder());
    }
}
