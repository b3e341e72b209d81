package com.studyapp.data.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "corpus.storage")
@Getter
@Setter
public class CorpusStorageProperties {
    private String directory = "./data"; // Root holding questions/<provider>/<exam>/questions.json
    private String questionsFolder = "questions";
    private String questionFileName = "questions.json";
}
