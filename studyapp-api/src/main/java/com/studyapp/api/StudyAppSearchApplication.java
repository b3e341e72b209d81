package com.studyapp.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.studyapp")
public class StudyAppSearchApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(StudyAppSearchApplication.class, args);
    }
}
