package com.ai.studyassistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AI Study Assistant Application
 * Main entry point for the course knowledge Q&amp;A service.
 */
@SpringBootApplication
public class StudyAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudyAssistantApplication.class, args);
    }
}
