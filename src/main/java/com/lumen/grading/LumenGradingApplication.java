package com.lumen.grading;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.lumen.grading.config.GradingProperties;

/**
 * Lumen Grading Pipeline
 *
 * Takes a student's typed or handwritten work through text extraction, AI
 * evaluation and grade reconciliation, then pushes the final grade to the
 * LMS integrations configured for the course.
 */
@SpringBootApplication
@EnableConfigurationProperties(GradingProperties.class)
@EnableAsync
@EnableScheduling
public class LumenGradingApplication {

    public static void main(String[] args) {
        SpringApplication.run(LumenGradingApplication.class, args);
    }
}
