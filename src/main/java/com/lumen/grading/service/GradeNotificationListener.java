package com.lumen.grading.service;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Tells students their work has been graded.
 */
@Component
@Slf4j
public class GradeNotificationListener {

    @EventListener
    public void onGradeReady(GradeReadyEvent event) {
        if (event.firstRevision()) {
            log.info("NOTIFY: Student {}: your submission {} has been graded ({})",
                    event.studentId(), event.submissionId(), event.score());
        } else {
            log.info("NOTIFY: Student {}: the grade of submission {} was updated to {} ({})",
                    event.studentId(), event.submissionId(), event.score(), event.source());
        }
    }
}
