package com.lumen.grading.service;

import com.lumen.grading.model.enums.GradeSource;

/**
 * Published whenever a grade is created or changes value.
 */
public record GradeReadyEvent(
        Long gradeId,
        Long submissionId,
        Long studentId,
        double score,
        GradeSource source,
        boolean firstRevision
) {}
