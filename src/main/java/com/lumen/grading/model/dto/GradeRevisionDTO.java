package com.lumen.grading.model.dto;

import java.time.LocalDateTime;

import com.lumen.grading.model.domain.GradeRevision;
import com.lumen.grading.model.enums.GradeSource;

/**
 * One entry of a grade's history.
 */
public record GradeRevisionDTO(
        int revisionNumber,
        Double score,
        GradeSource source,
        Long instructorId,
        LocalDateTime createdAt
) {
    public static GradeRevisionDTO fromEntity(GradeRevision revision) {
        return new GradeRevisionDTO(revision.getRevisionNumber(), revision.getScore(), revision.getSource(),
                revision.getInstructorId(), revision.getCreatedAt());
    }
}
