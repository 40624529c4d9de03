package com.lumen.grading.model.dto;

import java.time.LocalDateTime;

import com.lumen.grading.model.domain.SyncJob;
import com.lumen.grading.model.enums.SyncState;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a sync job.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncJobDTO {

    private Long id;
    private Long gradeId;
    private Long integrationId;
    private SyncState state;
    private Double score;
    private int attemptCount;
    private String lastErrorClass;
    private String lastError;
    private LocalDateTime lastAttemptedAt;
    private LocalDateTime nextAttemptAt;

    public static SyncJobDTO fromEntity(SyncJob job) {
        return SyncJobDTO.builder()
                .id(job.getId())
                .gradeId(job.getGradeId())
                .integrationId(job.getIntegrationId())
                .state(job.getState())
                .score(job.getScore())
                .attemptCount(job.getAttemptCount())
                .lastErrorClass(job.getLastErrorClass())
                .lastError(job.getLastError())
                .lastAttemptedAt(job.getLastAttemptedAt())
                .nextAttemptAt(job.getNextAttemptAt())
                .build();
    }
}
