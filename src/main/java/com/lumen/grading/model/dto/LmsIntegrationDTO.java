package com.lumen.grading.model.dto;

import java.time.LocalDateTime;

import com.lumen.grading.model.domain.LmsIntegration;
import com.lumen.grading.model.enums.LmsType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for an LMS integration. Never exposes the API key.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LmsIntegrationDTO {

    private Long id;
    private LmsType lmsType;
    private String lmsDisplayName;
    private String connectionName;
    private Long courseId;
    private String externalCourseId;
    private String apiBaseUrl;
    private boolean hasApiKey;
    private Boolean active;
    private Boolean syncEnabled;
    private LocalDateTime createdAt;

    public static LmsIntegrationDTO fromEntity(LmsIntegration integration) {
        return LmsIntegrationDTO.builder()
                .id(integration.getId())
                .lmsType(integration.getLmsType())
                .lmsDisplayName(integration.getLmsType().getDisplayName())
                .connectionName(integration.getConnectionName())
                .courseId(integration.getCourseId())
                .externalCourseId(integration.getExternalCourseId())
                .apiBaseUrl(integration.resolveBaseUrl())
                .hasApiKey(integration.getEncryptedApiKey() != null)
                .active(integration.getActive())
                .syncEnabled(integration.getSyncEnabled())
                .createdAt(integration.getCreatedAt())
                .build();
    }
}
