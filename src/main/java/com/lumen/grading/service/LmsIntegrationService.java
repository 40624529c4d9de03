package com.lumen.grading.service;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.lumen.grading.adapter.LmsConnector;
import com.lumen.grading.adapter.LmsConnector.ConnectionTestResult;
import com.lumen.grading.model.domain.LmsIntegration;
import com.lumen.grading.model.domain.LmsStudentMapping;
import com.lumen.grading.model.enums.LmsType;
import com.lumen.grading.repository.LmsIntegrationRepository;
import com.lumen.grading.repository.LmsStudentMappingRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Administration of LMS integrations and student mappings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LmsIntegrationService {

    private final LmsIntegrationRepository integrationRepository;
    private final LmsStudentMappingRepository mappingRepository;
    private final Map<LmsType, LmsConnector> lmsConnectors;
    private final CredentialCipher credentialCipher;

    public LmsIntegration create(LmsType lmsType, String connectionName, Long courseId,
                                 String externalCourseId, String apiBaseUrl, String apiKey) {
        if (integrationRepository.existsByConnectionName(connectionName)) {
            throw new IllegalArgumentException("Connection name already exists: " + connectionName);
        }

        LmsIntegration integration = integrationRepository.save(LmsIntegration.builder()
                .lmsType(lmsType)
                .connectionName(connectionName)
                .courseId(courseId)
                .externalCourseId(externalCourseId)
                .apiBaseUrl(apiBaseUrl)
                .encryptedApiKey(credentialCipher.encrypt(apiKey))
                .build());

        log.info("Created {} integration '{}' for course {}", lmsType.getDisplayName(), connectionName, courseId);
        return integration;
    }

    public LmsIntegration get(Long integrationId) {
        return integrationRepository.findById(integrationId)
                .orElseThrow(() -> new IllegalArgumentException("Integration not found: " + integrationId));
    }

    public List<LmsIntegration> listForCourse(Long courseId) {
        return integrationRepository.findByCourseId(courseId);
    }

    public LmsIntegration setSyncEnabled(Long integrationId, boolean enabled) {
        LmsIntegration integration = get(integrationId);
        integration.setSyncEnabled(enabled);
        log.info("Sync {} for integration '{}'", enabled ? "enabled" : "disabled", integration.getConnectionName());
        return integrationRepository.save(integration);
    }

    public LmsIntegration deactivate(Long integrationId) {
        LmsIntegration integration = get(integrationId);
        integration.setActive(false);
        log.info("Deactivated integration '{}'", integration.getConnectionName());
        return integrationRepository.save(integration);
    }

    public ConnectionTestResult testConnection(Long integrationId) {
        LmsIntegration integration = get(integrationId);
        LmsConnector connector = lmsConnectors.get(integration.getLmsType());
        if (connector == null) {
            return ConnectionTestResult.failure("No connector for " + integration.getLmsType());
        }
        return connector.testConnection(integration);
    }

    /**
     * Map a student to their LMS account, replacing any earlier mapping.
     */
    public LmsStudentMapping mapStudent(Long integrationId, Long studentId, String externalStudentId) {
        get(integrationId);

        LmsStudentMapping mapping = mappingRepository.findByIntegrationIdAndStudentId(integrationId, studentId)
                .orElseGet(() -> LmsStudentMapping.builder()
                        .integrationId(integrationId)
                        .studentId(studentId)
                        .build());
        mapping.setExternalStudentId(externalStudentId);
        return mappingRepository.save(mapping);
    }

    public List<LmsStudentMapping> listMappings(Long integrationId) {
        return mappingRepository.findByIntegrationId(integrationId);
    }
}
