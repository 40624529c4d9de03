package com.lumen.grading.controller.api;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.lumen.grading.adapter.LmsConnector.ConnectionTestResult;
import com.lumen.grading.model.domain.LmsStudentMapping;
import com.lumen.grading.model.dto.LmsIntegrationDTO;
import com.lumen.grading.model.enums.LmsType;
import com.lumen.grading.service.LmsIntegrationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for managing LMS integrations.
 */
@RestController
@RequestMapping("/api/v1/grading/integrations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "LMS Integrations", description = "Configure where grades are pushed")
public class LmsIntegrationController {

    private final LmsIntegrationService integrationService;

    @GetMapping
    @Operation(summary = "List integrations of a course")
    @ApiResponse(responseCode = "200", description = "Integrations returned")
    public ResponseEntity<List<LmsIntegrationDTO>> listForCourse(@RequestParam Long courseId) {
        return ResponseEntity.ok(integrationService.listForCourse(courseId).stream()
                .map(LmsIntegrationDTO::fromEntity)
                .toList());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get integration details")
    public ResponseEntity<LmsIntegrationDTO> get(@PathVariable Long id) {
        return ResponseEntity.ok(LmsIntegrationDTO.fromEntity(integrationService.get(id)));
    }

    @PostMapping
    @Operation(summary = "Create integration", description = "Register an LMS connection for a course; the API key is stored encrypted")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Integration created"),
        @ApiResponse(responseCode = "400", description = "Invalid request or duplicate name")
    })
    public ResponseEntity<LmsIntegrationDTO> create(@Valid @RequestBody CreateIntegrationRequest request) {
        log.info("Creating {} integration: {}", request.lmsType(), request.connectionName());

        return ResponseEntity.status(HttpStatus.CREATED).body(LmsIntegrationDTO.fromEntity(
                integrationService.create(request.lmsType(), request.connectionName(), request.courseId(),
                        request.externalCourseId(), request.apiBaseUrl(), request.apiKey())));
    }

    @PutMapping("/{id}/sync")
    @Operation(summary = "Enable or disable grade sync")
    public ResponseEntity<LmsIntegrationDTO> setSyncEnabled(@PathVariable Long id, @RequestParam boolean enabled) {
        return ResponseEntity.ok(LmsIntegrationDTO.fromEntity(integrationService.setSyncEnabled(id, enabled)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Deactivate integration", description = "Pending sync jobs of this integration end up DISABLED")
    public ResponseEntity<LmsIntegrationDTO> deactivate(@PathVariable Long id) {
        return ResponseEntity.ok(LmsIntegrationDTO.fromEntity(integrationService.deactivate(id)));
    }

    @PostMapping("/{id}/test")
    @Operation(summary = "Test connection", description = "Call the LMS with the stored credentials")
    public ResponseEntity<ConnectionTestResult> testConnection(@PathVariable Long id) {
        return ResponseEntity.ok(integrationService.testConnection(id));
    }

    @GetMapping("/{id}/students")
    @Operation(summary = "List student mappings")
    public ResponseEntity<List<LmsStudentMapping>> listMappings(@PathVariable Long id) {
        return ResponseEntity.ok(integrationService.listMappings(id));
    }

    @PutMapping("/{id}/students/{studentId}")
    @Operation(summary = "Map a student", description = "Link a student to their account on the LMS")
    public ResponseEntity<LmsStudentMapping> mapStudent(
            @PathVariable Long id,
            @PathVariable Long studentId,
            @Valid @RequestBody StudentMappingRequest request) {
        return ResponseEntity.ok(integrationService.mapStudent(id, studentId, request.externalStudentId()));
    }

    // ========================================================================
    // REQUEST TYPES
    // ========================================================================

    public record CreateIntegrationRequest(
            @NotNull LmsType lmsType,
            @NotBlank String connectionName,
            @NotNull Long courseId,
            @NotBlank String externalCourseId,
            String apiBaseUrl,
            String apiKey
    ) {}

    public record StudentMappingRequest(
            @NotBlank String externalStudentId
    ) {}
}
