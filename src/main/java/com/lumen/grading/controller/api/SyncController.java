package com.lumen.grading.controller.api;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.lumen.grading.model.dto.SyncJobDTO;
import com.lumen.grading.model.enums.SyncState;
import com.lumen.grading.repository.SyncJobRepository;
import com.lumen.grading.service.SyncDispatcher;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for LMS sync jobs.
 */
@RestController
@RequestMapping("/api/v1/grading/sync-jobs")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Sync Jobs", description = "Inspect and re-trigger grade deliveries to LMS integrations")
public class SyncController {

    private final SyncJobRepository syncJobRepository;
    private final SyncDispatcher syncDispatcher;

    @GetMapping
    @Operation(summary = "List sync jobs by state", description = "Defaults to FAILED jobs")
    @ApiResponse(responseCode = "200", description = "Jobs returned")
    public ResponseEntity<List<SyncJobDTO>> listByState(@RequestParam(defaultValue = "FAILED") SyncState state) {
        return ResponseEntity.ok(syncJobRepository.findByStateOrderByUpdatedAtDesc(state).stream()
                .map(SyncJobDTO::fromEntity)
                .toList());
    }

    @PostMapping("/{id}/retry")
    @Operation(summary = "Retry a sync job", description = "Send the current grade again to the job's integration")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "New job attempted"),
        @ApiResponse(responseCode = "404", description = "Sync job not found"),
        @ApiResponse(responseCode = "409", description = "Job is not FAILED or DISABLED")
    })
    public ResponseEntity<SyncJobDTO> retry(@PathVariable Long id) {
        log.info("Manual sync retry requested for job {}", id);
        return ResponseEntity.ok(SyncJobDTO.fromEntity(syncDispatcher.retrySyncJob(id)));
    }
}
