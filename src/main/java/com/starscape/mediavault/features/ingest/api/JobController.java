package com.starscape.mediavault.features.ingest.api;

import com.starscape.mediavault.features.ingest.api.dto.JobTriggerResponse;
import com.starscape.mediavault.features.ingest.api.dto.RegenerateRequest;
import com.starscape.mediavault.features.ingest.app.JobOrchestrator;
import com.starscape.mediavault.features.ingest.domain.ImportSourceType;
import com.starscape.mediavault.features.ingest.domain.JobState;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Commands that start and cancel background jobs. A start while another job is
 * running answers 409 through the global exception handler.
 */
@RestController
@RequestMapping("/commands")
public class JobController {
    
    private final JobOrchestrator orchestrator;
    
    public JobController(JobOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }
    
    @PostMapping("/imports/local")
    public ResponseEntity<JobTriggerResponse> importLocal() {
        orchestrator.startImport(ImportSourceType.LOCAL);
        return accepted("Local import started");
    }
    
    @PostMapping("/imports/webdav")
    public ResponseEntity<JobTriggerResponse> importWebDav() {
        orchestrator.startImport(ImportSourceType.WEBDAV);
        return accepted("WebDAV import started");
    }
    
    @PostMapping("/regenerations")
    public ResponseEntity<JobTriggerResponse> regenerate(@RequestBody(required = false) RegenerateRequest request) {
        boolean missingOnly = request == null || request.isMissingOnly();
        orchestrator.startRegeneration(missingOnly);
        return accepted(missingOnly ? "Regeneration of missing data started" : "Full regeneration started");
    }
    
    @PostMapping("/regenerations/reset")
    public ResponseEntity<JobTriggerResponse> reset() {
        orchestrator.resetLibrary();
        return accepted("Library reset started");
    }
    
    @PostMapping("/jobs/cancel")
    public ResponseEntity<JobTriggerResponse> cancel() {
        if (orchestrator.cancel()) {
            return ResponseEntity.ok(new JobTriggerResponse("Cancellation requested", "cancelling"));
        }
        return ResponseEntity.ok(new JobTriggerResponse("No job to cancel", JobState.IDLE.value()));
    }
    
    private static ResponseEntity<JobTriggerResponse> accepted(String message) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new JobTriggerResponse(message, JobState.RUNNING.value()));
    }
}
