package com.starscape.mediavault.features.ingest.api;

import com.starscape.mediavault.features.ingest.api.dto.JobRunItem;
import com.starscape.mediavault.features.ingest.app.JobOrchestrator;
import com.starscape.mediavault.features.ingest.app.ListJobHistoryHandler;
import com.starscape.mediavault.features.ingest.domain.ImportJobStatus;
import com.starscape.mediavault.features.ingest.domain.JobStatus;
import com.starscape.mediavault.features.ingest.domain.RegenerationJobStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/queries")
public class JobQueryController {
    
    private final JobOrchestrator orchestrator;
    private final ListJobHistoryHandler listJobHistoryHandler;
    
    public JobQueryController(JobOrchestrator orchestrator, ListJobHistoryHandler listJobHistoryHandler) {
        this.orchestrator = orchestrator;
        this.listJobHistoryHandler = listJobHistoryHandler;
    }
    
    @GetMapping("/imports/status")
    public ResponseEntity<ImportJobStatus> importStatus() {
        return ResponseEntity.ok(orchestrator.getImportStatus());
    }
    
    @GetMapping("/regenerations/status")
    public ResponseEntity<RegenerationJobStatus> regenerationStatus() {
        return ResponseEntity.ok(orchestrator.getRegenerationStatus());
    }
    
    @GetMapping("/jobs/current")
    public ResponseEntity<JobStatus> currentJob() {
        return ResponseEntity.ok(orchestrator.getStatus());
    }
    
    @GetMapping("/jobs/history")
    public ResponseEntity<List<JobRunItem>> history(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(listJobHistoryHandler.handle(limit));
    }
}
