package com.starscape.mediavault.features.ingest.app;

import com.starscape.mediavault.common.config.JobProperties;
import com.starscape.mediavault.features.ingest.api.dto.JobRunItem;
import com.starscape.mediavault.features.ingest.domain.JobRunRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Handler for listing recent job runs, newest first.
 */
@Service
public class ListJobHistoryHandler {
    
    private final JobRunRepository jobRunRepository;
    private final int maxLimit;
    
    public ListJobHistoryHandler(JobRunRepository jobRunRepository, JobProperties jobProperties) {
        this.jobRunRepository = jobRunRepository;
        this.maxLimit = jobProperties.getHistoryLimit();
    }
    
    @Transactional(readOnly = true)
    public List<JobRunItem> handle(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be at least 1");
        }
        return jobRunRepository.findAllByOrderByStartedAtDesc(PageRequest.of(0, Math.min(limit, maxLimit)))
                .stream()
                .map(run -> new JobRunItem(
                    run.getRunId(),
                    run.getKind(),
                    run.getStatus(),
                    run.getTotalItems(),
                    run.getProcessedItems(),
                    run.getSucceededItems(),
                    run.getFailedItems(),
                    run.getStartedAt(),
                    run.getCompletedAt()
                ))
                .toList();
    }
}
