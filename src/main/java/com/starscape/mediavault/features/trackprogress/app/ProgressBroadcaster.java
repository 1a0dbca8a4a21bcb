package com.starscape.mediavault.features.trackprogress.app;

import com.starscape.mediavault.features.ingest.app.JobStatusListener;
import com.starscape.mediavault.features.ingest.domain.JobKind;
import com.starscape.mediavault.features.ingest.domain.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Service for broadcasting job status snapshots via WebSocket.
 * Import and regeneration updates go to separate topics.
 */
@Service
public class ProgressBroadcaster implements JobStatusListener {
    
    static final String IMPORT_TOPIC = "/topic/jobs/import";
    static final String REGENERATION_TOPIC = "/topic/jobs/regeneration";
    
    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);
    
    private final SimpMessagingTemplate messagingTemplate;
    
    public ProgressBroadcaster(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }
    
    @Override
    public void onStatus(JobStatus status) {
        String destination = status.kind() == JobKind.IMPORT ? IMPORT_TOPIC : REGENERATION_TOPIC;
        messagingTemplate.convertAndSend(destination, status);
        log.debug("Broadcasted job status to {}: state={}, processed={}/{}",
            destination, status.state().value(), status.processedItems(), status.totalItems());
    }
}
