package com.starscape.mediavault.features.trackprogress.app;

import com.starscape.mediavault.features.ingest.domain.ImportJobStatus;
import com.starscape.mediavault.features.ingest.domain.ImportSourceType;
import com.starscape.mediavault.features.ingest.domain.RegenerationJobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Instant;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ProgressBroadcasterTest {
    
    private SimpMessagingTemplate messagingTemplate;
    private ProgressBroadcaster broadcaster;
    
    @BeforeEach
    void setUp() {
        messagingTemplate = mock(SimpMessagingTemplate.class);
        broadcaster = new ProgressBroadcaster(messagingTemplate);
    }
    
    @Test
    void importStatusGoesToImportTopic() {
        ImportJobStatus status = ImportJobStatus.started(ImportSourceType.LOCAL, Instant.now()).withTotal(3);
        
        broadcaster.onStatus(status);
        
        verify(messagingTemplate).convertAndSend(ProgressBroadcaster.IMPORT_TOPIC, status);
    }
    
    @Test
    void regenerationStatusGoesToRegenerationTopic() {
        RegenerationJobStatus status = RegenerationJobStatus.started(false, true, Instant.now());
        
        broadcaster.onStatus(status);
        
        verify(messagingTemplate).convertAndSend(ProgressBroadcaster.REGENERATION_TOPIC, status);
    }
}
