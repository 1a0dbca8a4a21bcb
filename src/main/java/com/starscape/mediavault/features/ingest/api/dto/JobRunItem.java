package com.starscape.mediavault.features.ingest.api.dto;

import com.starscape.mediavault.features.ingest.domain.JobKind;
import com.starscape.mediavault.features.ingest.domain.JobState;

import java.time.Instant;

public record JobRunItem(
    String runId,
    JobKind kind,
    JobState status,
    int totalItems,
    int processedItems,
    int succeededItems,
    int failedItems,
    Instant startedAt,
    Instant completedAt
) {}
