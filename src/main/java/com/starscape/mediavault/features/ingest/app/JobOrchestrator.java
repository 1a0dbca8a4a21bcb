package com.starscape.mediavault.features.ingest.app;

import com.starscape.mediavault.common.config.JobProperties;
import com.starscape.mediavault.features.ingest.domain.ImportJobStatus;
import com.starscape.mediavault.features.ingest.domain.ImportSourceType;
import com.starscape.mediavault.features.ingest.domain.JobKind;
import com.starscape.mediavault.features.ingest.domain.JobState;
import com.starscape.mediavault.features.ingest.domain.JobStatus;
import com.starscape.mediavault.features.ingest.domain.RegenerationJobStatus;
import com.starscape.mediavault.features.library.domain.LibraryRepository;
import com.starscape.mediavault.features.library.domain.MediaAsset;
import com.starscape.mediavault.features.library.domain.MergePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Runs imports and regenerations in the background, one job at a time.
 *
 * <p>A job is started by claiming a single slot with compare-and-set; a second
 * start while the slot is held fails with {@link JobAlreadyRunningException}
 * and changes nothing. Items are processed sequentially on the job executor.
 * Item failures are recorded in the status and never stop the run. Cancellation
 * is checked between items. Whatever happens inside the worker, the job ends
 * in a terminal state and the slot is released.
 *
 * <p>Status snapshots are immutable and published through atomic references,
 * so readers never block and never see a half-updated status.
 */
@Service
public class JobOrchestrator {
    
    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);
    
    private final ImportItemProcessor importProcessor;
    private final RegenerationItemProcessor regenerationProcessor;
    private final LibraryRepository library;
    private final Map<ImportSourceType, ImportSource> sources = new EnumMap<>(ImportSourceType.class);
    private final JobHistory history;
    private final List<JobStatusListener> listeners;
    private final Executor executor;
    private final Clock clock;
    private final int maxErrors;
    
    private final AtomicReference<ActiveJob> active = new AtomicReference<>();
    private final AtomicReference<ImportJobStatus> importStatus = new AtomicReference<>(ImportJobStatus.idle());
    private final AtomicReference<RegenerationJobStatus> regenerationStatus =
        new AtomicReference<>(RegenerationJobStatus.idle());
    private volatile JobKind lastKind;
    
    public JobOrchestrator(
            ImportItemProcessor importProcessor,
            RegenerationItemProcessor regenerationProcessor,
            LibraryRepository library,
            List<ImportSource> sources,
            JobHistory history,
            List<JobStatusListener> listeners,
            @Qualifier("mediaJobExecutor") Executor executor,
            JobProperties jobProperties,
            Clock clock) {
        this.importProcessor = importProcessor;
        this.regenerationProcessor = regenerationProcessor;
        this.library = library;
        for (ImportSource source : sources) {
            this.sources.put(source.type(), source);
        }
        this.history = history;
        this.listeners = List.copyOf(listeners);
        this.executor = executor;
        this.maxErrors = jobProperties.getMaxErrors();
        this.clock = clock;
    }
    
    /**
     * Start importing from the given source.
     * @throws JobAlreadyRunningException if any job is running
     * @throws SourceUnavailableException if the source is not configured or unreachable;
     *         the import status is then {@code failed}
     */
    public ImportJobStatus startImport(ImportSourceType type) {
        ActiveJob job = claim(JobKind.IMPORT);
        ImportJobStatus started = updateImport(s -> ImportJobStatus.started(type, now()));
        job.runId = recordStart(JobKind.IMPORT, started.startedAt());
        log.info("Import from {} started", type.value());
        
        ImportSource source = sources.get(type);
        try {
            if (source == null) {
                throw new SourceUnavailableException("The " + type.value() + " import source is not configured");
            }
            source.verify();
        } catch (SourceUnavailableException e) {
            log.warn("Import from {} cannot start: {}", type.value(), e.getMessage());
            finishImport(job, s -> s.withError("Import failed: " + e.getMessage(), maxErrors), JobState.FAILED);
            release(job);
            throw e;
        }
        
        submit(job, () -> runImport(job, source));
        return started;
    }
    
    /**
     * Start regenerating metadata and derived assets.
     * @param missingOnly only touch rows lacking a thumbnail or dimensions
     */
    public RegenerationJobStatus startRegeneration(boolean missingOnly) {
        return startRegenerationJob(missingOnly, false);
    }
    
    /**
     * Clear every row's metadata and derived assets, then run a full regeneration.
     * Identity fields are kept.
     */
    public RegenerationJobStatus resetLibrary() {
        return startRegenerationJob(false, true);
    }
    
    /**
     * Ask the running job to stop after its current item.
     * @return false if nothing is running
     */
    public boolean cancel() {
        ActiveJob job = active.get();
        if (job == null) {
            return false;
        }
        job.cancelRequested.set(true);
        // the job may have finished and a new one been claimed since it was read
        if (job.kind == JobKind.IMPORT) {
            updateImport(s -> active.get() == job && s.state() == JobState.RUNNING ? s.withCancelRequested() : s);
        } else {
            updateRegeneration(s -> active.get() == job && s.state() == JobState.RUNNING ? s.withCancelRequested() : s);
        }
        log.info("Cancellation requested for the running {} job", job.kind.value());
        return true;
    }
    
    public ImportJobStatus getImportStatus() {
        return importStatus.get();
    }
    
    public RegenerationJobStatus getRegenerationStatus() {
        return regenerationStatus.get();
    }
    
    /**
     * Status of the running job, or of the most recent one.
     */
    public JobStatus getStatus() {
        ActiveJob job = active.get();
        JobKind kind = job != null ? job.kind : lastKind;
        return kind == JobKind.REGENERATION ? regenerationStatus.get() : importStatus.get();
    }
    
    public boolean isRunning() {
        return active.get() != null;
    }
    
    private RegenerationJobStatus startRegenerationJob(boolean missingOnly, boolean reset) {
        ActiveJob job = claim(JobKind.REGENERATION);
        RegenerationJobStatus started = updateRegeneration(s -> RegenerationJobStatus.started(missingOnly, reset, now()));
        job.runId = recordStart(JobKind.REGENERATION, started.startedAt());
        log.info("Regeneration started (missingOnly={}, reset={})", missingOnly, reset);
        submit(job, () -> runRegeneration(job, missingOnly, reset));
        return started;
    }
    
    private ActiveJob claim(JobKind kind) {
        ActiveJob job = new ActiveJob(kind);
        if (!active.compareAndSet(null, job)) {
            ActiveJob running = active.get();
            throw new JobAlreadyRunningException(running != null ? running.kind : kind);
        }
        lastKind = kind;
        return job;
    }
    
    private void submit(ActiveJob job, Runnable work) {
        try {
            executor.execute(work);
        } catch (RejectedExecutionException e) {
            log.error("Job executor rejected the {} job", job.kind.value(), e);
            String error = "Job could not be scheduled: " + e.getMessage();
            if (job.kind == JobKind.IMPORT) {
                finishImport(job, s -> s.withError(error, maxErrors), JobState.FAILED);
            } else {
                finishRegeneration(job, s -> s.withError(error, maxErrors), JobState.FAILED);
            }
            release(job);
            throw new IllegalStateException(error, e);
        }
    }
    
    private void runImport(ActiveJob job, ImportSource source) {
        try {
            List<ImportCandidate> candidates = source.enumerate();
            updateImport(s -> s.withTotal(candidates.size()));
            log.info("Import found {} files", candidates.size());
            
            boolean cancelled = false;
            for (ImportCandidate candidate : candidates) {
                if (job.cancelRequested.get()) {
                    cancelled = true;
                    break;
                }
                ImportOutcome outcome = importSafely(candidate);
                switch (outcome.result()) {
                    case IMPORTED -> updateImport(ImportJobStatus::withImported);
                    case DUPLICATE -> updateImport(ImportJobStatus::withDuplicate);
                    case FAILED -> {
                        log.warn("Import item failed: {}", outcome.error());
                        updateImport(s -> s.withFailure(outcome.error(), maxErrors));
                    }
                }
            }
            
            ImportJobStatus current = importStatus.get();
            JobState finalState = terminalState(cancelled, current.processedFiles(), current.failedImports());
            ImportJobStatus finished = finishImport(job, UnaryOperator.identity(), finalState);
            log.info("Import {}: {} processed, {} imported, {} duplicates, {} failed",
                finished.state().value(), finished.processedFiles(), finished.successfulImports(),
                finished.skippedDuplicates(), finished.failedImports());
        } catch (RuntimeException e) {
            log.error("Import aborted", e);
            finishImport(job, s -> s.withError("Import failed: " + e.getMessage(), maxErrors), JobState.FAILED);
        } finally {
            if (!importStatus.get().state().isTerminal()) {
                finishImport(job, s -> s.withError("Import failed: worker stopped unexpectedly", maxErrors),
                    JobState.FAILED);
            }
            release(job);
        }
    }
    
    private void runRegeneration(ActiveJob job, boolean missingOnly, boolean reset) {
        try {
            if (reset) {
                clearLibrary(job);
            }
            MergePolicy policy = missingOnly ? MergePolicy.FILL_MISSING : MergePolicy.REPLACE;
            long total = missingOnly ? library.countMissingDerivedData() : library.countAll();
            updateRegeneration(s -> s.withTotal((int) Math.min(total, Integer.MAX_VALUE)));
            log.info("Regeneration will visit {} items", total);
            
            Iterable<MediaAsset> items = missingOnly ? library.listMissingDerivedData() : library.listAll();
            boolean cancelled = false;
            for (MediaAsset asset : items) {
                if (job.cancelRequested.get()) {
                    cancelled = true;
                    break;
                }
                RegenerationOutcome outcome = regenerateSafely(asset, policy);
                if (outcome.succeeded()) {
                    updateRegeneration(s -> s.withProcessed(
                        outcome.metadataUpdated(), outcome.thumbnailGenerated(), outcome.tagsLinked()));
                } else {
                    log.warn("Regeneration item failed: {}", outcome.error());
                    updateRegeneration(s -> s.withFailure(outcome.error(), maxErrors));
                }
            }
            
            RegenerationJobStatus current = regenerationStatus.get();
            JobState finalState = terminalState(cancelled, current.processedMedia(), current.failedMedia());
            RegenerationJobStatus finished = finishRegeneration(job, UnaryOperator.identity(), finalState);
            log.info("Regeneration {}: {} processed, {} metadata updates, {} thumbnails, {} tags, {} failed",
                finished.state().value(), finished.processedMedia(), finished.updatedMetadata(),
                finished.generatedThumbnails(), finished.updatedTags(), finished.failedMedia());
        } catch (RuntimeException e) {
            log.error("Regeneration aborted", e);
            finishRegeneration(job, s -> s.withError("Regeneration failed: " + e.getMessage(), maxErrors),
                JobState.FAILED);
        } finally {
            if (!regenerationStatus.get().state().isTerminal()) {
                finishRegeneration(job, s -> s.withError("Regeneration failed: worker stopped unexpectedly",
                    maxErrors), JobState.FAILED);
            }
            release(job);
        }
    }
    
    private void clearLibrary(ActiveJob job) {
        int cleared = 0;
        for (MediaAsset asset : library.listAll()) {
            if (job.cancelRequested.get()) {
                break;
            }
            try {
                regenerationProcessor.clearDerivedAssets(asset);
                cleared++;
            } catch (RuntimeException e) {
                log.warn("Could not reset media {}: {}", asset.getId(), e.getMessage());
                updateRegeneration(s -> s.withError(
                    "Failed to reset " + asset.getFilename() + ": " + e.getMessage(), maxErrors));
            }
        }
        log.info("Reset cleared derived data on {} items", cleared);
    }
    
    private ImportOutcome importSafely(ImportCandidate candidate) {
        try {
            return importProcessor.process(candidate);
        } catch (RuntimeException e) {
            log.error("Unexpected error importing {}", candidate.displayName(), e);
            return ImportOutcome.failed(ImportItemProcessor.failure(candidate.displayName(), String.valueOf(e.getMessage())));
        }
    }
    
    private RegenerationOutcome regenerateSafely(MediaAsset asset, MergePolicy policy) {
        try {
            return regenerationProcessor.process(asset, policy);
        } catch (RuntimeException e) {
            log.error("Unexpected error regenerating media {}", asset.getId(), e);
            return RegenerationOutcome.failed(ImportItemProcessor.failure(asset.getFilename(), String.valueOf(e.getMessage())));
        }
    }
    
    /**
     * Cancelled wins; otherwise a run fails only when it processed items and every one failed.
     */
    static JobState terminalState(boolean cancelled, int processed, int failed) {
        if (cancelled) {
            return JobState.CANCELLED;
        }
        if (processed > 0 && failed == processed) {
            return JobState.FAILED;
        }
        return JobState.COMPLETED;
    }
    
    private ImportJobStatus finishImport(ActiveJob job, UnaryOperator<ImportJobStatus> change, JobState state) {
        ImportJobStatus finished = updateImport(s -> change.apply(s).finish(state, now()));
        recordFinish(job, finished);
        return finished;
    }
    
    private RegenerationJobStatus finishRegeneration(ActiveJob job, UnaryOperator<RegenerationJobStatus> change,
                                                     JobState state) {
        RegenerationJobStatus finished = updateRegeneration(s -> change.apply(s).finish(state, now()));
        recordFinish(job, finished);
        return finished;
    }
    
    private void release(ActiveJob job) {
        active.compareAndSet(job, null);
    }
    
    private ImportJobStatus updateImport(UnaryOperator<ImportJobStatus> change) {
        ImportJobStatus updated = importStatus.updateAndGet(change);
        notifyListeners(updated);
        return updated;
    }
    
    private RegenerationJobStatus updateRegeneration(UnaryOperator<RegenerationJobStatus> change) {
        RegenerationJobStatus updated = regenerationStatus.updateAndGet(change);
        notifyListeners(updated);
        return updated;
    }
    
    private void notifyListeners(JobStatus status) {
        for (JobStatusListener listener : listeners) {
            try {
                listener.onStatus(status);
            } catch (RuntimeException e) {
                log.warn("Status listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
    
    private String recordStart(JobKind kind, Instant startedAt) {
        try {
            return history.recordStart(kind, startedAt);
        } catch (RuntimeException e) {
            log.warn("Could not record the start of the {} job: {}", kind.value(), e.getMessage());
            return null;
        }
    }
    
    private void recordFinish(ActiveJob job, JobStatus finished) {
        if (job.runId == null) {
            return;
        }
        try {
            history.recordFinish(job.runId, finished);
        } catch (RuntimeException e) {
            log.warn("Could not record the end of run {}: {}", job.runId, e.getMessage());
        }
    }
    
    private Instant now() {
        return clock.instant();
    }
    
    private static final class ActiveJob {
        
        private final JobKind kind;
        private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
        private volatile String runId;
        
        private ActiveJob(JobKind kind) {
            this.kind = kind;
        }
    }
}
