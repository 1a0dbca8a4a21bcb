package com.starscape.mediavault.features.ingest.app;

import com.starscape.mediavault.features.ingest.domain.JobKind;

/**
 * A job start was requested while another job holds the claim. Nothing was started.
 */
public class JobAlreadyRunningException extends IllegalStateException {
    
    private final JobKind runningKind;
    
    public JobAlreadyRunningException(JobKind runningKind) {
        super("A " + runningKind.value() + " job is already running");
        this.runningKind = runningKind;
    }
    
    public JobKind getRunningKind() {
        return runningKind;
    }
}
