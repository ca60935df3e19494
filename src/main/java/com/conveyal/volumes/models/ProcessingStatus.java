package com.conveyal.volumes.models;

import com.conveyal.volumes.processing.ProcessingResult;
import com.google.common.base.Preconditions;

import java.io.File;
import java.util.Date;
import java.util.EnumSet;
import java.util.UUID;

/**
 * Tracks one processing run on behalf of a caller, so it can report whether the run is in progress, finished, or
 * failed and where the outputs are. Serialized as JSON in the command line report.
 */
public class ProcessingStatus {

    public static final int MAX_MESSAGE_LENGTH = 253;

    private static final EnumSet<Status> STARTABLE = EnumSet.of(Status.READY_TO_PROCESS, Status.ERROR, Status.COMPLETE);

    public final String id;
    public final String runName;
    public Status status = Status.READY_TO_PROCESS;
    public String message;
    public File mergedCsv;
    public File attinTxt;
    public Date createdAt;
    public Date startedAt;
    public Date completedAt;

    public enum Status {
        READY_TO_PROCESS, PROCESSING, COMPLETE, ERROR;
    }

    public ProcessingStatus (String runName) {
        this.id = UUID.randomUUID().toString();
        this.runName = runName;
        this.createdAt = new Date();
    }

    /** Move to PROCESSING, clearing the outputs of any previous run. */
    public synchronized void start () {
        Preconditions.checkState(STARTABLE.contains(status),
                "Run %s is not ready for processing. Current status: %s. Must be one of %s.", runName, status, STARTABLE);
        status = Status.PROCESSING;
        message = "Processing started...";
        mergedCsv = null;
        attinTxt = null;
        startedAt = new Date();
        completedAt = null;
    }

    public synchronized void complete (ProcessingResult result) {
        status = Status.COMPLETE;
        mergedCsv = result.mergedCsv;
        attinTxt = result.attinTxt;
        message = result.warnings.isEmpty()
                ? "Processing completed successfully."
                : truncate("Processing completed with warnings: " + result.warnings.summary());
        completedAt = new Date();
    }

    public synchronized void fail (Exception e) {
        status = Status.ERROR;
        mergedCsv = null;
        attinTxt = null;
        message = truncate("Processing failed: " + e.getMessage());
        completedAt = new Date();
    }

    static String truncate (String message) {
        if (message.length() <= MAX_MESSAGE_LENGTH) return message;
        return message.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
    }
}
