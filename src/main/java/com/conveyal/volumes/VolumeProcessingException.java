package com.conveyal.volumes;

import java.io.File;

/**
 * The single failure signal surfaced by a processing run. Every fatal condition aborts the run and is reported
 * through one of these; non-fatal anomalies are accumulated as warnings instead.
 */
public class VolumeProcessingException extends RuntimeException {

    public final TYPE type;

    /** The input or output file the failure relates to, if any. */
    public final File file;

    public enum TYPE {
        INPUT_NOT_FOUND,
        FORMAT,
        // Value coercion failures degrade to "no value" and are never thrown by the pipeline.
        DATA,
        UNEXPECTED;
    }

    public static VolumeProcessingException inputNotFound (File file, String description) {
        return new VolumeProcessingException(TYPE.INPUT_NOT_FOUND,
                String.format("%s file not found: %s", description, file), file, null);
    }

    public static VolumeProcessingException format (File file, String message) {
        return new VolumeProcessingException(TYPE.FORMAT, message, file, null);
    }

    public static VolumeProcessingException unexpected (String runName, Exception cause) {
        return new VolumeProcessingException(TYPE.UNEXPECTED,
                String.format("Unexpected error processing run '%s': %s", runName, cause.getMessage()), null, cause);
    }

    public static VolumeProcessingException unexpected (String runName, String message) {
        return new VolumeProcessingException(TYPE.UNEXPECTED,
                String.format("Unexpected error processing run '%s': %s", runName, message), null, null);
    }

    public VolumeProcessingException (TYPE type, String message, File file, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.file = file;
    }

}
