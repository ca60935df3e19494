package com.conveyal.volumes.processing;

import com.conveyal.volumes.VolumeProcessingException;
import com.conveyal.volumes.models.InputFileType;

import java.io.File;

/**
 * The fixed inputs of one invocation of the pipeline. Nothing here outlives the invocation.
 */
public class ProcessingRun {

    public final File amCsv;
    public final File pmCsv;
    public final File attoutTxt;

    /** Existing directory the outputs are written into. Creating it is the caller's job. */
    public final File outputDirectory;

    /** Free text, used only to derive output file names. */
    public final String runName;

    public ProcessingRun (File amCsv, File pmCsv, File attoutTxt, File outputDirectory, String runName) {
        this.amCsv = amCsv;
        this.pmCsv = pmCsv;
        this.attoutTxt = attoutTxt;
        this.outputDirectory = outputDirectory;
        this.runName = runName;
    }

    /** Fail before anything is read or written if an input cannot be opened or the output directory is missing. */
    void checkInputs () {
        checkReadable(amCsv, InputFileType.AM_CSV);
        checkReadable(pmCsv, InputFileType.PM_CSV);
        checkReadable(attoutTxt, InputFileType.ATTOUT_TXT);
        if (outputDirectory == null || !outputDirectory.isDirectory()) {
            throw VolumeProcessingException.inputNotFound(outputDirectory, "Output directory");
        }
    }

    private static void checkReadable (File file, InputFileType type) {
        if (file == null || !file.isFile() || !file.canRead()) {
            throw VolumeProcessingException.inputNotFound(file, type.label);
        }
    }

    @Override
    public String toString () {
        return String.format("ProcessingRun[%s: am=%s, pm=%s, attout=%s, output=%s]",
                runName, amCsv, pmCsv, attoutTxt, outputDirectory);
    }
}
