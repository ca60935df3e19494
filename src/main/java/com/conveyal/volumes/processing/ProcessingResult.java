package com.conveyal.volumes.processing;

import java.io.File;

/**
 * What a successful run hands back: absolute paths of both outputs, and the warnings gathered along the way.
 */
public class ProcessingResult {

    public final File mergedCsv;

    public final File attinTxt;

    public final int mergedRows;

    public final int attinRows;

    public final RunWarnings warnings;

    public ProcessingResult (File mergedCsv, File attinTxt, int mergedRows, int attinRows, RunWarnings warnings) {
        this.mergedCsv = mergedCsv.getAbsoluteFile();
        this.attinTxt = attinTxt.getAbsoluteFile();
        this.mergedRows = mergedRows;
        this.attinRows = attinRows;
        this.warnings = warnings;
    }
}
