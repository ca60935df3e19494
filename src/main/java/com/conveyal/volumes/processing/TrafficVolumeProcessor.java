package com.conveyal.volumes.processing;

import com.conveyal.volumes.VolumeProcessingException;
import com.conveyal.volumes.models.GeometryFile;
import com.conveyal.volumes.models.MergedVolumeTable;
import com.conveyal.volumes.models.Period;
import com.conveyal.volumes.models.ProcessingStatus;
import com.conveyal.volumes.models.VolumeTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Runs the whole transformation for one run: load the AM and PM count exports, merge them, parse the ATTOUT
 * geometry, and write the merged CSV and ATTIN file.
 *
 * A processor holds no state between runs, so one instance may serve concurrent runs as long as each run has its
 * own output directory or run name.
 */
public class TrafficVolumeProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(TrafficVolumeProcessor.class);

    private final VolumeTableLoader volumeTableLoader;
    private final VolumeMerger volumeMerger;
    private final GeometryParser geometryParser;
    private final OutputAssembler outputAssembler;

    public TrafficVolumeProcessor () {
        this(new VolumeTableLoader(), new VolumeMerger(), new GeometryParser(), new OutputAssembler());
    }

    public TrafficVolumeProcessor (VolumeTableLoader volumeTableLoader, VolumeMerger volumeMerger,
                                   GeometryParser geometryParser, OutputAssembler outputAssembler) {
        this.volumeTableLoader = volumeTableLoader;
        this.volumeMerger = volumeMerger;
        this.geometryParser = geometryParser;
        this.outputAssembler = outputAssembler;
    }

    /**
     * @return absolute paths of both outputs and any warnings.
     * @throws VolumeProcessingException if the run fails for any reason. No output is left behind in that case.
     */
    public ProcessingResult process (ProcessingRun run) {
        LOG.info("Starting processing for run: {}", run.runName);
        LOG.info("AM path: {}", run.amCsv);
        LOG.info("PM path: {}", run.pmCsv);
        LOG.info("ATTOUT path: {}", run.attoutTxt);
        LOG.info("Output dir: {}", run.outputDirectory);

        RunWarnings warnings = new RunWarnings();
        try {
            run.checkInputs();
            VolumeTable am = volumeTableLoader.load(run.amCsv, Period.AM, warnings);
            VolumeTable pm = volumeTableLoader.load(run.pmCsv, Period.PM, warnings);
            MergedVolumeTable merged = volumeMerger.merge(am, pm);
            GeometryFile geometry = geometryParser.parse(run.attoutTxt, warnings);
            List<String> attinLines = outputAssembler.assembleAttinLines(merged, geometry, warnings);
            ProcessingResult result = outputAssembler.write(
                    merged, geometry, attinLines, run.outputDirectory, run.runName, warnings);
            LOG.info("Processing complete for run: {}", run.runName);
            return result;
        } catch (VolumeProcessingException e) {
            LOG.error("Processing failed for run {} ({}): {}", run.runName, e.type, e.getMessage());
            throw e;
        } catch (IOException | RuntimeException e) {
            LOG.error("Unexpected error processing run {}", run.runName, e);
            throw VolumeProcessingException.unexpected(run.runName, e);
        }
    }

    /** As {@link #process(ProcessingRun)}, recording the run's progress and outcome on the given status. */
    public ProcessingResult process (ProcessingRun run, ProcessingStatus status) {
        status.start();
        try {
            ProcessingResult result = process(run);
            status.complete(result);
            return result;
        } catch (VolumeProcessingException e) {
            status.fail(e);
            throw e;
        }
    }
}
