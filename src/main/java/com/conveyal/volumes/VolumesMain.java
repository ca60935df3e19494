package com.conveyal.volumes;

import com.conveyal.volumes.models.InputFileType;
import com.conveyal.volumes.models.ProcessingStatus;
import com.conveyal.volumes.processing.ProcessingResult;
import com.conveyal.volumes.processing.ProcessingRun;
import com.conveyal.volumes.processing.TrafficVolumeProcessor;
import com.conveyal.volumes.util.JsonUtil;
import com.conveyal.volumes.util.SecureFilename;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command line entry point: processes one run into its own folder under the configured output directory.
 *
 * Usage: VolumesMain am.csv pm.csv attout.txt "run name"
 * The properties file is volumes.properties in the working directory unless -Dvolumes.config names another.
 */
public class VolumesMain {

    private static final Logger LOG = LoggerFactory.getLogger(VolumesMain.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    public interface Config {
        File outputDirectory ();
        int runTimeoutSeconds ();
        List<String> allowedExtensions ();
    }

    private final Config config;

    private final TrafficVolumeProcessor processor;

    /** JSON status report of the most recent run. */
    volatile String lastReport;

    public VolumesMain (Config config) {
        this(config, new TrafficVolumeProcessor());
    }

    public VolumesMain (Config config, TrafficVolumeProcessor processor) {
        this.config = config;
        this.processor = processor;
    }

    public static void main (String... args) {
        LOG.info("Starting traffic volume processing at {}", LocalDateTime.now());
        String configFile = System.getProperty("volumes.config", VolumesConfig.PROPERTIES_FILE_NAME);
        int exitCode = new VolumesMain(new VolumesConfig(configFile)).run(args);
        System.exit(exitCode);
    }

    /**
     * Process one run and report its final status.
     * @return a process exit code, zero on success.
     */
    public int run (String... args) {
        if (args.length != 4) {
            LOG.error("Usage: VolumesMain <am.csv> <pm.csv> <attout.txt> <run name>");
            return EXIT_USAGE;
        }
        File amCsv = new File(args[0]);
        File pmCsv = new File(args[1]);
        File attoutTxt = new File(args[2]);
        String runName = args[3];
        ProcessingStatus status = new ProcessingStatus(runName);

        File outputDirectory;
        try {
            InputFileType.AM_CSV.validate(amCsv.getName(), config.allowedExtensions());
            InputFileType.PM_CSV.validate(pmCsv.getName(), config.allowedExtensions());
            InputFileType.ATTOUT_TXT.validate(attoutTxt.getName(), config.allowedExtensions());
            outputDirectory = new File(config.outputDirectory(), SecureFilename.sanitize(runName));
            if (!outputDirectory.isDirectory() && !outputDirectory.mkdirs()) {
                throw VolumeProcessingException.unexpected(runName, "could not create output directory " + outputDirectory);
            }
        } catch (VolumeProcessingException e) {
            LOG.error("Cannot process run {}: {}", runName, e.getMessage());
            status.fail(e);
            report(status);
            return EXIT_FAILURE;
        }

        ProcessingRun run = new ProcessingRun(amCsv, pmCsv, attoutTxt, outputDirectory, runName);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        int exitCode;
        String report;
        try {
            Future<ProcessingResult> future = executor.submit(() -> processor.process(run, status));
            try {
                future.get(config.runTimeoutSeconds(), TimeUnit.SECONDS);
                exitCode = EXIT_OK;
                report = snapshot(status);
            } catch (TimeoutException e) {
                // The pipeline has no cancellation points, so this only stops us waiting for it.
                future.cancel(true);
                LOG.error("Run {} did not finish within {} seconds.", runName, config.runTimeoutSeconds());
                exitCode = EXIT_FAILURE;
                report = failAndSnapshot(status, VolumeProcessingException.unexpected(runName,
                        "timed out after " + config.runTimeoutSeconds() + " seconds"));
            } catch (ExecutionException e) {
                LOG.error("Run {} failed: {}", runName, e.getCause().getMessage());
                exitCode = EXIT_FAILURE;
                report = snapshot(status);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                exitCode = EXIT_FAILURE;
                report = failAndSnapshot(status, e);
            }
        } finally {
            executor.shutdownNow();
        }
        LOG.info("Run report: {}", report);
        lastReport = report;
        return exitCode;
    }

    /**
     * Fail the run and serialize it while holding the status lock, so a worker that finishes late cannot change what
     * is reported.
     */
    private static String failAndSnapshot (ProcessingStatus status, Exception e) {
        synchronized (status) {
            status.fail(e);
            return snapshot(status);
        }
    }

    private static String snapshot (ProcessingStatus status) {
        synchronized (status) {
            try {
                return JsonUtil.objectMapper.writeValueAsString(status);
            } catch (JsonProcessingException e) {
                LOG.warn("Could not serialize status of run {}", status.runName, e);
                return String.format("{\"runName\":\"%s\",\"status\":\"%s\"}", status.runName, status.status);
            }
        }
    }

    private void report (ProcessingStatus status) {
        lastReport = snapshot(status);
        LOG.info("Run report: {}", lastReport);
    }
}
