package com.conveyal.volumes.processing;

import com.conveyal.volumes.models.GeometryFile;
import com.conveyal.volumes.models.GeometryRecord;
import com.conveyal.volumes.models.MergedVolumeRow;
import com.conveyal.volumes.models.MergedVolumeTable;
import com.conveyal.volumes.models.MovementCode;
import com.conveyal.volumes.util.SecureFilename;
import com.csvreader.CsvWriter;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders the merged volume table as a CSV, and projects it onto the ATTOUT geometry rows to produce the ATTIN
 * file.
 *
 * Each ATTIN line holds HANDLE, BLOCKNAME and NODE_ID followed by the combined volumes for the movement columns in
 * the order the geometry header lists them. Both outputs are written under temporary names and only moved into
 * place once both are complete, so a failed run never leaves a file that looks like a finished output.
 */
public class OutputAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(OutputAssembler.class);

    public static final String MERGED_SUFFIX = "_Merged.csv";

    public static final String ATTIN_SUFFIX = "_ATTIN.txt";

    /** Header of the intersection column in the merged CSV. */
    public static final String NODE_ID_COLUMN = "Node ID";

    private static final Joiner TAB_JOINER = Joiner.on('\t');

    private static final Joiner LINE_JOINER = Joiner.on('\n');

    private final ImmutableList<MovementCode> movements;

    public OutputAssembler () {
        this(MovementCode.CANONICAL_ORDER);
    }

    /** @param movements the movement columns of the merged CSV, in output order. */
    public OutputAssembler (List<MovementCode> movements) {
        this.movements = ImmutableList.copyOf(movements);
    }

    public static String mergedFileName (String runName) {
        return SecureFilename.sanitize(runName) + MERGED_SUFFIX;
    }

    public static String attinFileName (String runName) {
        return SecureFilename.sanitize(runName) + ATTIN_SUFFIX;
    }

    /**
     * Build the ATTIN data lines, one per usable geometry record in file order. Records with a blank HANDLE,
     * BLOCKNAME or NODE_ID, records repeating an earlier HANDLE, and records whose NODE_ID has no merged volumes are
     * left out and noted in the warnings.
     */
    public List<String> assembleAttinLines (MergedVolumeTable merged, GeometryFile geometry, RunWarnings warnings) {
        LOG.info("Generating ATTIN data lines...");
        List<String> lines = new ArrayList<>();
        Set<String> processedHandles = new HashSet<>();
        for (GeometryRecord record : geometry.records) {
            RowCheck identity = checkIdentity(record);
            if (!identity.passed) {
                LOG.warn("Skipping ATTOUT row: {}", identity.reason);
                warnings.incompleteRecords.add(identity.reason);
                warnings.handlesNotGenerated.add(record.getHandle().isEmpty() ? "UNKNOWN" : record.getHandle());
                continue;
            }
            String handle = record.getHandle();
            if (!processedHandles.add(handle)) {
                LOG.warn("Duplicate HANDLE '{}' in ATTOUT on line {}. Skipping.", handle, record.lineNumber);
                warnings.duplicateHandles.add(handle);
                continue;
            }
            String nodeId = record.getNodeId();
            MergedVolumeRow row = merged.get(nodeId);
            if (row == null) {
                LOG.warn("No merged volumes for NODE_ID '{}' (HANDLE {}). Skipping ATTIN line.", nodeId, handle);
                warnings.unmatchedNodeIds.add(nodeId);
                warnings.handlesNotGenerated.add(handle);
                continue;
            }
            LOG.debug("Found merged volumes for NODE_ID '{}', building ATTIN line for HANDLE {}.", nodeId, handle);
            lines.add(attinLine(record, row, geometry));
        }
        warnings.logSummary(LOG);
        return lines;
    }

    static RowCheck checkIdentity (GeometryRecord record) {
        if (record.hasIdentity()) return RowCheck.pass();
        return RowCheck.fail("Line %d is missing HANDLE, BLOCKNAME, or NODE_ID: %s", record.lineNumber, record.getFields());
    }

    private static String attinLine (GeometryRecord record, MergedVolumeRow row, GeometryFile geometry) {
        List<String> parts = new ArrayList<>(3 + geometry.header.movementOrder.size());
        parts.add(record.getHandle());
        parts.add(record.getBlockName());
        parts.add(record.getNodeId());
        for (MovementCode movement : geometry.header.movementOrder) {
            parts.add(row.renderForAttin(movement));
        }
        return TAB_JOINER.join(parts);
    }

    /** Write the merged table with one row per intersection and the movements in canonical order. */
    public void writeMergedCsv (MergedVolumeTable merged, Writer out) throws IOException {
        CsvWriter writer = new CsvWriter(out, ',');
        writer.setRecordDelimiter('\n');
        try {
            String[] header = new String[movements.size() + 1];
            header[0] = NODE_ID_COLUMN;
            for (int i = 0; i < movements.size(); i++) header[i + 1] = movements.get(i).name();
            writer.writeRecord(header);

            for (MergedVolumeRow row : merged.rows()) {
                String[] record = new String[movements.size() + 1];
                record[0] = row.intersectionId;
                for (int i = 0; i < movements.size(); i++) record[i + 1] = row.render(movements.get(i));
                writer.writeRecord(record, true);
            }
            writer.flush();
        } finally {
            writer.close();
        }
    }

    /** The original geometry header line, then the data lines, with no newline after the last data line. */
    public void writeAttin (GeometryFile geometry, List<String> lines, Writer out) throws IOException {
        out.write(geometry.header.rawLine);
        out.write('\n');
        out.write(LINE_JOINER.join(lines));
        out.flush();
    }

    /**
     * Write both output files into the output directory. Nothing is left under a final name unless both files were
     * written completely.
     */
    public ProcessingResult write (MergedVolumeTable merged, GeometryFile geometry, List<String> attinLines,
                                   File outputDirectory, String runName, RunWarnings warnings) throws IOException {
        File mergedFile = new File(outputDirectory, mergedFileName(runName));
        File attinFile = new File(outputDirectory, attinFileName(runName));
        File mergedTemp = temporaryFile(mergedFile);
        File attinTemp = temporaryFile(attinFile);
        boolean mergedInPlace = false;
        boolean finished = false;
        try {
            try (Writer out = Files.newWriter(mergedTemp, StandardCharsets.UTF_8)) {
                writeMergedCsv(merged, out);
            }
            LOG.info("Merged CSV written: {} rows", merged.size());
            try (Writer out = Files.newWriter(attinTemp, StandardCharsets.UTF_8)) {
                writeAttin(geometry, attinLines, out);
            }
            LOG.info("ATTIN written: {} data lines", attinLines.size());

            moveIntoPlace(mergedTemp, mergedFile);
            mergedInPlace = true;
            moveIntoPlace(attinTemp, attinFile);
            finished = true;
        } finally {
            if (!finished) {
                FileUtils.deleteQuietly(mergedTemp);
                FileUtils.deleteQuietly(attinTemp);
                if (mergedInPlace) FileUtils.deleteQuietly(mergedFile);
            }
        }
        LOG.info("Merged CSV saved to: {}", mergedFile.getAbsolutePath());
        LOG.info("ATTIN file saved to: {}", attinFile.getAbsolutePath());
        return new ProcessingResult(mergedFile, attinFile, merged.size(), attinLines.size(), warnings);
    }

    private static File temporaryFile (File target) {
        return new File(target.getParentFile(), "." + target.getName() + ".tmp");
    }

    private static void moveIntoPlace (File source, File target) throws IOException {
        try {
            java.nio.file.Files.move(source.toPath(), target.toPath(),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}, falling back to a plain move.", target);
            java.nio.file.Files.move(source.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
