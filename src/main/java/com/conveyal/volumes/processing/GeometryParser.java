package com.conveyal.volumes.processing;

import com.conveyal.volumes.VolumeProcessingException;
import com.conveyal.volumes.models.GeometryFile;
import com.conveyal.volumes.models.GeometryHeader;
import com.conveyal.volumes.models.GeometryRecord;
import com.conveyal.volumes.models.MovementCode;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.CharStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parses a tab-delimited ATTOUT geometry export. The header must name HANDLE, BLOCKNAME and NODE_ID. Data rows are
 * tolerated when short: rows with at least three fields are padded with empty strings to the header width, and
 * anything shorter is dropped with a warning.
 */
public class GeometryParser {

    private static final Logger LOG = LoggerFactory.getLogger(GeometryParser.class);

    public static final char DELIMITER = '\t';

    /** Fewest fields a data row may have and still be used. */
    public static final int MIN_FIELDS = 3;

    private static final Splitter FIELD_SPLITTER = Splitter.on(DELIMITER).trimResults();

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public GeometryFile parse (File file, RunWarnings warnings) throws IOException {
        LOG.info("Reading ATTOUT TXT {}", file);
        List<String> lines;
        try (BufferedReader reader = Utf8Input.open(file)) {
            lines = CharStreams.readLines(reader);
        } catch (CharacterCodingException e) {
            throw VolumeProcessingException.format(file, "ATTOUT file is not valid UTF-8 text.");
        }
        if (lines.isEmpty()) {
            throw VolumeProcessingException.format(file, "ATTOUT file is empty.");
        }

        GeometryHeader header = parseHeader(file, stripByteOrderMark(lines.get(0)), warnings);

        List<GeometryRecord> records = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.trim().isEmpty()) continue;
            int lineNumber = i + 1;
            List<String> fields = new ArrayList<>(FIELD_SPLITTER.splitToList(line));
            LOG.debug("ATTOUT line {} fields: {} (count: {})", lineNumber, fields, fields.size());

            RowCheck check = checkFields(lineNumber, fields);
            if (!check.passed) {
                LOG.warn("Skipping ATTOUT line {}: {}", lineNumber, check.reason);
                warnings.droppedGeometryLines.add(check.reason);
                continue;
            }
            records.add(new GeometryRecord(header, lineNumber, fitToWidth(fields, header.width(), lineNumber)));
        }
        LOG.info("Read {} data rows from ATTOUT.", records.size());
        return new GeometryFile(header, records);
    }

    GeometryHeader parseHeader (File file, String rawLine, RunWarnings warnings) {
        if (rawLine.indexOf(DELIMITER) < 0) {
            throw VolumeProcessingException.format(file, "ATTOUT file header does not appear to be tab-delimited.");
        }
        GeometryHeader header = new GeometryHeader(rawLine, FIELD_SPLITTER.splitToList(rawLine));
        LOG.info("ATTOUT header read: {}", header.columns);

        List<String> missing = GeometryHeader.REQUIRED_COLUMNS.stream()
                .filter(column -> !header.hasColumn(column))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw VolumeProcessingException.format(file,
                    "ATTOUT file header missing required columns: " + String.join(", ", missing));
        }

        int movementsFound = ImmutableSet.copyOf(header.movementOrder).size();
        if (movementsFound < MovementCode.count()) {
            String note = String.format("ATTOUT header contains %d recognized movement tags (expected %d). " +
                    "ATTIN output will be missing columns. Found: %s", movementsFound, MovementCode.count(),
                    header.movementOrder);
            LOG.warn(note);
            warnings.notes.add(note);
        }
        return header;
    }

    static RowCheck checkFields (int lineNumber, List<String> fields) {
        if (fields.size() < MIN_FIELDS) {
            return RowCheck.fail("Line %d: too few columns (%d < %d).", lineNumber, fields.size(), MIN_FIELDS);
        }
        return RowCheck.pass();
    }

    /** Pad a short row with empty fields, or drop fields beyond the last header column. */
    private static List<String> fitToWidth (List<String> fields, int width, int lineNumber) {
        if (fields.size() < width) {
            LOG.debug("Padding ATTOUT line {} from {} to {} columns.", lineNumber, fields.size(), width);
            while (fields.size() < width) fields.add("");
        } else if (fields.size() > width) {
            LOG.debug("Ignoring {} fields beyond the header on ATTOUT line {}.", fields.size() - width, lineNumber);
            return fields.subList(0, width);
        }
        return fields;
    }

    private static String stripByteOrderMark (String line) {
        return !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK ? line.substring(1) : line;
    }
}
