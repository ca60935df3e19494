package com.conveyal.volumes.processing;

import com.conveyal.volumes.VolumeProcessingException;
import com.conveyal.volumes.models.MovementCode;
import com.conveyal.volumes.models.Period;
import com.conveyal.volumes.models.VolumeRecord;
import com.conveyal.volumes.models.VolumeTable;
import com.csvreader.CsvReader;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Reads one period's turning movement count export into a VolumeTable.
 *
 * The first physical line of an export is metadata and is skipped without inspection. The second line is the real
 * column header. Only rows whose record type column reads "Volume" are kept; lane configuration and other record
 * types are discarded.
 */
public class VolumeTableLoader {

    private static final Logger LOG = LoggerFactory.getLogger(VolumeTableLoader.class);

    /** Names of the columns a count export must carry. */
    public static class Columns {
        public static final Columns DEFAULT =
                new Columns("RECORDNAME", "INTID", "Volume", MovementCode.CANONICAL_ORDER);

        public final String recordType;
        public final String intersectionId;
        /** Value of the record type column on the rows that hold volumes. */
        public final String volumeRecordType;
        public final ImmutableList<MovementCode> movements;

        public Columns (String recordType, String intersectionId, String volumeRecordType, List<MovementCode> movements) {
            this.recordType = recordType;
            this.intersectionId = intersectionId;
            this.volumeRecordType = volumeRecordType;
            this.movements = ImmutableList.copyOf(movements);
        }

        List<String> required () {
            List<String> required = new ArrayList<>();
            required.add(recordType);
            required.add(intersectionId);
            for (MovementCode movement : movements) required.add(movement.name());
            return required;
        }
    }

    private final Columns columns;

    private final char delimiter;

    public VolumeTableLoader () {
        this(Columns.DEFAULT, ',');
    }

    public VolumeTableLoader (Columns columns, char delimiter) {
        this.columns = columns;
        this.delimiter = delimiter;
    }

    public VolumeTable load (File file, Period period, RunWarnings warnings) throws IOException {
        LOG.info("Reading {} CSV {}", period, file);
        VolumeTable table = new VolumeTable(period);
        try (BufferedReader reader = Utf8Input.open(file)) {
            if (reader.readLine() == null) {
                throw VolumeProcessingException.format(file, String.format("%s CSV is empty.", period));
            }
            CsvReader csvReader = new CsvReader(reader, delimiter);
            // Intersection IDs are compared exactly, so surrounding spaces are kept.
            csvReader.setTrimWhitespace(false);
            try {
                if (!csvReader.readHeaders()) {
                    throw VolumeProcessingException.format(file,
                            String.format("%s CSV has no column header after its first line.", period));
                }
                checkColumns(csvReader, file, period);

                int recordTypeIndex = csvReader.getIndex(columns.recordType);
                int intersectionIdIndex = csvReader.getIndex(columns.intersectionId);
                int[] movementIndexes = new int[columns.movements.size()];
                for (int i = 0; i < movementIndexes.length; i++) {
                    movementIndexes[i] = csvReader.getIndex(columns.movements.get(i).name());
                }

                while (csvReader.readRecord()) {
                    if (!columns.volumeRecordType.equals(csvReader.get(recordTypeIndex))) continue;
                    String intersectionId = csvReader.get(intersectionIdIndex);
                    if (intersectionId.isEmpty()) {
                        LOG.warn("Skipping {} volume row {} with no intersection ID.", period,
                                csvReader.getCurrentRecord() + 1);
                        warnings.notes.add(String.format("%s volume row %d has no intersection ID",
                                period, csvReader.getCurrentRecord() + 1));
                        continue;
                    }
                    VolumeRecord record = new VolumeRecord(intersectionId);
                    for (int i = 0; i < movementIndexes.length; i++) {
                        record.setVolume(columns.movements.get(i), parseVolume(csvReader.get(movementIndexes[i])));
                    }
                    if (table.put(record) != null) {
                        // Later rows replace earlier ones for the same intersection.
                        LOG.warn("{} CSV has more than one volume row for intersection {}; keeping the last.",
                                period, intersectionId);
                        warnings.replacedVolumeRows.add(period + ":" + intersectionId);
                    }
                }
            } finally {
                csvReader.close();
            }
        } catch (CharacterCodingException e) {
            throw VolumeProcessingException.format(file, String.format("%s CSV is not valid UTF-8 text.", period));
        }
        LOG.info("Read {} {} volume records.", table.size(), period);
        return table;
    }

    private void checkColumns (CsvReader csvReader, File file, Period period) throws IOException {
        List<String> missing = new ArrayList<>();
        for (String column : columns.required()) {
            if (csvReader.getIndex(column) < 0) missing.add(column);
        }
        if (!missing.isEmpty()) {
            throw VolumeProcessingException.format(file,
                    String.format("%s CSV is missing required columns: %s", period, String.join(", ", missing)));
        }
    }

    /**
     * Parse a count. Blank, non-numeric and non-finite values are "no value", never zero.
     */
    static OptionalDouble parseVolume (String text) {
        if (text == null) return OptionalDouble.empty();
        Double value = Doubles.tryParse(text.trim());
        if (value == null || value.isNaN() || value.isInfinite()) return OptionalDouble.empty();
        return OptionalDouble.of(value);
    }
}
