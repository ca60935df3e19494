package com.conveyal.volumes;

import com.conveyal.volumes.models.MovementCode;
import com.google.common.base.Joiner;
import com.google.common.io.Files;
import com.google.common.primitives.Bytes;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class TestUtils {

    /** Header line of a count export with every required column, in canonical order. */
    public static final String VOLUME_HEADER = "RECORDNAME,INTID," + Joiner.on(',').join(MovementCode.CANONICAL_ORDER);

    /**
     * Helper to return the relative path to a test resource file
     */
    public static String getResourceFileName (String fileName) {
        return String.format("./src/test/resources/%s", fileName);
    }

    public static File writeFile (File directory, String name, String content) throws IOException {
        File file = new File(directory, name);
        Files.asCharSink(file, StandardCharsets.UTF_8).write(content);
        return file;
    }

    public static File writeBytes (File directory, String name, byte[]... parts) throws IOException {
        File file = new File(directory, name);
        Files.write(Bytes.concat(parts), file);
        return file;
    }

    public static String readFile (File file) throws IOException {
        return Files.asCharSource(file, StandardCharsets.UTF_8).read();
    }

    /**
     * Build a count export with a metadata line, the standard header, and one Volume row per intersection in which
     * only the given movement has a value.
     */
    public static String volumeCsv (String intersectionId, MovementCode movement, String value) {
        StringBuilder row = new StringBuilder("Volume,").append(intersectionId);
        for (MovementCode code : MovementCode.CANONICAL_ORDER) {
            row.append(',');
            if (code == movement) row.append(value);
        }
        return "Metadata line\n" + VOLUME_HEADER + "\n" + row + "\n";
    }
}
