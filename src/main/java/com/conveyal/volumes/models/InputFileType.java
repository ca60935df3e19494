package com.conveyal.volumes.models;

import com.conveyal.volumes.VolumeProcessingException;
import org.apache.commons.io.FilenameUtils;

import java.io.File;
import java.util.Collection;
import java.util.Locale;

/**
 * The three inputs of a processing run, each with the file extension it must be uploaded with.
 */
public enum InputFileType {
    AM_CSV("AM", "csv"),
    PM_CSV("PM", "csv"),
    ATTOUT_TXT("ATTOUT", "txt");

    public final String label;

    public final String extension;

    InputFileType (String label, String extension) {
        this.label = label;
        this.extension = extension;
    }

    /**
     * Check that a file name carries this type's extension and that the extension is among those allowed.
     * Extensions are compared case-insensitively.
     */
    public void validate (String fileName, Collection<String> allowedExtensions) {
        String actual = FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT);
        if (!actual.equals(extension) || !allowedExtensions.contains(actual)) {
            throw VolumeProcessingException.format(new File(fileName), String.format(
                    "Invalid file extension for %s file '%s'. Expected '.%s'. Allowed types: %s",
                    label, fileName, extension, String.join(", ", allowedExtensions)));
        }
    }
}
