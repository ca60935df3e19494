package com.conveyal.volumes.processing;

import com.google.common.io.Files;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Opens input files as UTF-8 text. Malformed byte sequences raise a CharacterCodingException when read rather
 * than being replaced, so an identifier is never silently altered.
 */
final class Utf8Input {

    private Utf8Input () { }

    static BufferedReader open (File file) throws IOException {
        return new BufferedReader(new InputStreamReader(
                Files.asByteSource(file).openStream(), StandardCharsets.UTF_8.newDecoder()));
    }
}
