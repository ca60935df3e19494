package com.conveyal.volumes.util;

import com.google.common.base.CharMatcher;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Turns free text such as a run name into a file name that is safe to use on any common filesystem.
 */
public abstract class SecureFilename {

    /** Used when nothing of the original name survives sanitizing. */
    public static final String FALLBACK = "scenario";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_.-]");

    private static final CharMatcher EDGE = CharMatcher.anyOf("._");

    /**
     * Decompose accented characters and drop anything outside ASCII, treat path separators as spaces, join words
     * with underscores, then remove every remaining character other than letters, digits, '_', '.' and '-'. Leading
     * and trailing dots and underscores are stripped so the result can never be a relative path or a hidden file.
     */
    public static String sanitize (String name) {
        if (name == null) return FALLBACK;
        String ascii = Normalizer.normalize(name, Normalizer.Form.NFKD)
                .replaceAll("[^\\p{ASCII}]", "");
        ascii = ascii.replace('/', ' ').replace('\\', ' ');
        String joined = String.join("_", WHITESPACE.split(ascii.trim()));
        String safe = EDGE.trimFrom(UNSAFE.matcher(joined).replaceAll(""));
        return safe.isEmpty() ? FALLBACK : safe;
    }
}
