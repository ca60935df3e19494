package com.conveyal.volumes;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Configuration for command line processing runs, read from a properties file.
 */
public class VolumesConfig implements VolumesMain.Config {

    private static final Logger LOG = LoggerFactory.getLogger(VolumesConfig.class);

    public static final String PROPERTIES_FILE_NAME = "volumes.properties";

    public static final int DEFAULT_RUN_TIMEOUT_SECONDS = 300;

    public static final String DEFAULT_ALLOWED_EXTENSIONS = "csv,txt";

    protected Properties config = new Properties();
    protected Set<String> missingKeys = new LinkedHashSet<>();

    private final File outputDirectory;
    private final int runTimeoutSeconds;
    private final List<String> allowedExtensions;

    public VolumesConfig () {
        this(PROPERTIES_FILE_NAME);
    }

    public VolumesConfig (String filename) {
        this(load(filename));
    }

    public VolumesConfig (Properties properties) {
        config.putAll(properties);

        String outputDirectoryName = getProperty("output-directory", true);
        outputDirectory = outputDirectoryName == null ? null : new File(outputDirectoryName);
        runTimeoutSeconds = Integer.parseInt(getProperty("run-timeout-seconds", false,
                Integer.toString(DEFAULT_RUN_TIMEOUT_SECONDS)));
        allowedExtensions = ImmutableList.copyOf(Splitter.on(',').trimResults().omitEmptyStrings()
                .split(getProperty("allowed-extensions", false, DEFAULT_ALLOWED_EXTENSIONS).toLowerCase()));

        if (!missingKeys.isEmpty()) {
            String message = "You must provide these configuration properties: " + String.join(", ", missingKeys);
            LOG.error(message);
            throw new IllegalArgumentException(message);
        }
    }

    private static Properties load (String filename) {
        Properties properties = new Properties();
        try (InputStream is = new FileInputStream(filename)) {
            properties.load(is);
        } catch (Exception e) {
            String message = "Could not read config file " + filename;
            LOG.error(message);
            throw new RuntimeException(message, e);
        }
        return properties;
    }

    private String getProperty (String key, boolean require) {
        String value = config.getProperty(key);
        if (require && value == null) {
            LOG.error("Missing configuration option {}", key);
            missingKeys.add(key);
        }
        return value;
    }

    private String getProperty (String key, boolean require, String defaultValue) {
        String value = getProperty(key, require);
        return value == null ? defaultValue : value;
    }

    @Override public File outputDirectory () { return outputDirectory; }
    @Override public int runTimeoutSeconds () { return runTimeoutSeconds; }
    @Override public List<String> allowedExtensions () { return allowedExtensions; }

}
