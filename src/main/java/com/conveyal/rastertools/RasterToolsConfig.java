package com.conveyal.rastertools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Properties;

/**
 * Process-wide options of the raster tools: how many worker threads may be used, and whether progress is reported.
 *
 * Keys are max-workers and no-progress. The shorter maxworkers and notqdm spellings, as in the environment variables
 * RASTERTOOLS_MAXWORKERS and RASTERTOOLS_NOTQDM, are also understood; the long spelling wins when both are set.
 */
public class RasterToolsConfig extends ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(RasterToolsConfig.class);

    private final int maxWorkers;

    private final boolean progressEnabled;

    private RasterToolsConfig (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        super(properties, environment, systemProperties);
        int availableProcessors = Runtime.getRuntime().availableProcessors();
        int workers = intProp(keyOrLegacy("max-workers", "maxworkers"), availableProcessors);
        if (workers < 1) {
            LOG.error("Configuration option 'max-workers' must be at least 1, got {}", workers);
            keysWithErrors.add("max-workers");
        }
        maxWorkers = workers;
        progressEnabled = !boolProp(keyOrLegacy("no-progress", "notqdm"), false);
        throwIfErrors();
    }

    /** The legacy spelling of an option is only looked at when the option is not set under its own key. */
    private String keyOrLegacy (String key, String legacyKey) {
        return strProp(key) == null && strProp(legacyKey) != null ? legacyKey : key;
    }

    /** Configuration from environment variables and system properties only. */
    public static RasterToolsConfig fromEnvironment () {
        return new RasterToolsConfig(new Properties(), System.getenv(), System.getProperties());
    }

    /** Configuration from a properties file, overridden by environment variables and system properties. */
    public static RasterToolsConfig fromFile (String filename) {
        return new RasterToolsConfig(propsFromFile(filename), System.getenv(), System.getProperties());
    }

    /** Configuration from the given properties alone, with no override from the environment. */
    public static RasterToolsConfig fromProperties (Properties properties) {
        return new RasterToolsConfig(properties, Map.of(), Map.of());
    }

    /** Configuration from the given properties, overridden from the given environment and system properties. */
    public static RasterToolsConfig load (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        return new RasterToolsConfig(properties, environment, systemProperties);
    }

    /** Upper bound on the number of worker threads, used when a run does not specify its own worker count. */
    public int maxWorkers () {
        return maxWorkers;
    }

    public boolean progressEnabled () {
        return progressEnabled;
    }

    @Override
    public String toString () {
        return String.format("max-workers %d, progress %s", maxWorkers, progressEnabled ? "on" : "off");
    }

}
