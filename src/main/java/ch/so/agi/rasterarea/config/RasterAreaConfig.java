package ch.so.agi.rasterarea.config;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import ch.so.agi.rasterarea.lookup.LookupKind;
import ch.so.agi.rasterarea.matrix.OutputFormat;

/**
 * Settings of a run, read from the {@code raster-area} block of a Typesafe
 * config.
 * <p>
 * Defaults come from {@code reference.conf}. An explicit file passed to
 * {@link #load(File)} overrides {@code application.conf}, which in turn
 * overrides the defaults; system properties override everything.
 * </p>
 */
public final class RasterAreaConfig {
    public static final String ROOT = "raster-area";
    public static final List<String> GROUPS = List.of("land-cover", "climate", "slope", "workability");

    private final Path boundaries;
    private final Path adminNames;
    private final Path maskDirectory;
    private final Path resultsDirectory;
    private final int workers;
    private final boolean skipSparseBlocks;
    private final OutputFormat outputFormat;
    private final Map<String, List<DatasetDefinition>> datasets;

    private RasterAreaConfig(Config c) {
        this.boundaries = Paths.get(c.getString("boundaries"));
        String names = c.hasPath("admin-names") ? c.getString("admin-names").trim() : "";
        this.adminNames = names.isEmpty() ? null : Paths.get(names);
        this.maskDirectory = Paths.get(c.getString("mask-directory"));
        this.resultsDirectory = Paths.get(c.getString("results-directory"));
        this.workers = c.getInt("workers");
        if (workers < 1) {
            throw new ConfigException.BadValue(c.origin(), "workers", "must be at least 1");
        }
        this.skipSparseBlocks = c.getBoolean("skip-sparse-blocks");
        this.outputFormat = readOutputFormat(c.getConfig("output"));

        Map<String, List<DatasetDefinition>> groups = new LinkedHashMap<>();
        Config datasetConfig = c.getConfig("datasets");
        for (String group : GROUPS) {
            List<DatasetDefinition> list = new ArrayList<>();
            if (datasetConfig.hasPath(group)) {
                for (Config entry : datasetConfig.getConfigList(group)) {
                    list.add(readDataset(group, entry));
                }
            }
            groups.put(group, Collections.unmodifiableList(list));
        }
        this.datasets = Collections.unmodifiableMap(groups);
    }

    private RasterAreaConfig(RasterAreaConfig other, int workers) {
        this.boundaries = other.boundaries;
        this.adminNames = other.adminNames;
        this.maskDirectory = other.maskDirectory;
        this.resultsDirectory = other.resultsDirectory;
        this.workers = workers;
        this.skipSparseBlocks = other.skipSparseBlocks;
        this.outputFormat = other.outputFormat;
        this.datasets = other.datasets;
    }

    /**
     * Loads the configuration from the classpath defaults and
     * {@code application.conf}.
     *
     * @throws ConfigException if the configuration is missing a key or has a bad value
     */
    public static RasterAreaConfig load() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Loads the configuration with {@code configFile} overriding the defaults.
     *
     * @param configFile HOCON file, {@code null} for defaults only
     * @throws ConfigException if the file is unreadable, a key is missing or a value is bad
     */
    public static RasterAreaConfig load(File configFile) {
        if (configFile == null) {
            return load();
        }
        if (!configFile.isFile()) {
            throw new ConfigException.IO(ConfigFactory.empty().origin(),
                    "Configuration file not found: " + configFile.getAbsolutePath());
        }
        Config config = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.load())
                .resolve();
        return fromConfig(config);
    }

    /**
     * @param config a resolved config containing a {@code raster-area} block
     */
    public static RasterAreaConfig fromConfig(Config config) {
        return new RasterAreaConfig(config.getConfig(ROOT));
    }

    private static OutputFormat readOutputFormat(Config c) {
        String delimiter = c.getString("delimiter");
        if (delimiter.length() != 1) {
            throw new ConfigException.BadValue(c.origin(), "delimiter", "must be a single character: '" + delimiter + "'");
        }
        return new OutputFormat(c.getString("index-label"), c.getInt("decimal-places"), delimiter.charAt(0));
    }

    private static DatasetDefinition readDataset(String group, Config c) {
        LookupKind lookup;
        AggregationMethod method;
        try {
            lookup = LookupKind.forConfigName(c.getString("lookup"));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(c.origin(), "lookup", e.getMessage());
        }
        try {
            method = AggregationMethod.forConfigName(c.getString("method"));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(c.origin(), "method", e.getMessage());
        }
        boolean allTouched = c.hasPath("all-touched") ? c.getBoolean("all-touched") : lookup.isAllTouched();
        boolean skipIfMissing = c.hasPath("skip-if-missing") && c.getBoolean("skip-if-missing");
        return new DatasetDefinition(group, Paths.get(c.getString("raster")), c.getString("output"),
                lookup, method, allTouched, skipIfMissing);
    }

    public Path getBoundaries() {
        return boundaries;
    }

    /**
     * @return the name mapping table, {@code null} if names are used as they are
     */
    public Path getAdminNames() {
        return adminNames;
    }

    public Path getMaskDirectory() {
        return maskDirectory;
    }

    public Path getResultsDirectory() {
        return resultsDirectory;
    }

    public int getWorkers() {
        return workers;
    }

    /**
     * @return a copy running with {@code workers} parallel workers
     * @throws IllegalArgumentException if {@code workers} is less than 1
     */
    public RasterAreaConfig withWorkers(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1: " + workers);
        }
        return new RasterAreaConfig(this, workers);
    }

    public boolean isSkipSparseBlocks() {
        return skipSparseBlocks;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    /**
     * @param group one of {@link #GROUPS}
     * @return the datasets of the group in configured order
     * @throws IllegalArgumentException for an unknown group
     */
    public List<DatasetDefinition> getDatasets(String group) {
        List<DatasetDefinition> list = datasets.get(group);
        if (list == null) {
            throw new IllegalArgumentException("Unknown dataset group: " + group);
        }
        return list;
    }
}
