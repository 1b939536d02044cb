package ch.so.agi.rasterarea.config;

import java.nio.file.Path;
import java.util.Objects;

import ch.so.agi.rasterarea.lookup.LookupKind;

/**
 * One classification raster to aggregate and the table it produces.
 */
public final class DatasetDefinition {
    private final String group;
    private final Path raster;
    private final String output;
    private final LookupKind lookup;
    private final AggregationMethod method;
    private final boolean allTouched;
    private final boolean skipIfMissing;

    /**
     * @param group         dataset group, e.g. {@code climate}
     * @param raster        classification raster
     * @param output        file name of the result table
     * @param lookup        classification family of the raster
     * @param method        aggregation method
     * @param allTouched    clip with every touched pixel (vector clip only)
     * @param skipIfMissing skip the dataset instead of failing when the raster is missing
     */
    public DatasetDefinition(String group, Path raster, String output, LookupKind lookup, AggregationMethod method,
            boolean allTouched, boolean skipIfMissing) {
        this.group = Objects.requireNonNull(group, "group");
        this.raster = Objects.requireNonNull(raster, "raster");
        this.output = Objects.requireNonNull(output, "output");
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.method = Objects.requireNonNull(method, "method");
        this.allTouched = allTouched;
        this.skipIfMissing = skipIfMissing;
    }

    public String getGroup() {
        return group;
    }

    public Path getRaster() {
        return raster;
    }

    public String getOutput() {
        return output;
    }

    public LookupKind getLookup() {
        return lookup;
    }

    public AggregationMethod getMethod() {
        return method;
    }

    public boolean isAllTouched() {
        return allTouched;
    }

    public boolean isSkipIfMissing() {
        return skipIfMissing;
    }

    @Override
    public String toString() {
        return "DatasetDefinition(" + group + ": " + raster + " -> " + output + ", " + lookup.getConfigName()
                + ", " + method.getConfigName() + ")";
    }
}
