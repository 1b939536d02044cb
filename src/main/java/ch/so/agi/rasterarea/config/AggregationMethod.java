package ch.so.agi.rasterarea.config;

import java.util.Locale;

/**
 * How a dataset is aggregated per region.
 */
public enum AggregationMethod {
    /** Clip the raster to every region polygon and scan the clip. */
    VECTOR_CLIP("vector-clip"),
    /** Scan the raster block by block against precomputed region masks. */
    MASK_BLOCK("mask-block");

    private final String configName;

    AggregationMethod(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * @throws IllegalArgumentException if no method has that name
     */
    public static AggregationMethod forConfigName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (AggregationMethod method : values()) {
            if (method.configName.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation method: " + name);
    }
}
