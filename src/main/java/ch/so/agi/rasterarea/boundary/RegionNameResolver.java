package ch.so.agi.rasterarea.boundary;

/**
 * Normalises free text administrative names to canonical region names.
 */
@FunctionalInterface
public interface RegionNameResolver {

    /**
     * @param rawAdminName name as found in the boundary layer
     * @return the canonical region name, or {@code null} if the feature is to be skipped
     */
    String lookup(String rawAdminName);

    /**
     * @return resolver returning every name unchanged, {@code null} for blank names
     */
    static RegionNameResolver identity() {
        return name -> name == null || name.isBlank() ? null : name;
    }
}
