package ch.so.agi.rasterarea.lookup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Greyscale raster lookup: the raw value is the class code itself. {@code 0}
 * and codes outside the known classes are no data.
 */
public final class GreyscaleLookup implements ClassificationLookup<Integer> {
    private final List<Integer> columns;
    private final Set<Integer> known;

    public GreyscaleLookup(List<Integer> classes) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(classes));
        this.known = new HashSet<>(classes);
    }

    @Override
    public Integer classify(int raw) {
        if (raw == 0) {
            // black, no land cover (e.g. water)
            return null;
        }
        return known.contains(raw) ? raw : null;
    }

    @Override
    public List<Integer> columns() {
        return columns;
    }
}
