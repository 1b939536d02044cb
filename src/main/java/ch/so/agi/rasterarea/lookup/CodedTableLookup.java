package ch.so.agi.rasterarea.lookup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coded table lookup: the raw value is a code of a fixed code to label table.
 * {@code 0}, {@code 255} and unknown codes are no data.
 */
public final class CodedTableLookup implements ClassificationLookup<String> {
    private final Map<Integer, String> labels;
    private final List<String> columns;

    /**
     * @param labels code to label table, iteration order defines the columns
     */
    public CodedTableLookup(Map<Integer, String> labels) {
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        this.columns = Collections.unmodifiableList(new ArrayList<>(labels.values()));
    }

    @Override
    public String classify(int raw) {
        if (raw == 0 || raw == 255) {
            return null;
        }
        return labels.get(raw);
    }

    @Override
    public List<String> columns() {
        return columns;
    }
}
