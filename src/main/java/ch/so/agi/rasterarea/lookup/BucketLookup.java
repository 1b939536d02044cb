package ch.so.agi.rasterarea.lookup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Enumerated bucket lookup: the raw value indexes an ordered list of bucket
 * labels. {@code 255} and indexes outside the list are no data.
 */
public final class BucketLookup implements ClassificationLookup<String> {
    static final int NO_DATA_VALUE = 255;

    private final List<String> buckets;

    public BucketLookup(List<String> buckets) {
        this.buckets = Collections.unmodifiableList(new ArrayList<>(buckets));
    }

    @Override
    public String classify(int raw) {
        if (raw == NO_DATA_VALUE || raw < 0 || raw >= buckets.size()) {
            return null;
        }
        return buckets.get(raw);
    }

    @Override
    public List<String> columns() {
        return buckets;
    }
}
