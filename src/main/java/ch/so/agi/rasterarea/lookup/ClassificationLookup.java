package ch.so.agi.rasterarea.lookup;

import java.util.List;

/**
 * Maps raw pixel values of a classification raster to classification keys.
 * <p>
 * Implementations never fail for values outside their domain: unmapped values,
 * blank pixels and the masking sentinel {@link #NO_DATA} all classify as no
 * data ({@code null}).
 * </p>
 *
 * @param <K> type of the classification key, e.g. a class label or code
 */
public interface ClassificationLookup<K> {

    /** Raw value masked-out pixels are recoded to before classification. */
    int NO_DATA = -1;

    /**
     * @param raw raw pixel value
     * @return the classification key, or {@code null} for no data
     */
    K classify(int raw);

    /**
     * @return the fixed, ordered universe of keys this lookup can return
     */
    List<K> columns();
}
