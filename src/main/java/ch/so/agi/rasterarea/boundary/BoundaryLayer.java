package ch.so.agi.rasterarea.boundary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Single polygon layer read from a boundary dataset.
 */
public final class BoundaryLayer {
    private final List<String> fieldNames;
    private final List<BoundaryFeature> features;
    private final String projectionWkt;

    /**
     * @param fieldNames    attribute field names in dataset order
     * @param features      features in layer order
     * @param projectionWkt spatial reference as WKT, {@code null} if unknown
     */
    public BoundaryLayer(List<String> fieldNames, List<BoundaryFeature> features, String projectionWkt) {
        this.fieldNames = Collections.unmodifiableList(new ArrayList<>(fieldNames));
        this.features = Collections.unmodifiableList(new ArrayList<>(features));
        this.projectionWkt = projectionWkt;
    }

    public List<String> getFieldNames() {
        return fieldNames;
    }

    public List<BoundaryFeature> getFeatures() {
        return features;
    }

    public String getProjectionWkt() {
        return projectionWkt;
    }

    /**
     * @return a layer holding only {@code feature}, same fields and spatial reference
     */
    public BoundaryLayer single(BoundaryFeature feature) {
        return new BoundaryLayer(fieldNames, Collections.singletonList(feature), projectionWkt);
    }
}
