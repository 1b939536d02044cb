package ch.so.agi.rasterarea.boundary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.locationtech.jts.geom.Geometry;

/**
 * Polygon feature of the boundary layer with its text attributes.
 */
public final class BoundaryFeature {
    public static final String ADMIN = "ADMIN";
    public static final String SOV_A3 = "SOV_A3";

    private final int index;
    private final Map<String, String> attributes;
    private final Geometry geometry;

    /**
     * @param index      zero-based position of the feature in its layer
     * @param attributes attribute values by field name
     * @param geometry   polygonal geometry, may be empty
     */
    public BoundaryFeature(int index, Map<String, String> attributes, Geometry geometry) {
        this.index = index;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.geometry = Objects.requireNonNull(geometry, "geometry");
    }

    public int getIndex() {
        return index;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public Geometry getGeometry() {
        return geometry;
    }

    /**
     * @return the free text administrative name
     */
    public String getAdmin() {
        return attributes.get(ADMIN);
    }

    /**
     * @return the three letter sovereign code
     */
    public String getSovereignCode() {
        return attributes.get(SOV_A3);
    }

    /**
     * @return {@code {SOV_A3}_{index}}, the stem of per-feature file names
     */
    public String getFileStem() {
        return getSovereignCode() + "_" + index;
    }
}
