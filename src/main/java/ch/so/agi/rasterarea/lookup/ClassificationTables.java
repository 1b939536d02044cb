package ch.so.agi.rasterarea.lookup;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static classification tables of the supported datasets.
 */
public final class ClassificationTables {

    private ClassificationTables() {}

    /**
     * Köppen-Geiger colour legend of Beck et al. (2018), "Present and future
     * Köppen-Geiger climate classification maps at 1-km resolution".
     */
    public static final Map<Rgb, String> KOPPEN_GEIGER_COLORS;

    static {
        Map<Rgb, String> kg = new LinkedHashMap<>();
        kg.put(new Rgb(0, 0, 255), "Af");
        kg.put(new Rgb(0, 120, 255), "Am");
        kg.put(new Rgb(70, 170, 250), "Aw");
        kg.put(new Rgb(255, 0, 0), "BWh");
        kg.put(new Rgb(255, 150, 150), "BWk");
        kg.put(new Rgb(245, 165, 0), "BSh");
        kg.put(new Rgb(255, 220, 100), "BSk");
        kg.put(new Rgb(255, 255, 0), "Csa");
        kg.put(new Rgb(200, 200, 0), "Csb");
        kg.put(new Rgb(150, 150, 0), "Csc");
        kg.put(new Rgb(150, 255, 150), "Cwa");
        kg.put(new Rgb(100, 200, 100), "Cwb");
        kg.put(new Rgb(50, 150, 50), "Cwc");
        kg.put(new Rgb(200, 255, 80), "Cfa");
        kg.put(new Rgb(100, 255, 80), "Cfb");
        kg.put(new Rgb(50, 200, 0), "Cfc");
        kg.put(new Rgb(255, 0, 255), "Dsa");
        kg.put(new Rgb(200, 0, 200), "Dsb");
        kg.put(new Rgb(150, 50, 150), "Dsc");
        kg.put(new Rgb(150, 100, 150), "Dsd");
        kg.put(new Rgb(170, 175, 255), "Dwa");
        kg.put(new Rgb(90, 120, 220), "Dwb");
        kg.put(new Rgb(75, 80, 180), "Dwc");
        kg.put(new Rgb(50, 0, 135), "Dwd");
        kg.put(new Rgb(0, 255, 255), "Dfa");
        kg.put(new Rgb(55, 200, 255), "Dfb");
        kg.put(new Rgb(0, 125, 125), "Dfc");
        kg.put(new Rgb(0, 70, 95), "Dfd");
        kg.put(new Rgb(178, 178, 178), "ET");
        kg.put(new Rgb(102, 102, 102), "EF");
        KOPPEN_GEIGER_COLORS = Collections.unmodifiableMap(kg);
    }

    /**
     * LCCS classes of the ESA CCI land cover maps. The GeoTIFFs are greyscale
     * and the grey value of a pixel equals its LCCS class.
     */
    public static final List<Integer> ESA_LCCS_CLASSES = Collections.unmodifiableList(Arrays.asList(
            10, 11, 12, 20, 30, 40, 50, 60, 61, 62, 70, 71, 72, 80, 81, 82, 90, 100, 110,
            120, 121, 122, 130, 140, 150, 151, 152, 153, 160, 170, 180, 190, 200, 201, 202,
            210, 220));

    /** Dominant land cover classes of FAO GLC-SHARE. */
    public static final Map<Integer, String> FAO_LAND_COVER;

    static {
        Map<Integer, String> lc = new LinkedHashMap<>();
        lc.put(1, "Artificial Surfaces");
        lc.put(2, "Cropland");
        lc.put(3, "Grassland");
        lc.put(4, "Tree Covered Areas");
        lc.put(5, "Shrubs Covered Areas");
        lc.put(6, "Herbaceous vegetation, aquatic or regularly flooded");
        lc.put(7, "Mangroves");
        lc.put(8, "Sparse vegetation");
        lc.put(9, "Baresoil");
        lc.put(10, "Snow and glaciers");
        lc.put(11, "Waterbodies");
        FAO_LAND_COVER = Collections.unmodifiableMap(lc);
    }

    /**
     * GAEZ 3.0 slope classes. The Geomorpho90m slope raster is pre-classified
     * so that each pixel holds the index of its bucket.
     */
    public static final List<String> GAEZ_SLOPES = Collections.unmodifiableList(Arrays.asList(
            "0-0.5%", "0.5-2%", "2-5%", "5-8%", "8-16%", "16-30%", "30-45%", ">45%"));

    /** FAO soil workability classes, pixel values are the class. */
    public static final List<Integer> WORKABILITY_CLASSES = Collections.unmodifiableList(Arrays.asList(
            1, 2, 3, 4, 5, 6, 7));
}
