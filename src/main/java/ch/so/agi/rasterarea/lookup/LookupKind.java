package ch.so.agi.rasterarea.lookup;

import java.util.Locale;

import ch.so.agi.rasterarea.raster.Palette;
import ch.so.agi.rasterarea.raster.RasterSource;
import ch.so.agi.rasterarea.utils.RasterAreaException;

/**
 * Dataset families and the lookup each one classifies with.
 */
public enum LookupKind {
    /** Köppen-Geiger climate classes, palette raster. */
    KOPPEN_GEIGER("koppen-geiger", true) {
        @Override
        public ClassificationLookup<?> create(RasterSource raster) {
            Palette palette = raster.getPalette();
            if (palette == null) {
                throw new RasterAreaException("NO_PALETTE", "Köppen-Geiger raster has no colour table");
            }
            return new PaletteLookup(palette, ClassificationTables.KOPPEN_GEIGER_COLORS);
        }
    },
    /** ESA CCI land cover, greyscale LCCS codes. */
    ESA_LCCS("esa-lccs", true) {
        @Override
        public ClassificationLookup<?> create(RasterSource raster) {
            return new GreyscaleLookup(ClassificationTables.ESA_LCCS_CLASSES);
        }
    },
    /** FAO GLC-SHARE dominant land cover. */
    FAO_LAND_COVER("fao-land-cover", true) {
        @Override
        public ClassificationLookup<?> create(RasterSource raster) {
            return new CodedTableLookup(ClassificationTables.FAO_LAND_COVER);
        }
    },
    /** Geomorpho90m slope classified into GAEZ buckets. */
    GAEZ_SLOPE("gaez-slope", true) {
        @Override
        public ClassificationLookup<?> create(RasterSource raster) {
            return new BucketLookup(ClassificationTables.GAEZ_SLOPES);
        }
    },
    /** FAO workability classes. */
    WORKABILITY("workability", false) {
        @Override
        public ClassificationLookup<?> create(RasterSource raster) {
            return new GreyscaleLookup(ClassificationTables.WORKABILITY_CLASSES);
        }
    };

    private final String configName;
    private final boolean allTouched;

    LookupKind(String configName, boolean allTouched) {
        this.configName = configName;
        this.allTouched = allTouched;
    }

    /**
     * Creates the lookup for a raster of this family. Palette lookups read the
     * colour table from the raster.
     */
    public abstract ClassificationLookup<?> create(RasterSource raster);

    /**
     * @return whether cutline clipping includes every pixel the polygon touches
     */
    public boolean isAllTouched() {
        return allTouched;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * @param name configuration name, e.g. {@code koppen-geiger}
     * @throws IllegalArgumentException if no family has that name
     */
    public static LookupKind forConfigName(String name) {
        for (LookupKind kind : values()) {
            if (kind.configName.equals(name.trim().toLowerCase(Locale.ROOT))) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown lookup: " + name);
    }
}
