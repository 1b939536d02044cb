package ch.so.agi.rasterarea.lookup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import ch.so.agi.rasterarea.raster.Palette;

/**
 * Palette raster lookup: the raw value is a palette index, its colour is
 * mapped to a class through a fixed colour table. Negative indexes, indexes
 * outside the palette, pure white and pure black are no data.
 */
public final class PaletteLookup implements ClassificationLookup<String> {
    private final Palette palette;
    private final Map<Rgb, String> colorClasses;
    private final List<String> columns;

    /**
     * @param palette      colour table of the raster being classified
     * @param colorClasses colour to class table, iteration order defines the columns
     */
    public PaletteLookup(Palette palette, Map<Rgb, String> colorClasses) {
        this.palette = Objects.requireNonNull(palette, "palette");
        this.colorClasses = Objects.requireNonNull(colorClasses, "colorClasses");
        this.columns = Collections.unmodifiableList(new ArrayList<>(colorClasses.values()));
    }

    @Override
    public String classify(int raw) {
        if (raw < 0) {
            return null;
        }
        int[] entry = palette.getColorEntry(raw);
        if (entry == null) {
            return null;
        }
        Rgb color = new Rgb(entry[0], entry[1], entry[2]);
        if (color.equals(Rgb.WHITE) || color.equals(Rgb.BLACK)) {
            // blank pixel, masked off
            return null;
        }
        return colorClasses.get(color);
    }

    @Override
    public List<String> columns() {
        return columns;
    }
}
