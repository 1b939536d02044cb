package ch.so.agi.rasterarea.raster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Colour table of a palette raster: index to 8 bit RGBA.
 */
public final class Palette {
    private final List<int[]> entries;

    private Palette(List<int[]> entries) {
        this.entries = entries;
    }

    /**
     * Builds a palette from RGB triples, alpha is 255.
     *
     * @param rgb entries, each {@code {r, g, b}}
     */
    public static Palette ofRgb(int[]... rgb) {
        List<int[]> entries = new ArrayList<>(rgb.length);
        for (int[] c : rgb) {
            if (c.length < 3) {
                throw new IllegalArgumentException("Palette entries need three channels");
            }
            entries.add(new int[] {c[0], c[1], c[2], c.length > 3 ? c[3] : 255});
        }
        return new Palette(Collections.unmodifiableList(entries));
    }

    /**
     * Builds a palette from a TIFF ColorMap: all red values, then all green,
     * then all blue, each channel 16 bit.
     *
     * @param colorMap the ColorMap field values
     */
    public static Palette fromTiffColorMap(List<? extends Number> colorMap) {
        if (colorMap.size() % 3 != 0) {
            throw new IllegalArgumentException("ColorMap length must be a multiple of 3: " + colorMap.size());
        }
        int n = colorMap.size() / 3;
        List<int[]> entries = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            // 16 bit channel to 8 bit, the way GDAL reads TIFF palettes
            int r = colorMap.get(i).intValue() / 257;
            int g = colorMap.get(n + i).intValue() / 257;
            int b = colorMap.get(2 * n + i).intValue() / 257;
            entries.add(new int[] {r, g, b, 255});
        }
        return new Palette(Collections.unmodifiableList(entries));
    }

    public int size() {
        return entries.size();
    }

    /**
     * @param index palette index
     * @return {@code {r, g, b, a}}, or {@code null} if the index is outside the table
     */
    public int[] getColorEntry(int index) {
        if (index < 0 || index >= entries.size()) {
            return null;
        }
        return entries.get(index).clone();
    }

    /**
     * Encodes the palette as TIFF ColorMap values (16 bit channels).
     */
    public List<Integer> toTiffColorMap() {
        int n = entries.size();
        List<Integer> out = new ArrayList<>(3 * n);
        for (int channel = 0; channel < 3; channel++) {
            for (int[] e : entries) {
                out.add(e[channel] * 257);
            }
        }
        return out;
    }
}
