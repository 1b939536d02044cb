package ch.so.agi.rasterarea.raster;

import java.io.Closeable;
import java.io.IOException;

/**
 * Open single band classification raster with a linear geotransform.
 * <p>
 * Implementations are not thread safe; concurrent readers each open their own
 * instance.
 * </p>
 */
public interface RasterSource extends Closeable {

    int getWidth();

    int getHeight();

    GeoTransform getGeoTransform();

    /**
     * @return width of the native block (tile) the raster is stored in
     */
    int getBlockWidth();

    /**
     * @return height of the native block (tile or strip) the raster is stored in
     */
    int getBlockHeight();

    /**
     * @return the colour table, or {@code null} if the raster has none
     */
    Palette getPalette();

    /**
     * @return the declared nodata value, or {@code null} if none is declared
     */
    Double getNoData();

    /**
     * Reports whether the window holds stored data, without reading pixel values.
     */
    BlockCoverage getDataCoverageStatus(int xOff, int yOff, int cols, int rows) throws IOException;

    /**
     * Reads a window of pixel values.
     *
     * @throws IOException if the pixel data cannot be read
     * @throws IllegalArgumentException if the window is outside the raster
     */
    RasterBlock read(int xOff, int yOff, int cols, int rows) throws IOException;

    /**
     * Checks that a window lies inside a raster of the given size.
     */
    static void checkWindow(RasterSource raster, int xOff, int yOff, int cols, int rows) {
        if (xOff < 0 || yOff < 0 || cols < 0 || rows < 0
                || xOff + cols > raster.getWidth() || yOff + rows > raster.getHeight()) {
            throw new IllegalArgumentException("Window (" + xOff + "," + yOff + " " + cols + "x" + rows
                    + ") outside raster of " + raster.getWidth() + "x" + raster.getHeight());
        }
    }
}
