package ch.so.agi.rasterarea.raster;

import java.util.Arrays;
import java.util.Objects;

/**
 * Raster held in memory. Used for clip results before they are written to
 * scratch and for synthetic rasters.
 * <p>
 * A window is reported {@link BlockCoverage#EMPTY} when all of its values are
 * zero, which is what a sparse GeoTIFF returns for unwritten blocks.
 * </p>
 */
public class MemoryRaster implements RasterSource {
    private final int width;
    private final int height;
    private final int[] values;
    private final GeoTransform geoTransform;
    private final int blockWidth;
    private final int blockHeight;
    private Palette palette;
    private Double noData;

    /**
     * Creates a zero filled raster whose block is a single full-width row.
     */
    public MemoryRaster(int width, int height, GeoTransform geoTransform) {
        this(width, height, geoTransform, width, 1);
    }

    public MemoryRaster(int width, int height, GeoTransform geoTransform, int blockWidth, int blockHeight) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster size must be positive: " + width + "x" + height);
        }
        if (blockWidth <= 0 || blockHeight <= 0) {
            throw new IllegalArgumentException("Block size must be positive: " + blockWidth + "x" + blockHeight);
        }
        this.width = width;
        this.height = height;
        this.values = new int[width * height];
        this.geoTransform = Objects.requireNonNull(geoTransform, "geoTransform");
        this.blockWidth = blockWidth;
        this.blockHeight = blockHeight;
    }

    /**
     * Creates a raster from rows of values, top row first.
     */
    public static MemoryRaster of(int[][] rows, GeoTransform geoTransform, int blockWidth, int blockHeight) {
        MemoryRaster raster = new MemoryRaster(rows[0].length, rows.length, geoTransform, blockWidth, blockHeight);
        for (int y = 0; y < rows.length; y++) {
            if (rows[y].length != raster.width) {
                throw new IllegalArgumentException("Ragged row " + y);
            }
            System.arraycopy(rows[y], 0, raster.values, y * raster.width, raster.width);
        }
        return raster;
    }

    public static MemoryRaster of(int[][] rows, GeoTransform geoTransform) {
        return of(rows, geoTransform, rows[0].length, 1);
    }

    public MemoryRaster withPalette(Palette palette) {
        this.palette = palette;
        return this;
    }

    public MemoryRaster withNoData(Double noData) {
        this.noData = noData;
        return this;
    }

    public int get(int col, int row) {
        return values[row * width + col];
    }

    public void set(int col, int row, int value) {
        values[row * width + col] = value;
    }

    public void fill(int value) {
        Arrays.fill(values, value);
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public GeoTransform getGeoTransform() {
        return geoTransform;
    }

    @Override
    public int getBlockWidth() {
        return blockWidth;
    }

    @Override
    public int getBlockHeight() {
        return blockHeight;
    }

    @Override
    public Palette getPalette() {
        return palette;
    }

    @Override
    public Double getNoData() {
        return noData;
    }

    @Override
    public BlockCoverage getDataCoverageStatus(int xOff, int yOff, int cols, int rows) {
        RasterSource.checkWindow(this, xOff, yOff, cols, rows);
        for (int y = yOff; y < yOff + rows; y++) {
            for (int x = xOff; x < xOff + cols; x++) {
                if (values[y * width + x] != 0) {
                    return BlockCoverage.DATA;
                }
            }
        }
        return BlockCoverage.EMPTY;
    }

    @Override
    public RasterBlock read(int xOff, int yOff, int cols, int rows) {
        RasterSource.checkWindow(this, xOff, yOff, cols, rows);
        int[] out = new int[cols * rows];
        for (int y = 0; y < rows; y++) {
            System.arraycopy(values, (yOff + y) * width + xOff, out, y * cols, cols);
        }
        return new RasterBlock(xOff, yOff, cols, rows, out);
    }

    @Override
    public void close() {
        // nothing to release
    }
}
