package ch.so.agi.rasterarea.raster;

/**
 * Window of single band integer pixel values read from a {@link RasterSource}.
 * Values are stored row major.
 */
public final class RasterBlock {
    private final int xOffset;
    private final int yOffset;
    private final int width;
    private final int height;
    private final int[] values;

    public RasterBlock(int xOffset, int yOffset, int width, int height, int[] values) {
        if (values.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " values, got " + values.length);
        }
        this.xOffset = xOffset;
        this.yOffset = yOffset;
        this.width = width;
        this.height = height;
        this.values = values;
    }

    public int getXOffset() {
        return xOffset;
    }

    public int getYOffset() {
        return yOffset;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @param col column within the block
     * @param row row within the block
     */
    public int get(int col, int row) {
        return values[row * width + col];
    }

    /**
     * Copies one row of the block.
     */
    public int[] row(int row) {
        int[] out = new int[width];
        System.arraycopy(values, row * width, out, 0, width);
        return out;
    }
}
