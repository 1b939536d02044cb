package ch.so.agi.rasterarea.raster;

import java.util.Locale;

/**
 * Linear geotransform of a raster, in the GDAL order
 * {@code (xOrigin, xPixelSize, xRotation, yOrigin, yRotation, yPixelSize)}.
 * The origin is the outer corner of the upper left pixel; for north-up rasters
 * {@code yPixelSize} is negative.
 */
public final class GeoTransform {
    private final double xOrigin;
    private final double xPixelSize;
    private final double xRotation;
    private final double yOrigin;
    private final double yRotation;
    private final double yPixelSize;

    public GeoTransform(double xOrigin, double xPixelSize, double xRotation,
            double yOrigin, double yRotation, double yPixelSize) {
        if (xPixelSize == 0 || yPixelSize == 0) {
            throw new IllegalArgumentException("Pixel size must not be zero");
        }
        this.xOrigin = xOrigin;
        this.xPixelSize = xPixelSize;
        this.xRotation = xRotation;
        this.yOrigin = yOrigin;
        this.yRotation = yRotation;
        this.yPixelSize = yPixelSize;
    }

    /**
     * Creates an unrotated geotransform.
     */
    public static GeoTransform of(double xOrigin, double xPixelSize, double yOrigin, double yPixelSize) {
        return new GeoTransform(xOrigin, xPixelSize, 0d, yOrigin, 0d, yPixelSize);
    }

    public double getXOrigin() {
        return xOrigin;
    }

    public double getXPixelSize() {
        return xPixelSize;
    }

    public double getXRotation() {
        return xRotation;
    }

    public double getYOrigin() {
        return yOrigin;
    }

    public double getYRotation() {
        return yRotation;
    }

    public double getYPixelSize() {
        return yPixelSize;
    }

    public boolean isRotated() {
        return xRotation != 0 || yRotation != 0;
    }

    /** X coordinate of the left edge of column {@code col}. */
    public double columnToX(double col) {
        return xOrigin + col * xPixelSize;
    }

    /** Y coordinate of the top edge of row {@code row}. */
    public double rowToY(double row) {
        return yOrigin + row * yPixelSize;
    }

    /**
     * Geotransform of a window of this raster starting at the given pixel.
     */
    public GeoTransform shift(int col, int row) {
        return new GeoTransform(columnToX(col), xPixelSize, xRotation, rowToY(row), yRotation, yPixelSize);
    }

    /**
     * @return the six coefficients in GDAL order
     */
    public double[] toArray() {
        return new double[] {xOrigin, xPixelSize, xRotation, yOrigin, yRotation, yPixelSize};
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "GeoTransform(%s, %s, %s, %s, %s, %s)",
                xOrigin, xPixelSize, xRotation, yOrigin, yRotation, yPixelSize);
    }
}
