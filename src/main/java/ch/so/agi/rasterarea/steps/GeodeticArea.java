package ch.so.agi.rasterarea.steps;

import java.util.Arrays;

import ch.so.agi.rasterarea.raster.GeoTransform;

/**
 * Surface area of geographic (degree) raster pixels on the WGS 84 ellipsoid.
 * <p>
 * Pixel width and height in degrees are constant for a raster; the physical
 * size only depends on the latitude of the pixel centre. The centre of the
 * first row is the top edge of the window minus half a pixel height, every
 * further row steps one pixel height southwards.
 * </p>
 */
public final class GeodeticArea {
    /** Equatorial radius in km. */
    static final double SEMI_MAJOR_AXIS_KM = 6378.137;
    static final double ECCENTRICITY_SQUARED = 0.00669437999014;

    private GeodeticArea() {}

    /**
     * Area of one pixel.
     *
     * @param xPixelSizeDeg pixel width in degrees, sign ignored
     * @param yPixelSizeDeg pixel height in degrees, sign ignored
     * @param centerLatRad  latitude of the pixel centre in radians
     * @return the area in km²
     */
    public static double pixelAreaKm2(double xPixelSizeDeg, double yPixelSizeDeg, double centerLatRad) {
        double sin = Math.sin(centerLatRad);
        // length of a degree of longitude
        double xlen = Math.abs(xPixelSizeDeg) * (Math.cos(centerLatRad) * Math.PI * SEMI_MAJOR_AXIS_KM
                / (180 * Math.sqrt(1 - ECCENTRICITY_SQUARED * sin * sin)));
        // length of a degree of latitude
        double ylen = Math.abs(yPixelSizeDeg) * (111.132954 - 0.559822 * Math.cos(2 * centerLatRad)
                + 0.001175 * Math.cos(4 * centerLatRad));
        return xlen * ylen;
    }

    /**
     * Pixel area of each row of a window.
     *
     * @param gt    geotransform of the raster
     * @param yOff  first row of the window
     * @param nrows number of rows
     * @return {@code nrows} areas in km², one per row
     */
    public static double[] rowAreas(GeoTransform gt, int yOff, int nrows) {
        if (nrows < 0) {
            throw new IllegalArgumentException("Row count must not be negative: " + nrows);
        }
        double yRad = Math.toRadians(Math.abs(gt.getYPixelSize()));
        double center = Math.toRadians(gt.rowToY(yOff)) - yRad / 2;
        double[] areas = new double[nrows];
        for (int i = 0; i < nrows; i++) {
            areas[i] = pixelAreaKm2(gt.getXPixelSize(), gt.getYPixelSize(), center);
            center -= yRad;
        }
        return areas;
    }

    /**
     * Pixel area grid of a block, the row areas repeated across the columns.
     *
     * @return {@code nrows × ncols} areas in km², row major
     */
    public static double[][] blockAreas(GeoTransform gt, int yOff, int nrows, int ncols) {
        double[] rows = rowAreas(gt, yOff, nrows);
        double[][] grid = new double[nrows][ncols];
        for (int i = 0; i < nrows; i++) {
            Arrays.fill(grid[i], rows[i]);
        }
        return grid;
    }
}
