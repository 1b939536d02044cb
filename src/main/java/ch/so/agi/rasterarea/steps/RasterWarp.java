package ch.so.agi.rasterarea.steps;

import java.io.IOException;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

import ch.so.agi.rasterarea.raster.GeoTransform;
import ch.so.agi.rasterarea.raster.MemoryRaster;
import ch.so.agi.rasterarea.raster.RasterBlock;
import ch.so.agi.rasterarea.raster.RasterSource;
import ch.so.agi.rasterarea.utils.RasterAreaException;

/**
 * Crops a raster to the envelope of a cutline polygon and blanks every pixel
 * outside the polygon.
 * <p>
 * A pixel is kept when its centre lies inside the polygon or, with
 * {@code allTouched}, when its cell overlaps the polygon interior. Blanked
 * pixels get the nodata value of the source, {@code 0} if it declares none.
 * The clip keeps the palette and nodata value of the source.
 * </p>
 * <p>
 * A source without a {@code GDAL_NODATA} tag is blanked with {@code 0}. The
 * greyscale, coded and palette lookups drop {@code 0}, but a
 * {@link ch.so.agi.rasterarea.lookup.BucketLookup} counts it as its first
 * bucket, so bucket rasters must declare their nodata value ({@code 255}).
 * </p>
 */
public final class RasterWarp {

    private RasterWarp() {}

    /**
     * @param source     raster to clip, must not be rotated
     * @param cutline    polygonal cutline in the raster's coordinates
     * @param allTouched include every pixel the polygon touches
     * @return the clip, or {@code null} if the cutline does not overlap the raster
     * @throws IOException if the source cannot be read
     */
    public static MemoryRaster clipToCutline(RasterSource source, Geometry cutline, boolean allTouched) throws IOException {
        GeoTransform gt = source.getGeoTransform();
        if (gt.isRotated()) {
            throw new RasterAreaException("ROTATED", "Cannot clip a raster with a rotated geotransform: " + gt);
        }
        if (cutline.isEmpty()) {
            return null;
        }
        Envelope env = cutline.getEnvelopeInternal();
        double colA = (env.getMinX() - gt.getXOrigin()) / gt.getXPixelSize();
        double colB = (env.getMaxX() - gt.getXOrigin()) / gt.getXPixelSize();
        double rowA = (env.getMaxY() - gt.getYOrigin()) / gt.getYPixelSize();
        double rowB = (env.getMinY() - gt.getYOrigin()) / gt.getYPixelSize();
        int col0 = Math.max(0, (int) Math.floor(Math.min(colA, colB)));
        int col1 = Math.min(source.getWidth(), (int) Math.ceil(Math.max(colA, colB)));
        int row0 = Math.max(0, (int) Math.floor(Math.min(rowA, rowB)));
        int row1 = Math.min(source.getHeight(), (int) Math.ceil(Math.max(rowA, rowB)));
        int cols = col1 - col0;
        int rows = row1 - row0;
        if (cols <= 0 || rows <= 0) {
            return null;
        }

        Double noData = source.getNoData();
        int fill = noData == null ? 0 : (int) Math.round(noData);
        GeoTransform clipGt = gt.shift(col0, row0);
        MemoryRaster clip = new MemoryRaster(cols, rows, clipGt)
                .withPalette(source.getPalette())
                .withNoData(noData);

        GeometryFactory gf = cutline.getFactory();
        PreparedGeometry prepared = PreparedGeometryFactory.prepare(cutline);
        for (int y = 0; y < rows; y++) {
            RasterBlock row = source.read(col0, row0 + y, cols, 1);
            double top = clipGt.rowToY(y);
            double bottom = clipGt.rowToY(y + 1);
            for (int x = 0; x < cols; x++) {
                double left = clipGt.columnToX(x);
                double right = clipGt.columnToX(x + 1);
                boolean keep = isIncluded(prepared, gf, left, right, top, bottom, allTouched);
                clip.set(x, y, keep ? row.get(x, 0) : fill);
            }
        }
        return clip;
    }

    private static boolean isIncluded(PreparedGeometry prepared, GeometryFactory gf,
            double left, double right, double top, double bottom, boolean allTouched) {
        Point centre = gf.createPoint(new Coordinate((left + right) / 2, (top + bottom) / 2));
        if (!allTouched) {
            return prepared.intersects(centre);
        }
        if (prepared.containsProperly(centre)) {
            return true;
        }
        Geometry cell = gf.toGeometry(new Envelope(left, right, top, bottom));
        // a cell only sharing an edge or a corner with the polygon is not touched
        return prepared.intersects(cell) && !prepared.touches(cell);
    }
}
