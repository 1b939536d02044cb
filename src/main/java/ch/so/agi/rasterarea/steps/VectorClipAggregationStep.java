package ch.so.agi.rasterarea.steps;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.locationtech.jts.geom.Geometry;

import ch.so.agi.rasterarea.boundary.BoundaryFeature;
import ch.so.agi.rasterarea.boundary.BoundaryLayer;
import ch.so.agi.rasterarea.boundary.RegionNameResolver;
import ch.so.agi.rasterarea.boundary.ShapefileReader;
import ch.so.agi.rasterarea.boundary.ShapefileWriter;
import ch.so.agi.rasterarea.lookup.ClassificationLookup;
import ch.so.agi.rasterarea.matrix.AggregationMatrix;
import ch.so.agi.rasterarea.raster.GeoTiffRasterSource;
import ch.so.agi.rasterarea.raster.GeoTiffRasterWriter;
import ch.so.agi.rasterarea.raster.MemoryRaster;
import ch.so.agi.rasterarea.raster.RasterOpener;
import ch.so.agi.rasterarea.raster.RasterSource;
import ch.so.agi.rasterarea.utils.ScratchDirectory;

/**
 * Aggregates area by clipping the source raster to every region polygon.
 * <p>
 * For each feature a single-feature cutline shapefile
 * {@code {SOV_A3}_{index}_feature_mask.shp} is written to the scratch
 * directory, the raster is cropped to it and the clip is stored as
 * {@code {SOV_A3}_{index}_feature.tif}. The clip is closed after writing and
 * reopened for a row by row scan: each row contributes
 * {@code count × row area} per distinct pixel value. Scratch files are deleted
 * once the feature is done.
 * </p>
 */
public class VectorClipAggregationStep extends AbstractAggregationStep {
    private final ScratchDirectory scratch;
    private final boolean allTouched;

    /**
     * @param taskName     label used in lifecycle log messages, the class name if {@code null}
     * @param nameResolver canonicalises {@code ADMIN} names
     * @param rasterOpener opens the source raster, once per worker
     * @param scratch      run scoped directory for cutlines and clips
     * @param allTouched   include every pixel the polygon touches instead of centre-inside pixels
     */
    public VectorClipAggregationStep(String taskName, RegionNameResolver nameResolver, RasterOpener rasterOpener,
            ScratchDirectory scratch, boolean allTouched) {
        super(taskName, nameResolver, rasterOpener);
        this.scratch = Objects.requireNonNull(scratch, "scratch");
        this.allTouched = allTouched;
    }

    public boolean isAllTouched() {
        return allTouched;
    }

    @Override
    protected <K> void aggregateFeature(RasterSource source, BoundaryLayer layer, BoundaryFeature feature,
            String region, ClassificationLookup<K> lookup, AggregationMatrix<K> matrix) throws IOException {
        String stem = feature.getFileStem();
        Path cutlinePath = scratch.resolve(stem + "_feature_mask.shp");
        Path clipPath = scratch.resolve(stem + "_feature.tif");
        List<Path> cutlineFiles = ShapefileWriter.componentFiles(cutlinePath);
        try {
            ShapefileWriter.write(layer.single(feature), cutlinePath);
            Geometry cutline = new ShapefileReader(feature.getGeometry().getFactory())
                    .read(cutlinePath).getFeatures().get(0).getGeometry();

            MemoryRaster clip = RasterWarp.clipToCutline(source, cutline, allTouched);
            if (clip == null) {
                logSkippingEmpty(region, feature);
                return;
            }
            GeoTiffRasterWriter.write(clip, clipPath);

            logProcessing(region, feature);
            try (RasterSource clipped = GeoTiffRasterSource.open(clipPath)) {
                scanRows(clipped, region, lookup, matrix);
            }
        } finally {
            scratch.delete(cutlineFiles.toArray(new Path[0]));
            scratch.delete(clipPath);
        }
    }

    /**
     * Adds {@code count × row area} for every distinct value of every row.
     */
    static <K> void scanRows(RasterSource raster, String region, ClassificationLookup<K> lookup,
            AggregationMatrix<K> matrix) throws IOException {
        int width = raster.getWidth();
        double[] rowAreas = GeodeticArea.rowAreas(raster.getGeoTransform(), 0, raster.getHeight());
        Map<Integer, int[]> counts = new HashMap<>();
        for (int y = 0; y < raster.getHeight(); y++) {
            counts.clear();
            int[] values = raster.read(0, y, width, 1).row(0);
            for (int value : values) {
                counts.computeIfAbsent(value, v -> new int[1])[0]++;
            }
            for (Map.Entry<Integer, int[]> e : counts.entrySet()) {
                K key = lookup.classify(e.getKey());
                if (key != null) {
                    matrix.add(region, key, e.getValue()[0] * rowAreas[y]);
                }
            }
        }
    }
}
