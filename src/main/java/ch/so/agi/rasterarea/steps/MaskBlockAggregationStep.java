package ch.so.agi.rasterarea.steps;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import ch.so.agi.rasterarea.boundary.BoundaryFeature;
import ch.so.agi.rasterarea.boundary.BoundaryLayer;
import ch.so.agi.rasterarea.boundary.RegionNameResolver;
import ch.so.agi.rasterarea.lookup.ClassificationLookup;
import ch.so.agi.rasterarea.matrix.AggregationMatrix;
import ch.so.agi.rasterarea.raster.BlockCoverage;
import ch.so.agi.rasterarea.raster.RasterBlock;
import ch.so.agi.rasterarea.raster.RasterOpener;
import ch.so.agi.rasterarea.raster.RasterSource;
import ch.so.agi.rasterarea.utils.RasterAreaException;

/**
 * Aggregates area with precomputed per-region mask rasters.
 * <p>
 * The mask of a feature is {@code {maskDirectory}/{SOV_A3}_{index}_1km_mask.tif}
 * and must have the grid of the source raster. The source is walked in its
 * native blocks, edge blocks truncated. Blocks the mask stores no data for are
 * skipped without reading pixels. Pixels outside the mask are recoded to
 * {@link ClassificationLookup#NO_DATA}; the block areas are summed per distinct
 * value and each value is classified once.
 * </p>
 */
public class MaskBlockAggregationStep extends AbstractAggregationStep {
    static final String MASK_SUFFIX = "_1km_mask.tif";

    private final Path maskDirectory;
    private boolean skipSparseBlocks = true;

    /**
     * @param taskName      label used in lifecycle log messages, the class name if {@code null}
     * @param nameResolver  canonicalises {@code ADMIN} names
     * @param rasterOpener  opens the source raster and the masks
     * @param maskDirectory directory holding the region masks
     */
    public MaskBlockAggregationStep(String taskName, RegionNameResolver nameResolver, RasterOpener rasterOpener,
            Path maskDirectory) {
        super(taskName, nameResolver, rasterOpener);
        this.maskDirectory = Objects.requireNonNull(maskDirectory, "maskDirectory");
    }

    public boolean isSkipSparseBlocks() {
        return skipSparseBlocks;
    }

    /**
     * @param skipSparseBlocks whether blocks without stored mask data are skipped; totals are the same either way
     */
    public void setSkipSparseBlocks(boolean skipSparseBlocks) {
        this.skipSparseBlocks = skipSparseBlocks;
    }

    /**
     * @return path of the mask raster of {@code feature}
     */
    public Path maskPath(BoundaryFeature feature) {
        return maskDirectory.resolve(feature.getFileStem() + MASK_SUFFIX);
    }

    @Override
    protected <K> void aggregateFeature(RasterSource source, BoundaryLayer layer, BoundaryFeature feature,
            String region, ClassificationLookup<K> lookup, AggregationMatrix<K> matrix) throws IOException {
        logProcessing(region, feature);
        Path maskPath = maskPath(feature);
        RasterSource mask;
        try {
            mask = getRasterOpener().open(maskPath);
        } catch (NoSuchFileException e) {
            throw new RasterAreaException("MISSING_MASK", "Mask raster not found: " + maskPath);
        } catch (IOException e) {
            throw new RasterAreaException("Cannot open mask raster " + maskPath, e);
        }
        try (RasterSource m = mask) {
            if (m.getWidth() != source.getWidth() || m.getHeight() != source.getHeight()) {
                throw new RasterAreaException("GRID_MISMATCH", "Mask " + maskPath.getFileName() + " is "
                        + m.getWidth() + "x" + m.getHeight() + ", raster is "
                        + source.getWidth() + "x" + source.getHeight());
            }
            scanBlocks(source, m, region, lookup, matrix);
        }
    }

    private <K> void scanBlocks(RasterSource source, RasterSource mask, String region,
            ClassificationLookup<K> lookup, AggregationMatrix<K> matrix) throws IOException {
        int width = source.getWidth();
        int height = source.getHeight();
        int blockWidth = source.getBlockWidth();
        int blockHeight = source.getBlockHeight();
        int skipped = 0;
        for (int y = 0; y < height; y += blockHeight) {
            int nrows = blockLimit(y, blockHeight, height);
            for (int x = 0; x < width; x += blockWidth) {
                int ncols = blockLimit(x, blockWidth, width);
                if (skipSparseBlocks && mask.getDataCoverageStatus(x, y, ncols, nrows) == BlockCoverage.EMPTY) {
                    skipped++;
                    continue;
                }
                aggregateBlock(source, mask, x, y, ncols, nrows, region, lookup, matrix);
            }
        }
        if (skipped > 0 && log.isDebugEnabled()) {
            log.debug("Skipped " + skipped + " empty mask blocks for " + region);
        }
    }

    private <K> void aggregateBlock(RasterSource source, RasterSource mask, int x, int y, int ncols, int nrows,
            String region, ClassificationLookup<K> lookup, AggregationMatrix<K> matrix) throws IOException {
        RasterBlock block = source.read(x, y, ncols, nrows);
        RasterBlock inside = mask.read(x, y, ncols, nrows);
        double[][] km2 = GeodeticArea.blockAreas(mask.getGeoTransform(), y, nrows, ncols);

        Map<Integer, double[]> areaByValue = new HashMap<>();
        for (int row = 0; row < nrows; row++) {
            for (int col = 0; col < ncols; col++) {
                int value = inside.get(col, row) != 0 ? block.get(col, row) : ClassificationLookup.NO_DATA;
                areaByValue.computeIfAbsent(value, v -> new double[1])[0] += km2[row][col];
            }
        }
        for (Map.Entry<Integer, double[]> e : areaByValue.entrySet()) {
            K key = lookup.classify(e.getKey());
            if (key != null) {
                matrix.add(region, key, e.getValue()[0]);
            }
        }
    }

    /**
     * @return the block extent, truncated at the raster edge
     */
    static int blockLimit(int coord, int blockSize, int totalSize) {
        return coord + blockSize < totalSize ? blockSize : totalSize - coord;
    }
}
