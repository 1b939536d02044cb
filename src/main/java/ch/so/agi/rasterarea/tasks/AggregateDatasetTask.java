package ch.so.agi.rasterarea.tasks;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import ch.so.agi.rasterarea.boundary.BoundaryLayer;
import ch.so.agi.rasterarea.boundary.RegionNameResolver;
import ch.so.agi.rasterarea.config.AggregationMethod;
import ch.so.agi.rasterarea.config.DatasetDefinition;
import ch.so.agi.rasterarea.config.RasterAreaConfig;
import ch.so.agi.rasterarea.logging.AreaLogger;
import ch.so.agi.rasterarea.logging.LogEnvironment;
import ch.so.agi.rasterarea.lookup.ClassificationLookup;
import ch.so.agi.rasterarea.matrix.AggregationMatrix;
import ch.so.agi.rasterarea.matrix.MatrixCsvWriter;
import ch.so.agi.rasterarea.raster.RasterOpener;
import ch.so.agi.rasterarea.raster.RasterSource;
import ch.so.agi.rasterarea.steps.AbstractAggregationStep;
import ch.so.agi.rasterarea.steps.MaskBlockAggregationStep;
import ch.so.agi.rasterarea.steps.VectorClipAggregationStep;
import ch.so.agi.rasterarea.utils.RasterAreaException;
import ch.so.agi.rasterarea.utils.ScratchDirectory;

/**
 * Aggregates one configured dataset and writes its result table to the
 * results directory.
 */
public class AggregateDatasetTask {
    private final AreaLogger log;
    private final RasterAreaConfig config;
    private final BoundaryLayer boundaries;
    private final RegionNameResolver nameResolver;
    private final ScratchDirectory scratch;
    private final RasterOpener rasterOpener;

    public AggregateDatasetTask(RasterAreaConfig config, BoundaryLayer boundaries, RegionNameResolver nameResolver,
            ScratchDirectory scratch) {
        this(config, boundaries, nameResolver, scratch, RasterOpener.geoTiff());
    }

    public AggregateDatasetTask(RasterAreaConfig config, BoundaryLayer boundaries, RegionNameResolver nameResolver,
            ScratchDirectory scratch, RasterOpener rasterOpener) {
        this.config = Objects.requireNonNull(config, "config");
        this.boundaries = Objects.requireNonNull(boundaries, "boundaries");
        this.nameResolver = Objects.requireNonNull(nameResolver, "nameResolver");
        this.scratch = Objects.requireNonNull(scratch, "scratch");
        this.rasterOpener = Objects.requireNonNull(rasterOpener, "rasterOpener");
        this.log = LogEnvironment.getLogger(AggregateDatasetTask.class);
    }

    /**
     * Runs the dataset.
     *
     * @param dataset the dataset to aggregate
     * @return the written table, {@code null} if the raster is missing and may be skipped
     * @throws RasterAreaException if the dataset cannot be processed
     */
    public Path execute(DatasetDefinition dataset) {
        Path raster = dataset.getRaster();
        if (dataset.isSkipIfMissing() && !Files.exists(raster)) {
            log.info("Skipping missing " + raster);
            return null;
        }
        log.lifecycle("Dataset " + raster);

        Path target = config.getResultsDirectory().resolve(dataset.getOutput());
        try {
            ClassificationLookup<?> lookup;
            try (RasterSource source = rasterOpener.open(raster)) {
                lookup = dataset.getLookup().create(source);
            }
            AggregationMatrix<?> matrix = aggregate(createStep(dataset), dataset, lookup);
            new MatrixCsvWriter(config.getOutputFormat()).write(matrix, target);
        } catch (IOException e) {
            log.error("Failed to aggregate " + raster, e);
            throw new RasterAreaException("Failed to aggregate " + raster, e);
        }
        log.info("Wrote " + target);
        return target;
    }

    private <K> AggregationMatrix<K> aggregate(AbstractAggregationStep step, DatasetDefinition dataset,
            ClassificationLookup<K> lookup) throws IOException {
        return step.execute(dataset.getRaster(), boundaries, lookup);
    }

    AbstractAggregationStep createStep(DatasetDefinition dataset) {
        String taskName = dataset.getGroup() + ":" + dataset.getOutput();
        AbstractAggregationStep step;
        if (dataset.getMethod() == AggregationMethod.MASK_BLOCK) {
            MaskBlockAggregationStep maskStep = new MaskBlockAggregationStep(taskName, nameResolver, rasterOpener,
                    config.getMaskDirectory());
            maskStep.setSkipSparseBlocks(config.isSkipSparseBlocks());
            step = maskStep;
        } else {
            step = new VectorClipAggregationStep(taskName, nameResolver, rasterOpener, scratch,
                    dataset.isAllTouched());
        }
        step.setWorkers(config.getWorkers());
        return step;
    }
}
