package ch.so.agi.rasterarea.steps;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import ch.so.agi.rasterarea.boundary.BoundaryFeature;
import ch.so.agi.rasterarea.boundary.BoundaryLayer;
import ch.so.agi.rasterarea.boundary.RegionNameResolver;
import ch.so.agi.rasterarea.logging.AreaLogger;
import ch.so.agi.rasterarea.logging.LogEnvironment;
import ch.so.agi.rasterarea.lookup.ClassificationLookup;
import ch.so.agi.rasterarea.matrix.AggregationMatrix;
import ch.so.agi.rasterarea.raster.RasterOpener;
import ch.so.agi.rasterarea.raster.RasterSource;
import ch.so.agi.rasterarea.utils.RasterAreaException;

/**
 * Common run loop of the aggregation steps.
 * <p>
 * Features are visited in layer order. A feature whose {@code ADMIN} name does
 * not resolve is skipped; otherwise the region row is created and the feature
 * is handed to {@link #aggregateFeature}. With more than one worker the
 * features are dealt round-robin to a fixed thread pool. Every worker opens its
 * own source raster and fills its own matrix; the partial matrices are merged
 * once all workers are done. The first failing worker aborts the run.
 * </p>
 */
public abstract class AbstractAggregationStep {
    protected final AreaLogger log;
    protected final String taskName;
    private final RegionNameResolver nameResolver;
    private final RasterOpener rasterOpener;
    private int workers = 1;

    protected AbstractAggregationStep(String taskName, RegionNameResolver nameResolver, RasterOpener rasterOpener) {
        if (taskName == null) {
            this.taskName = this.getClass().getSimpleName();
        } else {
            this.taskName = taskName;
        }
        this.nameResolver = Objects.requireNonNull(nameResolver, "nameResolver");
        this.rasterOpener = Objects.requireNonNull(rasterOpener, "rasterOpener");
        this.log = LogEnvironment.getLogger(this.getClass());
    }

    public int getWorkers() {
        return workers;
    }

    /**
     * @param workers number of parallel workers, {@code 1} scans sequentially
     */
    public void setWorkers(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1: " + workers);
        }
        this.workers = workers;
    }

    protected RasterOpener getRasterOpener() {
        return rasterOpener;
    }

    /**
     * Aggregates the area of every classification key per region.
     *
     * @param rasterPath classification raster
     * @param layer      boundary polygons
     * @param lookup     classification of raw pixel values
     * @param <K>        classification key type
     * @return the filled matrix
     * @throws IOException         if the raster or a per-feature file cannot be read or written
     * @throws RasterAreaException on fatal domain failures, e.g. a missing mask
     */
    public <K> AggregationMatrix<K> execute(Path rasterPath, BoundaryLayer layer, ClassificationLookup<K> lookup)
            throws IOException {
        log.lifecycle(String.format("Start %s(Name: %s raster: %s features: %d workers: %d)",
                this.getClass().getSimpleName(), taskName, rasterPath, layer.getFeatures().size(), workers));

        AggregationMatrix<K> matrix = new AggregationMatrix<>(lookup.columns());
        List<BoundaryFeature> features = layer.getFeatures();
        if (workers <= 1 || features.size() <= 1) {
            try (RasterSource source = rasterOpener.open(rasterPath)) {
                aggregate(source, layer, features, lookup, matrix);
            }
        } else {
            executeParallel(rasterPath, layer, lookup, matrix);
        }

        log.lifecycle(String.format("Finished %s(Name: %s regions: %d)",
                this.getClass().getSimpleName(), taskName, matrix.regions().size()));
        return matrix;
    }

    private <K> void executeParallel(Path rasterPath, BoundaryLayer layer, ClassificationLookup<K> lookup,
            AggregationMatrix<K> matrix) throws IOException {
        List<BoundaryFeature> features = layer.getFeatures();
        int partitions = Math.min(workers, features.size());
        List<List<BoundaryFeature>> parts = new ArrayList<>();
        for (int i = 0; i < partitions; i++) {
            parts.add(new ArrayList<>());
        }
        for (int i = 0; i < features.size(); i++) {
            parts.get(i % partitions).add(features.get(i));
        }

        ExecutorService executor = Executors.newFixedThreadPool(partitions);
        List<Future<AggregationMatrix<K>>> futures = new ArrayList<>();
        try {
            for (List<BoundaryFeature> part : parts) {
                futures.add(executor.submit(() -> {
                    AggregationMatrix<K> partial = matrix.emptyCopy();
                    try (RasterSource source = rasterOpener.open(rasterPath)) {
                        aggregate(source, layer, part, lookup, partial);
                    }
                    return partial;
                }));
            }
            for (Future<AggregationMatrix<K>> future : futures) {
                matrix.mergeFrom(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RasterAreaException("Interrupted while aggregating " + rasterPath, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RasterAreaException("Worker failed while aggregating " + rasterPath, cause);
        } finally {
            for (Future<AggregationMatrix<K>> future : futures) {
                future.cancel(true);
            }
            executor.shutdownNow();
        }
    }

    private <K> void aggregate(RasterSource source, BoundaryLayer layer, List<BoundaryFeature> features,
            ClassificationLookup<K> lookup, AggregationMatrix<K> matrix) throws IOException {
        for (BoundaryFeature feature : features) {
            if (Thread.currentThread().isInterrupted()) {
                throw new RasterAreaException("Aggregation cancelled");
            }
            String region = nameResolver.lookup(feature.getAdmin());
            if (region == null) {
                log.debug("Skipping unresolved name '" + feature.getAdmin() + "' #" + feature.getFileStem());
                continue;
            }
            matrix.ensureRegion(region);
            aggregateFeature(source, layer, feature, region, lookup, matrix);
        }
    }

    /**
     * Adds the area of one feature to its region row.
     *
     * @param source  open source raster, owned by the calling worker
     * @param layer   layer the feature belongs to
     * @param feature the feature
     * @param region  resolved region name, its row already exists
     */
    protected abstract <K> void aggregateFeature(RasterSource source, BoundaryLayer layer, BoundaryFeature feature,
            String region, ClassificationLookup<K> lookup, AggregationMatrix<K> matrix) throws IOException;

    protected void logProcessing(String region, BoundaryFeature feature) {
        log.info(String.format(Locale.ROOT, "Processing %-41s #%s", region, feature.getFileStem()));
    }

    protected void logSkippingEmpty(String region, BoundaryFeature feature) {
        log.info(String.format(Locale.ROOT, "Skipping empty %-41s #%s", region, feature.getFileStem()));
    }
}
