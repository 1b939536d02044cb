package ch.so.agi.rasterarea;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import com.typesafe.config.ConfigException;

import ch.so.agi.rasterarea.boundary.BoundaryLayer;
import ch.so.agi.rasterarea.boundary.MappingRegionNameResolver;
import ch.so.agi.rasterarea.boundary.RegionNameResolver;
import ch.so.agi.rasterarea.boundary.ShapefileReader;
import ch.so.agi.rasterarea.config.DatasetDefinition;
import ch.so.agi.rasterarea.config.RasterAreaConfig;
import ch.so.agi.rasterarea.logging.AreaLogger;
import ch.so.agi.rasterarea.logging.Level;
import ch.so.agi.rasterarea.logging.LogEnvironment;
import ch.so.agi.rasterarea.tasks.AggregateDatasetTask;
import ch.so.agi.rasterarea.utils.RasterAreaException;
import ch.so.agi.rasterarea.utils.ScratchDirectory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

/**
 * Command line entry point: aggregates the selected dataset groups and writes
 * one table per dataset.
 */
@Command(
    name = "raster-area",
    mixinStandardHelpOptions = true,
    version = "raster-area 1.0",
    description = "Area of raster classes per country, written as CSV tables."
)
public class RasterAreaCli implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--lc", description = "process land cover")
    boolean landCover;

    @Option(names = "--kg", description = "process Köppen-Geiger")
    boolean climate;

    @Option(names = "--sl", description = "process slope")
    boolean slope;

    @Option(names = "--wk", description = "process workability")
    boolean workability;

    @Option(names = "--all", description = "process all")
    boolean all;

    @Option(names = {"-c", "--config"}, description = "configuration file overriding the defaults")
    File configFile;

    @Option(names = "--workers", description = "number of parallel workers (default: from configuration)")
    Integer workers;

    @Option(names = "--log-level", defaultValue = "info",
            description = "error, lifecycle, info or debug (default: ${DEFAULT-VALUE})")
    String logLevel;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RasterAreaCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        List<String> groups = selectedGroups();
        if (groups.isEmpty()) {
            PrintWriter out = spec.commandLine().getOut();
            out.println("Select one of: --lc, --kg, --sl, --wk, --all");
            spec.commandLine().usage(out);
            return 0;
        }

        try {
            LogEnvironment.initCommandLine(Level.forName(logLevel));
        } catch (IOException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("Cannot initialise logging: " + e.getMessage());
            return 1;
        }
        AreaLogger log = LogEnvironment.getLogger(RasterAreaCli.class);

        RasterAreaConfig config;
        try {
            config = RasterAreaConfig.load(configFile);
        } catch (ConfigException e) {
            log.error("Failed to load configuration", e);
            return 1;
        }

        try (ScratchDirectory scratch = ScratchDirectory.create()) {
            run(config, groups, scratch, log);
            return 0;
        } catch (IOException | RasterAreaException | IllegalArgumentException e) {
            log.error("Aggregation failed: " + e.getMessage(), e);
            return 1;
        }
    }

    private void run(RasterAreaConfig config, List<String> groups, ScratchDirectory scratch, AreaLogger log)
            throws IOException {
        BoundaryLayer boundaries = new ShapefileReader().read(config.getBoundaries());
        RegionNameResolver resolver = config.getAdminNames() == null
                ? RegionNameResolver.identity()
                : MappingRegionNameResolver.load(config.getAdminNames());
        log.lifecycle("Read " + boundaries.getFeatures().size() + " boundary features from " + config.getBoundaries());

        RasterAreaConfig effective = workers == null ? config : config.withWorkers(workers);
        AggregateDatasetTask task = new AggregateDatasetTask(effective, boundaries, resolver, scratch);
        for (String group : groups) {
            for (DatasetDefinition dataset : effective.getDatasets(group)) {
                task.execute(dataset);
            }
        }
    }

    List<String> selectedGroups() {
        List<String> groups = new ArrayList<>();
        if (landCover || all) {
            groups.add("land-cover");
        }
        if (climate || all) {
            groups.add("climate");
        }
        if (slope || all) {
            groups.add("slope");
        }
        if (workability || all) {
            groups.add("workability");
        }
        return groups;
    }
}
