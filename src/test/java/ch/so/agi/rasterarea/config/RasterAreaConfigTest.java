package ch.so.agi.rasterarea.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import ch.so.agi.rasterarea.lookup.LookupKind;

/**
 * Tests for {@link RasterAreaConfig}.
 */
class RasterAreaConfigTest {

    @TempDir
    Path tempDir;

    private static RasterAreaConfig parse(String hocon) {
        Config config = ConfigFactory.parseString(hocon).withFallback(ConfigFactory.defaultReference()).resolve();
        return RasterAreaConfig.fromConfig(config);
    }

    @Test
    void defaultsListEveryDataset() {
        RasterAreaConfig config = parse("");

        assertEquals(9, config.getDatasets("land-cover").size());
        assertEquals(2, config.getDatasets("climate").size());
        assertEquals(1, config.getDatasets("slope").size());
        assertEquals(1, config.getDatasets("workability").size());
        assertEquals(1, config.getWorkers());
        assertTrue(config.isSkipSparseBlocks());
        assertNull(config.getAdminNames());
        assertEquals(Paths.get("masks"), config.getMaskDirectory());
        assertEquals("Country", config.getOutputFormat().getIndexLabel());
        assertEquals(2, config.getOutputFormat().getDecimalPlaces());
        assertEquals(',', config.getOutputFormat().getDelimiter());
    }

    @Test
    void defaultDatasetsCarryTheirMethods() {
        RasterAreaConfig config = parse("");

        DatasetDefinition fao = config.getDatasets("land-cover").get(0);
        assertEquals(LookupKind.FAO_LAND_COVER, fao.getLookup());
        assertEquals(AggregationMethod.MASK_BLOCK, fao.getMethod());
        assertFalse(fao.isSkipIfMissing());

        DatasetDefinition esa = config.getDatasets("land-cover").get(1);
        assertEquals(LookupKind.ESA_LCCS, esa.getLookup());
        assertEquals(AggregationMethod.VECTOR_CLIP, esa.getMethod());
        assertTrue(esa.isSkipIfMissing());
        assertTrue(esa.isAllTouched());

        for (DatasetDefinition climate : config.getDatasets("climate")) {
            assertEquals(LookupKind.KOPPEN_GEIGER, climate.getLookup());
            assertEquals(AggregationMethod.MASK_BLOCK, climate.getMethod());
        }

        DatasetDefinition workability = config.getDatasets("workability").get(0);
        assertFalse(workability.isAllTouched());
        assertEquals("Workability-by-country.csv", workability.getOutput());
    }

    @Test
    void overridesReplaceDefaults() {
        RasterAreaConfig config = parse(String.join("\n",
                "raster-area {",
                "  workers = 4",
                "  admin-names = \"names.csv\"",
                "  skip-sparse-blocks = false",
                "  output.delimiter = \";\"",
                "  datasets.slope = [",
                "    { raster = \"s.tif\", output = \"s.csv\", lookup = GAEZ-Slope, method = mask-block, all-touched = false }",
                "  ]",
                "}"));

        assertEquals(4, config.getWorkers());
        assertEquals(Paths.get("names.csv"), config.getAdminNames());
        assertFalse(config.isSkipSparseBlocks());
        assertEquals(';', config.getOutputFormat().getDelimiter());
        List<DatasetDefinition> slope = config.getDatasets("slope");
        assertEquals(1, slope.size());
        assertEquals(Paths.get("s.tif"), slope.get(0).getRaster());
        assertEquals(LookupKind.GAEZ_SLOPE, slope.get(0).getLookup());
        assertEquals(AggregationMethod.MASK_BLOCK, slope.get(0).getMethod());
        assertFalse(slope.get(0).isAllTouched());
        assertEquals("slope", slope.get(0).getGroup());
    }

    @Test
    void unknownMethodIsBadValue() {
        assertThrows(ConfigException.BadValue.class, () -> parse(
                "raster-area.datasets.slope = [ { raster = a.tif, output = a.csv, lookup = gaez-slope, method = warp } ]"));
    }

    @Test
    void unknownLookupIsBadValue() {
        assertThrows(ConfigException.BadValue.class, () -> parse(
                "raster-area.datasets.slope = [ { raster = a.tif, output = a.csv, lookup = soil, method = vector-clip } ]"));
    }

    @Test
    void workersBelowOneAreBadValue() {
        assertThrows(ConfigException.BadValue.class, () -> parse("raster-area.workers = 0"));
    }

    @Test
    void multiCharacterDelimiterIsBadValue() {
        assertThrows(ConfigException.BadValue.class, () -> parse("raster-area.output.delimiter = \";;\""));
    }

    @Test
    void loadsOverridesFromFile() throws Exception {
        Path file = tempDir.resolve("run.conf");
        Files.write(file, List.of(
                "raster-area.results-directory = \"out\"",
                "raster-area.workers = 2"), StandardCharsets.UTF_8);

        RasterAreaConfig config = RasterAreaConfig.load(file.toFile());

        assertEquals(Paths.get("out"), config.getResultsDirectory());
        assertEquals(2, config.getWorkers());
        assertEquals(9, config.getDatasets("land-cover").size());
    }

    @Test
    void missingFileIsReported() {
        File missing = tempDir.resolve("missing.conf").toFile();

        assertThrows(ConfigException.class, () -> RasterAreaConfig.load(missing));
    }

    @Test
    void withWorkersKeepsEverythingElse() {
        RasterAreaConfig config = parse("");
        RasterAreaConfig eight = config.withWorkers(8);

        assertEquals(8, eight.getWorkers());
        assertEquals(1, config.getWorkers());
        assertEquals(config.getBoundaries(), eight.getBoundaries());
        assertSame(config.getDatasets("climate"), eight.getDatasets("climate"));
        assertThrows(IllegalArgumentException.class, () -> config.withWorkers(0));
    }

    @Test
    void unknownGroupIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> parse("").getDatasets("soil"));
    }
}
