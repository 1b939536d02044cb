package ch.so.agi.rasterarea.raster;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import mil.nga.tiff.FieldTagType;

/**
 * Tests for {@link GeoTiffRasterWriter} and {@link GeoTiffRasterSource}.
 */
class GeoTiffRasterWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void roundTripKeepsGridAndValues() throws Exception {
        GeoTransform gt = GeoTransform.of(-73.5, 0.25, 12.75, -0.25);
        MemoryRaster raster = MemoryRaster.of(new int[][] {
            {1, 2, 3},
            {0, 7, 255},
        }, gt);
        Path tif = tempDir.resolve("clip.tif");

        GeoTiffRasterWriter.write(raster, tif);

        assertTrue(Files.exists(tif));
        try (GeoTiffRasterSource read = GeoTiffRasterSource.open(tif)) {
            assertEquals(3, read.getWidth());
            assertEquals(2, read.getHeight());
            assertEquals(-73.5, read.getGeoTransform().getXOrigin(), 1e-12);
            assertEquals(0.25, read.getGeoTransform().getXPixelSize(), 1e-12);
            assertEquals(12.75, read.getGeoTransform().getYOrigin(), 1e-12);
            assertEquals(-0.25, read.getGeoTransform().getYPixelSize(), 1e-12);
            assertNull(read.getPalette());

            RasterBlock block = read.read(0, 0, 3, 2);
            assertEquals(1, block.get(0, 0));
            assertEquals(3, block.get(2, 0));
            assertEquals(0, block.get(0, 1));
            assertEquals(255, block.get(2, 1));

            RasterBlock window = read.read(1, 1, 2, 1);
            assertArrayEquals(new int[] {7, 255}, window.row(0));

            assertEquals(BlockCoverage.DATA, read.getDataCoverageStatus(0, 0, 3, 2));
            assertTrue(read.getBlockHeight() >= 1 && read.getBlockHeight() <= 2);
            assertEquals(3, read.getBlockWidth());
        }
    }

    @Test
    void roundTripKeepsSignedValues() throws Exception {
        MemoryRaster raster = MemoryRaster.of(new int[][] {{-9999, 12}, {40000, 1}}, GeoTransform.of(0d, 1d, 0d, -1d));
        Path tif = tempDir.resolve("signed.tif");

        GeoTiffRasterWriter.write(raster, tif);

        try (GeoTiffRasterSource read = GeoTiffRasterSource.open(tif)) {
            RasterBlock block = read.read(0, 0, 2, 2);
            assertEquals(-9999, block.get(0, 0));
            assertEquals(40000, block.get(0, 1));
        }
    }

    @Test
    void roundTripKeepsPalette() throws Exception {
        Palette palette = Palette.ofRgb(new int[] {255, 255, 255}, new int[] {0, 0, 255}, new int[] {178, 178, 178});
        MemoryRaster raster = MemoryRaster.of(new int[][] {{0, 1, 2}}, GeoTransform.of(0d, 1d, 1d, -1d))
                .withPalette(palette);
        Path tif = tempDir.resolve("palette.tif");

        GeoTiffRasterWriter.write(raster, tif);

        try (GeoTiffRasterSource read = GeoTiffRasterSource.open(tif)) {
            Palette readPalette = read.getPalette();
            assertNotNull(readPalette);
            assertEquals(3, readPalette.size());
            assertArrayEquals(new int[] {0, 0, 255, 255}, readPalette.getColorEntry(1));
            assertArrayEquals(new int[] {178, 178, 178, 255}, readPalette.getColorEntry(2));
        }
    }

    @Test
    void roundTripKeepsNoData() throws Exception {
        assumeTrue(FieldTagType.getById(GeoTiffRasterSource.TAG_GDAL_NODATA) != null,
                "GDAL_NODATA tag not known to the TIFF library");
        MemoryRaster raster = MemoryRaster.of(new int[][] {{255, 1}}, GeoTransform.of(0d, 1d, 1d, -1d))
                .withNoData(255d);
        Path tif = tempDir.resolve("nodata.tif");

        GeoTiffRasterWriter.write(raster, tif);

        try (GeoTiffRasterSource read = GeoTiffRasterSource.open(tif)) {
            assertEquals(Double.valueOf(255d), read.getNoData());
        }
    }

    @Test
    void rotatedGridIsRejected() {
        MemoryRaster raster = new MemoryRaster(1, 1, new GeoTransform(0d, 1d, 0.1, 0d, 0d, -1d));
        assertThrows(IOException.class, () -> GeoTiffRasterWriter.write(raster, tempDir.resolve("r.tif")));
    }

    @Test
    void missingFileIsReported() {
        assertThrows(NoSuchFileException.class, () -> GeoTiffRasterSource.open(tempDir.resolve("absent.tif")));
    }

    @Test
    void closedRasterCannotBeRead() throws Exception {
        Path tif = tempDir.resolve("closed.tif");
        GeoTiffRasterWriter.write(MemoryRaster.of(new int[][] {{1}}, GeoTransform.of(0d, 1d, 1d, -1d)), tif);
        GeoTiffRasterSource read = GeoTiffRasterSource.open(tif);
        read.close();
        assertThrows(IOException.class, () -> read.read(0, 0, 1, 1));
    }
}
