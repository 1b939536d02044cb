package ch.so.agi.rasterarea.steps;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import ch.so.agi.rasterarea.lookup.BucketLookup;
import ch.so.agi.rasterarea.raster.GeoTransform;
import ch.so.agi.rasterarea.raster.MemoryRaster;
import ch.so.agi.rasterarea.raster.Palette;

/**
 * Tests for {@link RasterWarp}.
 */
class RasterWarpTest {
    private final GeometryFactory gf = new GeometryFactory();

    private MemoryRaster fives() {
        MemoryRaster raster = new MemoryRaster(4, 4, GeoTransform.of(0d, 1d, 4d, -1d));
        raster.fill(5);
        return raster;
    }

    @Test
    void cropsToCutlineEnvelope() throws Exception {
        MemoryRaster clip = RasterWarp.clipToCutline(fives(), rectangle(0.6, 0.6, 2.4, 3.4), false);

        assertNotNull(clip);
        assertEquals(3, clip.getWidth());
        assertEquals(4, clip.getHeight());
        assertEquals(0d, clip.getGeoTransform().getXOrigin(), 1e-12);
        assertEquals(4d, clip.getGeoTransform().getYOrigin(), 1e-12);
    }

    @Test
    void keepsPixelsWithCentreInside() throws Exception {
        MemoryRaster clip = RasterWarp.clipToCutline(fives(), rectangle(0.6, 0.6, 2.4, 3.4), false);

        assertEquals(2, count(clip, 5));
        assertEquals(5, clip.get(1, 1));
        assertEquals(5, clip.get(1, 2));
        assertEquals(0, clip.get(0, 1), "blanked pixels get 0 without nodata");
    }

    @Test
    void allTouchedKeepsEveryOverlappingPixel() throws Exception {
        MemoryRaster clip = RasterWarp.clipToCutline(fives(), rectangle(0.6, 0.6, 2.4, 3.4), true);

        assertEquals(12, count(clip, 5));
    }

    @Test
    void allTouchedIgnoresCellsTouchingOnlyAtACorner() throws Exception {
        MemoryRaster raster = new MemoryRaster(2, 2, GeoTransform.of(0d, 1d, 2d, -1d));
        raster.fill(5);
        Geometry triangle = gf.createPolygon(new Coordinate[] {
            new Coordinate(0, 0), new Coordinate(2, 0), new Coordinate(0, 2), new Coordinate(0, 0)
        });

        MemoryRaster clip = RasterWarp.clipToCutline(raster, triangle, true);

        assertEquals(3, count(clip, 5));
        assertEquals(0, clip.get(1, 0), "upper right cell only shares the point (1, 1)");
    }

    @Test
    void blanksWithSourceNoDataAndKeepsPalette() throws Exception {
        Palette palette = Palette.ofRgb(new int[] {255, 255, 255}, new int[] {0, 0, 255});
        MemoryRaster source = fives().withNoData(255d).withPalette(palette);

        MemoryRaster clip = RasterWarp.clipToCutline(source, rectangle(0.6, 0.6, 2.4, 3.4), false);

        assertEquals(10, count(clip, 255));
        assertEquals(Double.valueOf(255d), clip.getNoData());
        assertSame(palette, clip.getPalette());
    }

    @Test
    void bucketRasterNeedsNoDataToDropBlankedPixels() throws Exception {
        BucketLookup buckets = new BucketLookup(Arrays.asList("0-0.5%", "0.5-2%", "2-5%", "5-8%", "8-10%", "10-15%"));
        Geometry cutline = rectangle(0.6, 0.6, 2.4, 3.4);

        MemoryRaster withoutNoData = RasterWarp.clipToCutline(fives(), cutline, false);
        MemoryRaster withNoData = RasterWarp.clipToCutline(fives().withNoData(255d), cutline, false);

        assertEquals("0-0.5%", buckets.classify(withoutNoData.get(0, 1)));
        assertNull(buckets.classify(withNoData.get(0, 1)));
        assertEquals("10-15%", buckets.classify(withNoData.get(1, 1)));
    }

    @Test
    void cutlineBeyondTheRasterIsClampedToIt() throws Exception {
        MemoryRaster clip = RasterWarp.clipToCutline(fives(), rectangle(-180, -90, 180, 90), false);

        assertEquals(4, clip.getWidth());
        assertEquals(4, clip.getHeight());
        assertEquals(16, count(clip, 5));
    }

    @Test
    void cutlineOutsideTheRasterGivesNoClip() throws Exception {
        assertNull(RasterWarp.clipToCutline(fives(), rectangle(10, 10, 11, 11), true));
        assertNull(RasterWarp.clipToCutline(fives(), gf.createPolygon(), true));
    }

    private Geometry rectangle(double minX, double minY, double maxX, double maxY) {
        return gf.createPolygon(new Coordinate[] {
            new Coordinate(minX, minY), new Coordinate(maxX, minY), new Coordinate(maxX, maxY),
            new Coordinate(minX, maxY), new Coordinate(minX, minY)
        });
    }

    private static int count(MemoryRaster raster, int value) {
        int n = 0;
        for (int y = 0; y < raster.getHeight(); y++) {
            for (int x = 0; x < raster.getWidth(); x++) {
                if (raster.get(x, y) == value) {
                    n++;
                }
            }
        }
        return n;
    }
}
