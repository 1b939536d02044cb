package ch.so.agi.rasterarea.lookup;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ch.so.agi.rasterarea.raster.GeoTransform;
import ch.so.agi.rasterarea.raster.MemoryRaster;
import ch.so.agi.rasterarea.raster.Palette;
import ch.so.agi.rasterarea.utils.RasterAreaException;

/**
 * Tests for the {@link ClassificationLookup} variants.
 */
class ClassificationLookupTest {

    private static final Palette PALETTE = Palette.ofRgb(
            new int[] {255, 255, 255},
            new int[] {0, 0, 255},
            new int[] {0, 0, 0},
            new int[] {178, 178, 178},
            new int[] {1, 2, 3});

    private static List<ClassificationLookup<?>> allLookups() {
        return Arrays.asList(
                new PaletteLookup(PALETTE, ClassificationTables.KOPPEN_GEIGER_COLORS),
                new GreyscaleLookup(ClassificationTables.ESA_LCCS_CLASSES),
                new BucketLookup(ClassificationTables.GAEZ_SLOPES),
                new CodedTableLookup(ClassificationTables.FAO_LAND_COVER),
                new GreyscaleLookup(ClassificationTables.WORKABILITY_CLASSES));
    }

    @Test
    void maskSentinelIsNoDataForEveryVariant() {
        for (ClassificationLookup<?> lookup : allLookups()) {
            assertNull(lookup.classify(ClassificationLookup.NO_DATA), lookup.getClass().getSimpleName());
            // asking again after other values must not change the answer
            lookup.classify(1);
            lookup.classify(254);
            assertNull(lookup.classify(ClassificationLookup.NO_DATA), lookup.getClass().getSimpleName());
        }
    }

    @Test
    void valuesOutsideTheDomainAreNoData() {
        for (ClassificationLookup<?> lookup : allLookups()) {
            assertNull(lookup.classify(100_000), lookup.getClass().getSimpleName());
            assertNull(lookup.classify(Integer.MIN_VALUE), lookup.getClass().getSimpleName());
        }
    }

    @Test
    void everyClassifiedKeyIsAColumn() {
        for (ClassificationLookup<?> lookup : allLookups()) {
            for (int raw = -1; raw < 300; raw++) {
                Object key = lookup.classify(raw);
                if (key != null) {
                    assertTrue(lookup.columns().contains(key), lookup.getClass().getSimpleName() + " " + raw);
                }
            }
        }
    }

    @Test
    void paletteLookupResolvesColours() {
        PaletteLookup lookup = new PaletteLookup(PALETTE, ClassificationTables.KOPPEN_GEIGER_COLORS);
        assertEquals("Af", lookup.classify(1));
        assertEquals("ET", lookup.classify(3));
        assertEquals(30, lookup.columns().size());
        assertEquals("Af", lookup.columns().get(0));
    }

    @Test
    void paletteLookupTreatsWhiteBlackAndUnknownColoursAsNoData() {
        PaletteLookup lookup = new PaletteLookup(PALETTE, ClassificationTables.KOPPEN_GEIGER_COLORS);
        assertNull(lookup.classify(0), "white");
        assertNull(lookup.classify(2), "black");
        assertNull(lookup.classify(4), "colour outside the legend");
        assertNull(lookup.classify(5), "index outside the palette");
    }

    @Test
    void greyscaleLookupUsesTheValueAsClass() {
        GreyscaleLookup lookup = new GreyscaleLookup(ClassificationTables.ESA_LCCS_CLASSES);
        assertEquals(Integer.valueOf(10), lookup.classify(10));
        assertEquals(Integer.valueOf(220), lookup.classify(220));
        assertNull(lookup.classify(0));
        assertNull(lookup.classify(15));
    }

    @Test
    void workabilityClassesAreOneToSeven() {
        GreyscaleLookup lookup = new GreyscaleLookup(ClassificationTables.WORKABILITY_CLASSES);
        assertEquals(Arrays.asList(1, 2, 3, 4, 5, 6, 7), lookup.columns());
        assertNull(lookup.classify(0));
        assertEquals(Integer.valueOf(7), lookup.classify(7));
        assertNull(lookup.classify(8));
    }

    @Test
    void bucketLookupIndexesLabels() {
        BucketLookup lookup = new BucketLookup(ClassificationTables.GAEZ_SLOPES);
        assertEquals("0-0.5%", lookup.classify(0));
        assertEquals(">45%", lookup.classify(7));
        assertNull(lookup.classify(8));
        assertNull(lookup.classify(255));
    }

    @Test
    void codedTableLookupTreatsZeroAnd255AsNoData() {
        Map<Integer, String> table = new LinkedHashMap<>();
        table.put(0, "zero");
        table.put(3, "three");
        table.put(255, "fill");
        CodedTableLookup lookup = new CodedTableLookup(table);
        assertNull(lookup.classify(0));
        assertNull(lookup.classify(255));
        assertEquals("three", lookup.classify(3));
        assertNull(lookup.classify(4));

        CodedTableLookup fao = new CodedTableLookup(ClassificationTables.FAO_LAND_COVER);
        assertEquals("Cropland", fao.classify(2));
        assertEquals(11, fao.columns().size());
    }

    @Test
    void lookupKindCreatesPaletteLookupFromRaster() {
        MemoryRaster raster = new MemoryRaster(1, 1, GeoTransform.of(0d, 1d, 0d, -1d)).withPalette(PALETTE);
        ClassificationLookup<?> lookup = LookupKind.KOPPEN_GEIGER.create(raster);
        assertEquals("Af", lookup.classify(1));
    }

    @Test
    void lookupKindRequiresPaletteForKoppenGeiger() {
        MemoryRaster raster = new MemoryRaster(1, 1, GeoTransform.of(0d, 1d, 0d, -1d));
        RasterAreaException e = assertThrows(RasterAreaException.class, () -> LookupKind.KOPPEN_GEIGER.create(raster));
        assertEquals("NO_PALETTE", e.getType());
    }

    @Test
    void lookupKindNamesAndWarpOptions() {
        assertEquals(LookupKind.GAEZ_SLOPE, LookupKind.forConfigName("gaez-slope"));
        assertEquals(LookupKind.ESA_LCCS, LookupKind.forConfigName(" ESA-LCCS "));
        assertThrows(IllegalArgumentException.class, () -> LookupKind.forConfigName("nope"));
        assertFalse(LookupKind.WORKABILITY.isAllTouched());
        assertTrue(LookupKind.KOPPEN_GEIGER.isAllTouched());
        assertTrue(LookupKind.ESA_LCCS.isAllTouched());
    }
}
