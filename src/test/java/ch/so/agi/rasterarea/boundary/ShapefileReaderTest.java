package ch.so.agi.rasterarea.boundary;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;

/**
 * Tests for {@link ShapefileReader} and {@link ShapefileWriter}.
 */
class ShapefileReaderTest {
    private static final String WGS84_PRJ = "GEOGCS[\"WGS 84\",DATUM[\"WGS_1984\",SPHEROID[\"WGS 84\",6378137,298.257223563]],"
            + "PRIMEM[\"Greenwich\",0],UNIT[\"degree\",0.0174532925199433]]";

    private final GeometryFactory gf = new GeometryFactory();

    @TempDir
    Path tempDir;

    @Test
    void roundTripKeepsGeometriesAttributesAndProjection() throws Exception {
        Polygon withHole = gf.createPolygon(ring(0, 0, 10, 10), new LinearRing[] {ring(2, 2, 4, 4)});
        MultiPolygon islands = gf.createMultiPolygon(new Polygon[] {
            gf.createPolygon(ring(20, 0, 21, 1)),
            gf.createPolygon(ring(30, 0, 32, 2))
        });
        BoundaryLayer layer = new BoundaryLayer(Arrays.asList(BoundaryFeature.ADMIN, BoundaryFeature.SOV_A3),
                Arrays.asList(
                        feature(0, "Côte d'Ivoire", "CIV", withHole),
                        feature(1, "Fiji", "FJI", islands)),
                WGS84_PRJ);
        Path shp = tempDir.resolve("countries.shp");

        ShapefileWriter.write(layer, shp);
        BoundaryLayer read = new ShapefileReader().read(shp);

        assertTrue(Files.exists(tempDir.resolve("countries.shx")));
        assertEquals(Arrays.asList("ADMIN", "SOV_A3"), read.getFieldNames());
        assertEquals(WGS84_PRJ, read.getProjectionWkt());
        assertEquals(2, read.getFeatures().size());

        BoundaryFeature first = read.getFeatures().get(0);
        assertEquals("Côte d'Ivoire", first.getAdmin());
        assertEquals("CIV", first.getSovereignCode());
        assertEquals("CIV_0", first.getFileStem());
        assertTrue(first.getGeometry() instanceof Polygon);
        assertEquals(1, ((Polygon) first.getGeometry()).getNumInteriorRing());
        assertEquals(96d, first.getGeometry().getArea(), 1e-9);
        assertTrue(first.getGeometry().equalsTopo(withHole));

        BoundaryFeature second = read.getFeatures().get(1);
        assertEquals(1, second.getIndex());
        assertTrue(second.getGeometry() instanceof MultiPolygon);
        assertEquals(2, second.getGeometry().getNumGeometries());
        assertEquals(5d, second.getGeometry().getArea(), 1e-9);
    }

    @Test
    void singleFeatureLayerKeepsFieldsAndProjection() throws Exception {
        BoundaryLayer layer = new BoundaryLayer(Arrays.asList(BoundaryFeature.ADMIN, BoundaryFeature.SOV_A3),
                Arrays.asList(
                        feature(0, "Peru", "PER", gf.createPolygon(ring(0, 0, 1, 1))),
                        feature(1, "Chile", "CHL", gf.createPolygon(ring(1, 0, 2, 1)))),
                WGS84_PRJ);
        Path shp = tempDir.resolve("CHL_1_feature_mask.shp");

        ShapefileWriter.write(layer.single(layer.getFeatures().get(1)), shp);
        BoundaryLayer read = new ShapefileReader().read(shp);

        assertEquals(1, read.getFeatures().size());
        assertEquals("Chile", read.getFeatures().get(0).getAdmin());
        assertEquals(WGS84_PRJ, read.getProjectionWkt());
    }

    @Test
    void emptyGeometryIsWrittenAsNullShape() throws Exception {
        BoundaryLayer layer = new BoundaryLayer(Arrays.asList(BoundaryFeature.ADMIN),
                Arrays.asList(feature(0, "Nowhere", null, gf.createPolygon())), null);
        Path shp = tempDir.resolve("empty.shp");

        ShapefileWriter.write(layer, shp);
        BoundaryLayer read = new ShapefileReader().read(shp);

        assertEquals(1, read.getFeatures().size());
        assertTrue(read.getFeatures().get(0).getGeometry().isEmpty());
        assertNull(read.getProjectionWkt());
    }

    @Test
    void deletedRecordsAreSkippedWithTheirShapes() throws Exception {
        BoundaryLayer layer = new BoundaryLayer(Arrays.asList(BoundaryFeature.ADMIN, BoundaryFeature.SOV_A3),
                Arrays.asList(
                        feature(0, "Peru", "PER", gf.createPolygon(ring(0, 0, 1, 1))),
                        feature(1, "Chile", "CHL", gf.createPolygon(ring(1, 0, 3, 1))),
                        feature(2, "Bolivia", "BOL", gf.createPolygon(ring(3, 0, 6, 1)))),
                null);
        Path shp = tempDir.resolve("countries.shp");
        ShapefileWriter.write(layer, shp);

        Path dbf = tempDir.resolve("countries.dbf");
        byte[] bytes = Files.readAllBytes(dbf);
        ByteBuffer header = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int headerLength = Short.toUnsignedInt(header.getShort(8));
        int recordLength = Short.toUnsignedInt(header.getShort(10));
        bytes[headerLength + recordLength] = '*';
        Files.write(dbf, bytes);

        BoundaryLayer read = new ShapefileReader().read(shp);

        assertEquals(2, read.getFeatures().size());
        assertEquals("Peru", read.getFeatures().get(0).getAdmin());
        BoundaryFeature bolivia = read.getFeatures().get(1);
        assertEquals("Bolivia", bolivia.getAdmin());
        assertEquals(1, bolivia.getIndex());
        assertEquals(3d, bolivia.getGeometry().getArea(), 1e-9);
    }

    @Test
    void ringsWithoutShellBecomeShells() {
        ShapefileReader reader = new ShapefileReader();
        Coordinate[] ccw = ring(0, 0, 1, 1).getCoordinates();
        Geometry geometry = reader.assemble(Collections.singletonList(ccw));
        assertEquals(1d, geometry.getArea(), 1e-12);
    }

    @Test
    void holeOutsideEveryShellBecomesShell() {
        ShapefileReader reader = new ShapefileReader();
        Coordinate[] shell = reverse(ring(0, 0, 1, 1).getCoordinates());
        Coordinate[] stray = ring(5, 5, 6, 6).getCoordinates();
        Geometry geometry = reader.assemble(Arrays.asList(shell, stray));
        assertEquals(2, geometry.getNumGeometries());
        assertEquals(2d, geometry.getArea(), 1e-12);
    }

    @Test
    void missingFilesAreReported() {
        assertThrows(NoSuchFileException.class, () -> new ShapefileReader().read(tempDir.resolve("absent.shp")));
    }

    @Test
    void nonPolygonalGeometryIsRejected() {
        BoundaryLayer layer = new BoundaryLayer(Arrays.asList(BoundaryFeature.ADMIN),
                Arrays.asList(feature(0, "Point", null, gf.createPoint(new Coordinate(1, 1)))), null);
        assertThrows(IllegalArgumentException.class, () -> ShapefileWriter.write(layer, tempDir.resolve("p.shp")));
    }

    private BoundaryFeature feature(int index, String admin, String a3, Geometry geometry) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(BoundaryFeature.ADMIN, admin);
        if (a3 != null) {
            attributes.put(BoundaryFeature.SOV_A3, a3);
        }
        return new BoundaryFeature(index, attributes, geometry);
    }

    /** Counter-clockwise rectangle ring. */
    private LinearRing ring(double minX, double minY, double maxX, double maxY) {
        return gf.createLinearRing(new Coordinate[] {
            new Coordinate(minX, minY),
            new Coordinate(maxX, minY),
            new Coordinate(maxX, maxY),
            new Coordinate(minX, maxY),
            new Coordinate(minX, minY)
        });
    }

    private static Coordinate[] reverse(Coordinate[] ring) {
        Coordinate[] out = new Coordinate[ring.length];
        for (int i = 0; i < ring.length; i++) {
            out[i] = ring[ring.length - 1 - i];
        }
        return out;
    }
}
