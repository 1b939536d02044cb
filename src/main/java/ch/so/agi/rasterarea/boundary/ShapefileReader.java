package ch.so.agi.rasterarea.boundary;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.algorithm.PointLocation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;

import ch.so.agi.rasterarea.logging.AreaLogger;
import ch.so.agi.rasterarea.logging.LogEnvironment;

/**
 * Reads polygon shapefiles ({@code .shp} with its {@code .dbf} attribute table,
 * optional {@code .prj} and {@code .cpg}) into a {@link BoundaryLayer}.
 * <p>
 * Rings are split into shells (clockwise) and holes (counter-clockwise) as the
 * format prescribes; each hole goes to the first shell containing it. No
 * topology repair is attempted.
 * </p>
 */
public final class ShapefileReader {
    static final int FILE_CODE = 9994;
    static final int HEADER_LENGTH = 100;
    static final int SHAPE_NULL = 0;
    static final int SHAPE_POLYGON = 5;
    static final int SHAPE_POLYGON_Z = 15;
    static final int SHAPE_POLYGON_M = 25;
    static final byte DELETED_RECORD = 0x2A;

    private final AreaLogger log;
    private final GeometryFactory geometryFactory;

    public ShapefileReader() {
        this(new GeometryFactory());
    }

    public ShapefileReader(GeometryFactory geometryFactory) {
        this.geometryFactory = geometryFactory;
        this.log = LogEnvironment.getLogger(this.getClass());
    }

    /**
     * Reads all features of a polygon shapefile.
     *
     * @param shpPath path of the {@code .shp} file
     * @return the layer
     * @throws IOException if a component file is missing or malformed
     */
    public BoundaryLayer read(Path shpPath) throws IOException {
        Path dbfPath = sibling(shpPath, ".dbf");
        if (!Files.isRegularFile(shpPath)) {
            throw new NoSuchFileException(shpPath.toString());
        }
        if (!Files.isRegularFile(dbfPath)) {
            throw new NoSuchFileException(dbfPath.toString());
        }

        List<Geometry> geometries = readGeometries(shpPath);
        DbfTable table = readDbf(dbfPath, charset(shpPath));
        if (table.records.size() != geometries.size()) {
            throw new IOException("Record count mismatch: " + geometries.size() + " shapes, "
                    + table.records.size() + " attribute rows in " + shpPath);
        }

        List<BoundaryFeature> features = new ArrayList<>(geometries.size());
        int deleted = 0;
        for (int i = 0; i < geometries.size(); i++) {
            Map<String, String> record = table.records.get(i);
            if (record == null) {
                deleted++;
                continue;
            }
            features.add(new BoundaryFeature(features.size(), record, geometries.get(i)));
        }
        if (deleted > 0) {
            log.debug("Ignored " + deleted + " deleted records in " + dbfPath.getFileName());
        }

        Path prjPath = sibling(shpPath, ".prj");
        String prj = Files.isRegularFile(prjPath) ? Files.readString(prjPath, StandardCharsets.ISO_8859_1).trim() : null;

        log.debug("Read " + features.size() + " features from " + shpPath.getFileName());
        return new BoundaryLayer(table.fieldNames, features, prj);
    }

    private List<Geometry> readGeometries(Path shpPath) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(Files.readAllBytes(shpPath));
        if (buf.limit() < HEADER_LENGTH) {
            throw new IOException("Truncated shapefile header: " + shpPath);
        }
        buf.order(ByteOrder.BIG_ENDIAN);
        if (buf.getInt(0) != FILE_CODE) {
            throw new IOException("Not a shapefile: " + shpPath);
        }
        int fileLength = Math.min(buf.getInt(24) * 2, buf.limit());
        buf.order(ByteOrder.LITTLE_ENDIAN);
        int layerType = buf.getInt(32);
        if (layerType != SHAPE_NULL && !isPolygonType(layerType)) {
            throw new IOException("Unsupported shape type " + layerType + " in " + shpPath + ", polygons expected");
        }

        List<Geometry> geometries = new ArrayList<>();
        int pos = HEADER_LENGTH;
        while (pos + 8 <= fileLength) {
            buf.order(ByteOrder.BIG_ENDIAN);
            int contentLength = buf.getInt(pos + 4) * 2;
            int content = pos + 8;
            if (content + contentLength > fileLength) {
                throw new IOException("Truncated record at offset " + pos + " in " + shpPath);
            }
            buf.order(ByteOrder.LITTLE_ENDIAN);
            int shapeType = buf.getInt(content);
            if (shapeType == SHAPE_NULL) {
                geometries.add(geometryFactory.createPolygon());
            } else if (isPolygonType(shapeType)) {
                geometries.add(readPolygon(buf, content + 4));
            } else {
                throw new IOException("Unsupported shape type " + shapeType + " at offset " + pos + " in " + shpPath);
            }
            pos = content + contentLength;
        }
        return geometries;
    }

    private Geometry readPolygon(ByteBuffer buf, int offset) {
        // skip bounding box
        int pos = offset + 32;
        int numParts = buf.getInt(pos);
        int numPoints = buf.getInt(pos + 4);
        pos += 8;
        int[] parts = new int[numParts];
        for (int i = 0; i < numParts; i++) {
            parts[i] = buf.getInt(pos);
            pos += 4;
        }
        List<Coordinate[]> rings = new ArrayList<>(numParts);
        for (int i = 0; i < numParts; i++) {
            int start = parts[i];
            int end = i + 1 < numParts ? parts[i + 1] : numPoints;
            Coordinate[] ring = new Coordinate[end - start];
            for (int j = start; j < end; j++) {
                int p = pos + j * 16;
                ring[j - start] = new Coordinate(buf.getDouble(p), buf.getDouble(p + 8));
            }
            rings.add(ring);
        }
        return assemble(rings);
    }

    /**
     * Builds a polygon or multipolygon from shapefile rings.
     */
    Geometry assemble(List<Coordinate[]> rings) {
        List<Coordinate[]> shells = new ArrayList<>();
        List<Coordinate[]> holes = new ArrayList<>();
        for (Coordinate[] ring : rings) {
            if (ring.length < 4) {
                continue;
            }
            if (Orientation.isCCW(ring)) {
                holes.add(ring);
            } else {
                shells.add(ring);
            }
        }
        if (shells.isEmpty()) {
            // wrongly oriented data, take every ring as a shell
            shells.addAll(holes);
            holes.clear();
        }

        List<List<LinearRing>> holesByShell = new ArrayList<>();
        for (int i = 0; i < shells.size(); i++) {
            holesByShell.add(new ArrayList<>());
        }
        for (Coordinate[] hole : holes) {
            int owner = -1;
            for (int i = 0; i < shells.size() && owner < 0; i++) {
                if (PointLocation.isInRing(hole[0], shells.get(i))) {
                    owner = i;
                }
            }
            if (owner < 0) {
                shells.add(hole);
                holesByShell.add(new ArrayList<>());
            } else {
                holesByShell.get(owner).add(geometryFactory.createLinearRing(hole));
            }
        }

        Polygon[] polygons = new Polygon[shells.size()];
        for (int i = 0; i < shells.size(); i++) {
            polygons[i] = geometryFactory.createPolygon(geometryFactory.createLinearRing(shells.get(i)),
                    holesByShell.get(i).toArray(new LinearRing[0]));
        }
        if (polygons.length == 0) {
            return geometryFactory.createPolygon();
        }
        if (polygons.length == 1) {
            return polygons[0];
        }
        return geometryFactory.createMultiPolygon(polygons);
    }

    private DbfTable readDbf(Path dbfPath, Charset charset) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(Files.readAllBytes(dbfPath)).order(ByteOrder.LITTLE_ENDIAN);
        if (buf.limit() < 32) {
            throw new IOException("Truncated dBASE header: " + dbfPath);
        }
        int numRecords = buf.getInt(4);
        int headerLength = Short.toUnsignedInt(buf.getShort(8));
        int recordLength = Short.toUnsignedInt(buf.getShort(10));

        List<String> names = new ArrayList<>();
        List<Integer> lengths = new ArrayList<>();
        int pos = 32;
        while (pos < headerLength - 1 && buf.get(pos) != 0x0D) {
            byte[] nameBytes = new byte[11];
            buf.position(pos);
            buf.get(nameBytes);
            int nameLength = 0;
            while (nameLength < nameBytes.length && nameBytes[nameLength] != 0) {
                nameLength++;
            }
            names.add(new String(nameBytes, 0, nameLength, StandardCharsets.ISO_8859_1).trim());
            lengths.add(Byte.toUnsignedInt(buf.get(pos + 16)));
            pos += 32;
        }

        List<Map<String, String>> records = new ArrayList<>(numRecords);
        for (int r = 0; r < numRecords; r++) {
            int recordStart = headerLength + r * recordLength;
            if (recordStart + recordLength > buf.limit()) {
                throw new IOException("Truncated dBASE record " + r + " in " + dbfPath);
            }
            if (buf.get(recordStart) == DELETED_RECORD) {
                records.add(null);
                continue;
            }
            int fieldPos = recordStart + 1;
            Map<String, String> values = new LinkedHashMap<>();
            for (int f = 0; f < names.size(); f++) {
                byte[] raw = new byte[lengths.get(f)];
                buf.position(fieldPos);
                buf.get(raw);
                values.put(names.get(f), new String(raw, charset).trim());
                fieldPos += raw.length;
            }
            records.add(values);
        }
        return new DbfTable(names, records);
    }

    private Charset charset(Path shpPath) throws IOException {
        Path cpg = sibling(shpPath, ".cpg");
        if (!Files.isRegularFile(cpg)) {
            return StandardCharsets.ISO_8859_1;
        }
        String name = Files.readString(cpg, StandardCharsets.US_ASCII).trim();
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IOException("Unsupported code page '" + name + "' in " + cpg, e);
        }
    }

    static boolean isPolygonType(int shapeType) {
        return shapeType == SHAPE_POLYGON || shapeType == SHAPE_POLYGON_Z || shapeType == SHAPE_POLYGON_M;
    }

    static Path sibling(Path shpPath, String extension) {
        String name = shpPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return shpPath.resolveSibling(stem + extension);
    }

    private static final class DbfTable {
        private final List<String> fieldNames;
        /** One entry per record, {@code null} for records flagged deleted. */
        private final List<Map<String, String>> records;

        private DbfTable(List<String> fieldNames, List<Map<String, String>> records) {
            this.fieldNames = fieldNames;
            this.records = records;
        }
    }
}
