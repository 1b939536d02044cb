package ch.so.agi.rasterarea.boundary;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

/**
 * Writes a {@link BoundaryLayer} as a polygon shapefile ({@code .shp},
 * {@code .shx}, {@code .dbf}, {@code .cpg} and, if known, {@code .prj}).
 * Attributes are written as character fields; shells are written clockwise and
 * holes counter-clockwise.
 */
public final class ShapefileWriter {
    private static final int MAX_FIELD_LENGTH = 254;
    private static final Charset CHARSET = StandardCharsets.UTF_8;

    private ShapefileWriter() {}

    /**
     * @param layer   features to write, geometries must be polygonal
     * @param shpPath target {@code .shp} path, sibling files are derived from it
     * @throws IOException if writing fails
     * @throws IllegalArgumentException if a geometry is not polygonal
     */
    public static void write(BoundaryLayer layer, Path shpPath) throws IOException {
        List<List<Coordinate[]>> shapes = new ArrayList<>();
        Envelope bounds = new Envelope();
        for (BoundaryFeature feature : layer.getFeatures()) {
            Geometry geometry = feature.getGeometry();
            shapes.add(rings(geometry));
            bounds.expandToInclude(geometry.getEnvelopeInternal());
        }

        int[] contentLengths = new int[shapes.size()];
        int fileLength = ShapefileReader.HEADER_LENGTH;
        for (int i = 0; i < shapes.size(); i++) {
            contentLengths[i] = contentLength(shapes.get(i));
            fileLength += 8 + contentLengths[i];
        }

        ByteBuffer shp = ByteBuffer.allocate(fileLength);
        ByteBuffer shx = ByteBuffer.allocate(ShapefileReader.HEADER_LENGTH + 8 * shapes.size());
        writeHeader(shp, fileLength, bounds);
        writeHeader(shx, shx.capacity(), bounds);

        int offset = ShapefileReader.HEADER_LENGTH;
        for (int i = 0; i < shapes.size(); i++) {
            shx.order(ByteOrder.BIG_ENDIAN);
            shx.putInt(offset / 2);
            shx.putInt(contentLengths[i] / 2);

            shp.order(ByteOrder.BIG_ENDIAN);
            shp.putInt(i + 1);
            shp.putInt(contentLengths[i] / 2);
            shp.order(ByteOrder.LITTLE_ENDIAN);
            writeShape(shp, shapes.get(i));
            offset += 8 + contentLengths[i];
        }

        Path parent = shpPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(shpPath, shp.array());
        Files.write(ShapefileReader.sibling(shpPath, ".shx"), shx.array());
        Files.write(ShapefileReader.sibling(shpPath, ".dbf"), dbf(layer));
        Files.writeString(ShapefileReader.sibling(shpPath, ".cpg"), "UTF-8", StandardCharsets.US_ASCII);
        if (layer.getProjectionWkt() != null) {
            Files.writeString(ShapefileReader.sibling(shpPath, ".prj"), layer.getProjectionWkt(), StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * @return the component files written for {@code shpPath}
     */
    public static List<Path> componentFiles(Path shpPath) {
        List<Path> files = new ArrayList<>();
        files.add(shpPath);
        for (String ext : new String[] {".shx", ".dbf", ".cpg", ".prj"}) {
            files.add(ShapefileReader.sibling(shpPath, ext));
        }
        return files;
    }

    private static List<Coordinate[]> rings(Geometry geometry) {
        List<Coordinate[]> rings = new ArrayList<>();
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            Geometry part = geometry.getGeometryN(i);
            if (part.isEmpty()) {
                continue;
            }
            if (!(part instanceof Polygon)) {
                throw new IllegalArgumentException("Polygonal geometry expected, got " + part.getGeometryType());
            }
            Polygon polygon = (Polygon) part;
            rings.add(oriented(polygon.getExteriorRing().getCoordinates(), false));
            for (int h = 0; h < polygon.getNumInteriorRing(); h++) {
                rings.add(oriented(polygon.getInteriorRingN(h).getCoordinates(), true));
            }
        }
        return rings;
    }

    private static Coordinate[] oriented(Coordinate[] ring, boolean ccw) {
        if (Orientation.isCCW(ring) == ccw) {
            return ring;
        }
        Coordinate[] reversed = new Coordinate[ring.length];
        for (int i = 0; i < ring.length; i++) {
            reversed[i] = ring[ring.length - 1 - i];
        }
        return reversed;
    }

    private static int contentLength(List<Coordinate[]> rings) {
        if (rings.isEmpty()) {
            return 4;
        }
        int points = 0;
        for (Coordinate[] ring : rings) {
            points += ring.length;
        }
        return 4 + 32 + 4 + 4 + 4 * rings.size() + 16 * points;
    }

    private static void writeHeader(ByteBuffer buf, int fileLength, Envelope bounds) {
        buf.order(ByteOrder.BIG_ENDIAN);
        buf.putInt(ShapefileReader.FILE_CODE);
        for (int i = 0; i < 5; i++) {
            buf.putInt(0);
        }
        buf.putInt(fileLength / 2);
        buf.order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(1000);
        buf.putInt(ShapefileReader.SHAPE_POLYGON);
        putBounds(buf, bounds);
        // z and m ranges
        for (int i = 0; i < 4; i++) {
            buf.putDouble(0d);
        }
    }

    private static void writeShape(ByteBuffer buf, List<Coordinate[]> rings) {
        if (rings.isEmpty()) {
            buf.putInt(ShapefileReader.SHAPE_NULL);
            return;
        }
        Envelope env = new Envelope();
        int points = 0;
        for (Coordinate[] ring : rings) {
            for (Coordinate c : ring) {
                env.expandToInclude(c);
            }
            points += ring.length;
        }
        buf.putInt(ShapefileReader.SHAPE_POLYGON);
        putBounds(buf, env);
        buf.putInt(rings.size());
        buf.putInt(points);
        int start = 0;
        for (Coordinate[] ring : rings) {
            buf.putInt(start);
            start += ring.length;
        }
        for (Coordinate[] ring : rings) {
            for (Coordinate c : ring) {
                buf.putDouble(c.x);
                buf.putDouble(c.y);
            }
        }
    }

    private static void putBounds(ByteBuffer buf, Envelope env) {
        if (env.isNull()) {
            for (int i = 0; i < 4; i++) {
                buf.putDouble(0d);
            }
            return;
        }
        buf.putDouble(env.getMinX());
        buf.putDouble(env.getMinY());
        buf.putDouble(env.getMaxX());
        buf.putDouble(env.getMaxY());
    }

    private static byte[] dbf(BoundaryLayer layer) {
        List<String> fields = layer.getFieldNames();
        int[] lengths = new int[fields.size()];
        for (int f = 0; f < fields.size(); f++) {
            int max = 1;
            for (BoundaryFeature feature : layer.getFeatures()) {
                String value = feature.getAttribute(fields.get(f));
                if (value != null) {
                    max = Math.max(max, value.getBytes(CHARSET).length);
                }
            }
            lengths[f] = Math.min(max, MAX_FIELD_LENGTH);
        }
        int recordLength = 1;
        for (int length : lengths) {
            recordLength += length;
        }
        int headerLength = 32 + 32 * fields.size() + 1;
        int records = layer.getFeatures().size();

        ByteBuffer buf = ByteBuffer.allocate(headerLength + records * recordLength + 1).order(ByteOrder.LITTLE_ENDIAN);
        LocalDate today = LocalDate.now();
        buf.put((byte) 0x03);
        buf.put((byte) (today.getYear() - 1900));
        buf.put((byte) today.getMonthValue());
        buf.put((byte) today.getDayOfMonth());
        buf.putInt(records);
        buf.putShort((short) headerLength);
        buf.putShort((short) recordLength);
        buf.position(32);

        for (int f = 0; f < fields.size(); f++) {
            byte[] name = fields.get(f).getBytes(StandardCharsets.ISO_8859_1);
            byte[] descriptor = new byte[32];
            System.arraycopy(name, 0, descriptor, 0, Math.min(name.length, 10));
            descriptor[11] = (byte) 'C';
            descriptor[16] = (byte) lengths[f];
            buf.put(descriptor);
        }
        buf.put((byte) 0x0D);

        for (BoundaryFeature feature : layer.getFeatures()) {
            buf.put((byte) ' ');
            for (int f = 0; f < fields.size(); f++) {
                byte[] cell = new byte[lengths[f]];
                Arrays.fill(cell, (byte) ' ');
                String value = feature.getAttribute(fields.get(f));
                if (value != null) {
                    byte[] bytes = value.getBytes(CHARSET);
                    System.arraycopy(bytes, 0, cell, 0, Math.min(bytes.length, cell.length));
                }
                buf.put(cell);
            }
        }
        buf.put((byte) 0x1A);
        return buf.array();
    }
}
