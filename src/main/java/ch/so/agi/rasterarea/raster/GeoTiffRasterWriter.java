package ch.so.agi.rasterarea.raster;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;

/**
 * Writes a single band integer raster as an uncompressed, striped GeoTIFF in
 * geographic WGS 84 coordinates.
 * <p>
 * The smallest integer sample type holding all values is used. Georeferencing
 * goes to ModelPixelScale/ModelTiepoint, a palette to ColorMap and the nodata
 * value to GDAL_NODATA. {@link #write(RasterSource, Path)} returns after the
 * file is completely written and closed, so it can be reopened right away.
 * </p>
 */
public final class GeoTiffRasterWriter {
    private static final int EPSG_WGS84 = 4326;

    private GeoTiffRasterWriter() {}

    /**
     * Writes the full extent of {@code raster} to {@code target}.
     *
     * @param raster raster to write, must not be rotated
     * @param target output file, replaced if it exists
     * @throws IOException if reading the source or writing the file fails
     */
    public static void write(RasterSource raster, Path target) throws IOException {
        write(raster, target, 0);
    }

    /**
     * Writes the full extent of {@code raster} to {@code target} in strips of
     * {@code rowsPerStrip} rows.
     *
     * @param raster       raster to write, must not be rotated
     * @param target       output file, replaced if it exists
     * @param rowsPerStrip rows per strip, {@code 0} for a size chosen by the library
     * @throws IOException if reading the source or writing the file fails
     */
    public static void write(RasterSource raster, Path target, int rowsPerStrip) throws IOException {
        if (rowsPerStrip < 0) {
            throw new IllegalArgumentException("rowsPerStrip must not be negative: " + rowsPerStrip);
        }
        GeoTransform gt = raster.getGeoTransform();
        if (gt.isRotated()) {
            throw new IOException("Rotated geotransforms cannot be written as ModelPixelScale: " + gt);
        }
        int width = raster.getWidth();
        int height = raster.getHeight();
        RasterBlock block = raster.read(0, 0, width, height);

        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int v = block.get(x, y);
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
        }
        FieldType fieldType = sampleType(min, max);
        boolean signed = fieldType == FieldType.SSHORT || fieldType == FieldType.SLONG;

        Rasters rasters = new Rasters(width, height, 1, fieldType);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                rasters.setPixelSample(0, x, y, block.get(x, y));
            }
        }

        Palette palette = raster.getPalette();
        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(fieldType.getBits());
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(palette != null
                ? TiffConstants.PHOTOMETRIC_INTERPRETATION_PALETTE
                : TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(1);
        directory.setRowsPerStrip(rowsPerStrip > 0
                ? Math.min(rowsPerStrip, height)
                : rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(signed ? TiffConstants.SAMPLE_FORMAT_SIGNED_INT : TiffConstants.SAMPLE_FORMAT_UNSIGNED_INT);

        directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelPixelScale, FieldType.DOUBLE, 3,
                Arrays.asList(gt.getXPixelSize(), -gt.getYPixelSize(), 0d)));
        directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelTiepoint, FieldType.DOUBLE, 6,
                Arrays.asList(0d, 0d, 0d, gt.getXOrigin(), gt.getYOrigin(), 0d)));
        // GTModelType geographic, GTRasterType pixel-is-area, GeographicType EPSG:4326
        List<Integer> geoKeys = Arrays.asList(1, 1, 0, 3, 1024, 0, 1, 2, 1025, 0, 1, 1, 2048, 0, 1, EPSG_WGS84);
        directory.addEntry(new FileDirectoryEntry(FieldTagType.GeoKeyDirectory, FieldType.SHORT, geoKeys.size(), geoKeys));

        if (palette != null) {
            List<Integer> colorMap = palette.toTiffColorMap();
            directory.addEntry(new FileDirectoryEntry(FieldTagType.ColorMap, FieldType.SHORT, colorMap.size(), colorMap));
        }
        Double noData = raster.getNoData();
        FieldTagType noDataTag = FieldTagType.getById(GeoTiffRasterSource.TAG_GDAL_NODATA);
        if (noData != null && noDataTag != null) {
            String text = formatNoData(noData);
            List<String> values = new ArrayList<>();
            values.add(text);
            directory.addEntry(new FileDirectoryEntry(noDataTag, FieldType.ASCII, text.length() + 1, values));
        }
        directory.setWriteRasters(rasters);

        TIFFImage tiffImage = new TIFFImage();
        tiffImage.add(directory);

        File file = target.toFile();
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.deleteIfExists(target);
        TiffWriter.writeTiff(file, tiffImage);
    }

    private static FieldType sampleType(int min, int max) {
        if (min >= 0 && max <= 0xFF) {
            return FieldType.BYTE;
        }
        if (min >= 0 && max <= 0xFFFF) {
            return FieldType.SHORT;
        }
        if (min >= Short.MIN_VALUE && max <= Short.MAX_VALUE) {
            return FieldType.SSHORT;
        }
        return FieldType.SLONG;
    }

    private static String formatNoData(double noData) {
        if (noData == Math.rint(noData) && !Double.isInfinite(noData)) {
            return Long.toString((long) noData);
        }
        return String.format(Locale.ROOT, "%s", noData);
    }
}
