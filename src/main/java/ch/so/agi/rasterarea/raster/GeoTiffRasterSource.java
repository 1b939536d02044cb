package ch.so.agi.rasterarea.raster;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import ch.so.agi.rasterarea.logging.AreaLogger;
import ch.so.agi.rasterarea.logging.LogEnvironment;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.ImageWindow;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;

/**
 * Single band GeoTIFF opened with the NGA TIFF library.
 * <p>
 * Georeferencing is taken from the ModelTiepoint and ModelPixelScale tags, the
 * colour table from ColorMap and the nodata value from the GDAL_NODATA tag. The
 * native block is the tile for tiled files and the strip otherwise. A window is
 * reported {@link BlockCoverage#EMPTY} when every block it touches was never
 * written (zero byte count), which is how sparse GeoTIFFs store holes. Reads
 * fill such blocks with the nodata value instead of decoding them.
 * </p>
 */
public class GeoTiffRasterSource implements RasterSource {
    static final int TAG_GDAL_NODATA = 42113;

    private final AreaLogger log;
    private final Path path;
    private FileDirectory directory;
    private final int width;
    private final int height;
    private final GeoTransform geoTransform;
    private final int blockWidth;
    private final int blockHeight;
    private final Palette palette;
    private final Double noData;
    private final List<Long> blockByteCounts;

    private GeoTiffRasterSource(Path path, FileDirectory directory) throws IOException {
        this.log = LogEnvironment.getLogger(this.getClass());
        this.path = path;
        this.directory = directory;
        this.width = directory.getImageWidth().intValue();
        this.height = directory.getImageHeight().intValue();
        this.geoTransform = readGeoTransform(path, directory);

        if (directory.isTiled()) {
            this.blockWidth = directory.getTileWidth().intValue();
            this.blockHeight = directory.getTileHeight().intValue();
            this.blockByteCounts = longValues(directory, FieldTagType.TileByteCounts);
        } else {
            Number rowsPerStrip = directory.getRowsPerStrip();
            this.blockWidth = width;
            this.blockHeight = rowsPerStrip == null ? height : Math.min(rowsPerStrip.intValue(), height);
            this.blockByteCounts = longValues(directory, FieldTagType.StripByteCounts);
        }

        List<Number> colorMap = numberValues(directory, FieldTagType.ColorMap);
        this.palette = colorMap.isEmpty() ? null : Palette.fromTiffColorMap(colorMap);
        this.noData = readNoData(directory);
    }

    /**
     * Opens a GeoTIFF file.
     *
     * @param path the raster file
     * @return the open raster
     * @throws IOException if the file does not exist, is not a TIFF or lacks georeferencing
     */
    public static GeoTiffRasterSource open(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        TIFFImage tiffImage = TiffReader.readTiff(path.toFile());
        List<FileDirectory> directories = tiffImage.getFileDirectories();
        if (directories == null || directories.isEmpty()) {
            throw new IOException("No image directory in " + path);
        }
        FileDirectory directory = directories.get(0);
        if (directory.getSamplesPerPixel() != 1) {
            throw new IOException("Expected a single band raster, got " + directory.getSamplesPerPixel()
                    + " samples per pixel in " + path);
        }
        return new GeoTiffRasterSource(path, directory);
    }

    public Path getPath() {
        return path;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public GeoTransform getGeoTransform() {
        return geoTransform;
    }

    @Override
    public int getBlockWidth() {
        return blockWidth;
    }

    @Override
    public int getBlockHeight() {
        return blockHeight;
    }

    @Override
    public Palette getPalette() {
        return palette;
    }

    @Override
    public Double getNoData() {
        return noData;
    }

    @Override
    public BlockCoverage getDataCoverageStatus(int xOff, int yOff, int cols, int rows) {
        RasterSource.checkWindow(this, xOff, yOff, cols, rows);
        if (blockByteCounts.isEmpty() || cols == 0 || rows == 0) {
            return BlockCoverage.DATA;
        }
        int blocksAcross = blocksAcross();
        for (int by = yOff / blockHeight; by <= (yOff + rows - 1) / blockHeight; by++) {
            for (int bx = xOff / blockWidth; bx <= (xOff + cols - 1) / blockWidth; bx++) {
                if (!isSparse(by * blocksAcross + bx)) {
                    return BlockCoverage.DATA;
                }
            }
        }
        return BlockCoverage.EMPTY;
    }

    /**
     * Reads a window. Blocks that were never written are not decoded; their
     * pixels are filled with the nodata value, or 0 without one.
     */
    @Override
    public RasterBlock read(int xOff, int yOff, int cols, int rows) throws IOException {
        RasterSource.checkWindow(this, xOff, yOff, cols, rows);
        if (directory == null) {
            throw new IOException("Raster already closed: " + path);
        }
        int[] values = new int[cols * rows];
        if (cols == 0 || rows == 0) {
            return new RasterBlock(xOff, yOff, cols, rows, values);
        }
        if (!containsSparseBlock(xOff, yOff, cols, rows)) {
            readInto(values, xOff, yOff, cols, xOff, yOff, xOff + cols, yOff + rows);
            return new RasterBlock(xOff, yOff, cols, rows, values);
        }

        int fill = noData == null ? 0 : (int) Math.round(noData);
        int blocksAcross = blocksAcross();
        for (int by = yOff / blockHeight; by <= (yOff + rows - 1) / blockHeight; by++) {
            int y0 = Math.max(yOff, by * blockHeight);
            int y1 = Math.min(yOff + rows, (by + 1) * blockHeight);
            for (int bx = xOff / blockWidth; bx <= (xOff + cols - 1) / blockWidth; bx++) {
                int x0 = Math.max(xOff, bx * blockWidth);
                int x1 = Math.min(xOff + cols, (bx + 1) * blockWidth);
                if (isSparse(by * blocksAcross + bx)) {
                    for (int y = y0; y < y1; y++) {
                        Arrays.fill(values, (y - yOff) * cols + (x0 - xOff), (y - yOff) * cols + (x1 - xOff), fill);
                    }
                } else {
                    readInto(values, xOff, yOff, cols, x0, y0, x1, y1);
                }
            }
        }
        return new RasterBlock(xOff, yOff, cols, rows, values);
    }

    private void readInto(int[] values, int xOff, int yOff, int cols, int x0, int y0, int x1, int y1)
            throws IOException {
        Rasters rasters;
        try {
            rasters = directory.readRasters(new ImageWindow(x0, y0, x1, y1));
        } catch (RuntimeException e) {
            throw new IOException("Failed to read window (" + x0 + "," + y0 + " " + (x1 - x0) + "x" + (y1 - y0)
                    + ") of " + path, e);
        }
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                values[(y - yOff) * cols + (x - xOff)] = rasters.getPixelSample(0, x - x0, y - y0).intValue();
            }
        }
    }

    private boolean containsSparseBlock(int xOff, int yOff, int cols, int rows) {
        if (blockByteCounts.isEmpty()) {
            return false;
        }
        int blocksAcross = blocksAcross();
        for (int by = yOff / blockHeight; by <= (yOff + rows - 1) / blockHeight; by++) {
            for (int bx = xOff / blockWidth; bx <= (xOff + cols - 1) / blockWidth; bx++) {
                if (isSparse(by * blocksAcross + bx)) {
                    return true;
                }
            }
        }
        return false;
    }

    private int blocksAcross() {
        return (width + blockWidth - 1) / blockWidth;
    }

    /**
     * A block without bytes was never written. Blocks past the end of the
     * byte count table count as written.
     */
    private boolean isSparse(int blockIndex) {
        return blockIndex < blockByteCounts.size() && blockByteCounts.get(blockIndex) == 0L;
    }

    @Override
    public void close() {
        if (directory != null) {
            log.debug("Closed raster " + path.getFileName());
        }
        directory = null;
    }

    private static GeoTransform readGeoTransform(Path path, FileDirectory directory) throws IOException {
        List<Number> scale = numberValues(directory, FieldTagType.ModelPixelScale);
        List<Number> tiepoint = numberValues(directory, FieldTagType.ModelTiepoint);
        if (scale.size() < 2 || tiepoint.size() < 6) {
            throw new IOException("Missing ModelPixelScale/ModelTiepoint georeferencing in " + path);
        }
        double scaleX = scale.get(0).doubleValue();
        double scaleY = scale.get(1).doubleValue();
        double i = tiepoint.get(0).doubleValue();
        double j = tiepoint.get(1).doubleValue();
        double x = tiepoint.get(3).doubleValue();
        double y = tiepoint.get(4).doubleValue();
        // tiepoint raster (i, j) maps to model (x, y); raster rows grow southwards
        return GeoTransform.of(x - i * scaleX, scaleX, y + j * scaleY, -scaleY);
    }

    private static Double readNoData(FileDirectory directory) {
        FieldTagType tag = FieldTagType.getById(TAG_GDAL_NODATA);
        if (tag == null) {
            return null;
        }
        FileDirectoryEntry entry = directory.get(tag);
        if (entry == null || entry.getValues() == null) {
            return null;
        }
        Object values = entry.getValues();
        String text;
        if (values instanceof List<?>) {
            List<?> list = (List<?>) values;
            text = list.isEmpty() ? null : String.valueOf(list.get(0));
        } else {
            text = String.valueOf(values);
        }
        if (text == null) {
            return null;
        }
        text = text.trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Malformed GDAL_NODATA value: " + text, e);
        }
    }

    /**
     * Extracts the numeric values of a tag, whether stored as a single value or
     * as a list.
     */
    static List<Number> numberValues(FileDirectory directory, FieldTagType tag) {
        FileDirectoryEntry entry = directory.get(tag);
        if (entry == null || entry.getValues() == null) {
            return Collections.emptyList();
        }
        Object values = entry.getValues();
        List<Number> out = new ArrayList<>();
        if (values instanceof List<?>) {
            for (Object item : (List<?>) values) {
                if (item instanceof Number) {
                    out.add((Number) item);
                }
            }
        } else if (values instanceof Number) {
            out.add((Number) values);
        }
        return out;
    }

    private static List<Long> longValues(FileDirectory directory, FieldTagType tag) {
        List<Long> out = new ArrayList<>();
        for (Number n : numberValues(directory, tag)) {
            out.add(n.longValue());
        }
        return out;
    }

    @Override
    public String toString() {
        return "GeoTiffRasterSource(" + path + " " + width + "x" + height + ", block " + blockWidth + "x" + blockHeight + ")";
    }
}
