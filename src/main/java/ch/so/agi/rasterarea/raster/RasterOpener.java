package ch.so.agi.rasterarea.raster;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens a raster file. Every parallel worker opens its own handle through an
 * opener; handles are never shared between threads.
 */
@FunctionalInterface
public interface RasterOpener {

    RasterSource open(Path path) throws IOException;

    /**
     * @return opener for GeoTIFF files
     */
    static RasterOpener geoTiff() {
        return GeoTiffRasterSource::open;
    }
}
