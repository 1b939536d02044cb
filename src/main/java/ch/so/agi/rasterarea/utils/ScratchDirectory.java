package ch.so.agi.rasterarea.utils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

import ch.so.agi.rasterarea.logging.AreaLogger;
import ch.so.agi.rasterarea.logging.LogEnvironment;

/**
 * Run scoped temporary directory holding the per-feature cutline shapefiles
 * and clipped rasters. Created once per run and removed recursively on
 * {@link #close()}; use it with try-with-resources so removal happens on every
 * exit path.
 */
public final class ScratchDirectory implements AutoCloseable {
    private static final String PREFIX = "raster-area-";

    private final AreaLogger log;
    private final Path path;
    private boolean closed;

    private ScratchDirectory(Path path) {
        this.path = path;
        this.log = LogEnvironment.getLogger(this.getClass());
    }

    /**
     * Creates a new scratch directory below the default temporary directory.
     *
     * @return the open scratch directory
     * @throws IOException if the directory cannot be created
     */
    public static ScratchDirectory create() throws IOException {
        return new ScratchDirectory(Files.createTempDirectory(PREFIX));
    }

    /**
     * Creates a new scratch directory below {@code parent}.
     *
     * @param parent existing directory to create the scratch directory in
     * @return the open scratch directory
     * @throws IOException if the directory cannot be created
     */
    public static ScratchDirectory createIn(Path parent) throws IOException {
        return new ScratchDirectory(Files.createTempDirectory(parent, PREFIX));
    }

    public Path getPath() {
        return path;
    }

    /**
     * Resolves a file name inside the scratch directory.
     *
     * @param fileName plain file name
     * @return path inside the directory
     * @throws IllegalStateException if the directory has already been removed
     */
    public Path resolve(String fileName) {
        if (closed) {
            throw new IllegalStateException("Scratch directory already removed: " + path);
        }
        return path.resolve(fileName);
    }

    /**
     * Deletes the given scratch files if they exist.
     *
     * @param files files previously resolved in this directory
     * @throws IOException if a file cannot be deleted
     */
    public void delete(Path... files) throws IOException {
        for (Path file : files) {
            if (Files.deleteIfExists(file)) {
                log.debug("Deleted scratch file " + file.getFileName());
            }
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        log.debug("Removed scratch directory " + path);
    }
}
