package ch.so.agi.rasterarea.utils;

/**
 * Baseclass for all fatal failures raised by the aggregation steps.
 *
 * The tasks pass pure RasterAreaExceptions through unchanged and wrap checked
 * I/O failures into one, so the command line only has to handle a single
 * exception type.
 */
public class RasterAreaException extends RuntimeException {

    private String type;

    public RasterAreaException() {}

    public RasterAreaException(String message) {
        super(message);
    }

    public RasterAreaException(String message, Throwable cause) {
        super(message, cause);
    }

    public RasterAreaException(Throwable cause) {
        super(cause);
    }

    public RasterAreaException(String type, String message) {
        super(message);
        this.type = type;
    }

    public String getType() {
        return this.type;
    }
}
