package ch.so.agi.rasterarea.raster;

/**
 * Data coverage status of a raster window, as reported before reading it.
 */
public enum BlockCoverage {
    /** Window contains stored pixel data. */
    DATA,
    /** Window is a sparse hole; reading it would only return fill values. */
    EMPTY
}
