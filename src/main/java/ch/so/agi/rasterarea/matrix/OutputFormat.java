package ch.so.agi.rasterarea.matrix;

/**
 * Display settings used when a matrix is serialised.
 */
public final class OutputFormat {
    public static final OutputFormat DEFAULT = new OutputFormat("Country", 2, ',');

    private final String indexLabel;
    private final int decimalPlaces;
    private final char delimiter;

    /**
     * @param indexLabel    header of the region column
     * @param decimalPlaces fraction digits of area cells
     * @param delimiter     field separator
     */
    public OutputFormat(String indexLabel, int decimalPlaces, char delimiter) {
        if (decimalPlaces < 0) {
            throw new IllegalArgumentException("decimalPlaces must not be negative");
        }
        this.indexLabel = indexLabel;
        this.decimalPlaces = decimalPlaces;
        this.delimiter = delimiter;
    }

    public String getIndexLabel() {
        return indexLabel;
    }

    public int getDecimalPlaces() {
        return decimalPlaces;
    }

    public char getDelimiter() {
        return delimiter;
    }
}
