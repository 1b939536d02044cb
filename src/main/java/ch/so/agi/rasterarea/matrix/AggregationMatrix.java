package ch.so.agi.rasterarea.matrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Region by classification accumulator of area in square kilometres.
 * <p>
 * The column universe is fixed when the matrix is created. A row, once
 * created, holds one zero-initialised cell per column; cells only ever grow.
 * Rows are kept in ascending region order. Instances are not thread safe;
 * parallel scans fill one matrix per worker and {@link #mergeFrom merge} them.
 * </p>
 *
 * @param <K> classification key type
 */
public final class AggregationMatrix<K> {
    private final List<K> columns;
    private final Map<K, Integer> columnIndex;
    private final TreeMap<String, double[]> rows = new TreeMap<>();

    public AggregationMatrix(List<K> columns) {
        Objects.requireNonNull(columns, "columns");
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.columnIndex = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            if (columnIndex.put(this.columns.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate column " + this.columns.get(i));
            }
        }
    }

    /**
     * Creates an empty matrix with the same columns.
     */
    public AggregationMatrix<K> emptyCopy() {
        return new AggregationMatrix<>(columns);
    }

    /**
     * Creates the zero-filled row of {@code region} unless it exists.
     */
    public void ensureRegion(String region) {
        Objects.requireNonNull(region, "region");
        rows.computeIfAbsent(region, r -> new double[columns.size()]);
    }

    /**
     * Adds area to a cell. A {@code null} key (no data) is ignored.
     *
     * @param region  region name
     * @param key     classification key, {@code null} for no data
     * @param areaKm2 non-negative area
     * @throws IllegalArgumentException if the area is negative or NaN, or the
     *                                  key is not one of the columns
     */
    public void add(String region, K key, double areaKm2) {
        if (key == null) {
            return;
        }
        if (!(areaKm2 >= 0)) {
            throw new IllegalArgumentException("Area must be non-negative: " + areaKm2);
        }
        Integer index = columnIndex.get(key);
        if (index == null) {
            throw new IllegalArgumentException("Unknown classification key: " + key);
        }
        ensureRegion(region);
        rows.get(region)[index] += areaKm2;
    }

    /**
     * Sums all cells of {@code other} into this matrix.
     *
     * @throws IllegalArgumentException if the columns differ
     */
    public void mergeFrom(AggregationMatrix<K> other) {
        if (!columns.equals(other.columns)) {
            throw new IllegalArgumentException("Cannot merge matrices with different columns");
        }
        for (Map.Entry<String, double[]> e : other.rows.entrySet()) {
            ensureRegion(e.getKey());
            double[] target = rows.get(e.getKey());
            double[] source = e.getValue();
            for (int i = 0; i < target.length; i++) {
                target[i] += source[i];
            }
        }
    }

    /**
     * @return the cell value, {@code 0} if the row does not exist
     */
    public double get(String region, K key) {
        Integer index = columnIndex.get(key);
        if (index == null) {
            throw new IllegalArgumentException("Unknown classification key: " + key);
        }
        double[] row = rows.get(region);
        return row == null ? 0d : row[index];
    }

    public boolean containsRegion(String region) {
        return rows.containsKey(region);
    }

    /**
     * @return region names in ascending order
     */
    public List<String> regions() {
        return new ArrayList<>(rows.keySet());
    }

    public List<K> columns() {
        return columns;
    }

    /**
     * @return the cells of a region in column order
     * @throws IllegalArgumentException if the region has no row
     */
    public Map<K, Double> row(String region) {
        double[] row = rows.get(region);
        if (row == null) {
            throw new IllegalArgumentException("No row for region " + region);
        }
        Map<K, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            out.put(columns.get(i), row[i]);
        }
        return out;
    }

    /**
     * @return sum of all cells of a region
     */
    public double total(String region) {
        double[] row = rows.get(region);
        double sum = 0d;
        if (row != null) {
            for (double v : row) {
                sum += v;
            }
        }
        return sum;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
