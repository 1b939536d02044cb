package ch.so.agi.rasterarea.matrix;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;

/**
 * Writes an {@link AggregationMatrix} as a delimited table: one row per region
 * in ascending order, first column the region name, then one column per
 * classification key in lookup order.
 */
public final class MatrixCsvWriter {
    private final OutputFormat format;

    public MatrixCsvWriter(OutputFormat format) {
        this.format = format;
    }

    public void write(AggregationMatrix<?> matrix, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(matrix, out);
        }
    }

    public void write(AggregationMatrix<?> matrix, Writer out) throws IOException {
        ICSVWriter csv = new CSVWriter(out, format.getDelimiter(), ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER, "\n");
        List<?> columns = matrix.columns();
        String[] header = new String[columns.size() + 1];
        header[0] = format.getIndexLabel();
        for (int i = 0; i < columns.size(); i++) {
            header[i + 1] = String.valueOf(columns.get(i));
        }
        csv.writeNext(header, false);

        for (String region : matrix.regions()) {
            Map<?, Double> cells = matrix.row(region);
            String[] line = new String[cells.size() + 1];
            line[0] = region;
            int i = 1;
            for (Double value : cells.values()) {
                line[i++] = formatArea(value);
            }
            csv.writeNext(line, false);
        }
        csv.flush();
        if (csv.checkError()) {
            throw new IOException("Failed to write matrix");
        }
    }

    String formatArea(double value) {
        return BigDecimal.valueOf(value).setScale(format.getDecimalPlaces(), RoundingMode.HALF_EVEN).toPlainString();
    }
}
