package ch.so.agi.rasterarea.boundary;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

/**
 * {@link RegionNameResolver} backed by a two column mapping table
 * {@code raw name,canonical name}.
 * <p>
 * A blank canonical name marks a feature to be skipped. Names missing from
 * the table are returned unchanged. Lines starting with {@code #} are
 * comments.
 * </p>
 */
public final class MappingRegionNameResolver implements RegionNameResolver {
    private final Map<String, String> mapping;

    public MappingRegionNameResolver(Map<String, String> mapping) {
        this.mapping = Collections.unmodifiableMap(new HashMap<>(mapping));
    }

    /**
     * Loads the mapping from a UTF-8 CSV file.
     *
     * @param csvFile mapping table
     * @return the resolver
     * @throws IOException if the file cannot be read or is malformed
     */
    public static MappingRegionNameResolver load(Path csvFile) throws IOException {
        Map<String, String> mapping = new HashMap<>();
        try (Reader in = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8);
                CSVReader csv = new CSVReader(in)) {
            String[] line;
            while ((line = csv.readNext()) != null) {
                if (line.length == 0 || line[0].isBlank() || line[0].startsWith("#")) {
                    continue;
                }
                String canonical = line.length > 1 ? line[1].trim() : "";
                mapping.put(line[0].trim(), canonical);
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed name mapping " + csvFile, e);
        }
        return new MappingRegionNameResolver(mapping);
    }

    @Override
    public String lookup(String rawAdminName) {
        if (rawAdminName == null || rawAdminName.isBlank()) {
            return null;
        }
        String name = rawAdminName.trim();
        if (!mapping.containsKey(name)) {
            return name;
        }
        String canonical = mapping.get(name);
        return canonical.isEmpty() ? null : canonical;
    }
}
