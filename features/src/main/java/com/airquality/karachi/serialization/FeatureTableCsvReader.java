package com.airquality.karachi.serialization;

import com.airquality.karachi.errors.SchemaMismatchException;
import com.airquality.karachi.models.FeatureSpec;
import com.airquality.karachi.models.FeatureTable;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a persisted feature table back for serving, checking it against the spec.
 */
public class FeatureTableCsvReader {

    private final CsvMapper mapper;

    public FeatureTableCsvReader() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public FeatureTable read(Path path, FeatureSpec spec) throws IOException {
        List<String[]> lines = new ArrayList<>();
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .readValues(path.toFile())) {
            while (it.hasNext()) {
                lines.add(it.next());
            }
        }
        if (lines.isEmpty()) {
            throw new IOException("Feature table has no header: " + path);
        }

        List<String> header = Arrays.asList(lines.get(0));
        if (!header.equals(spec.getColumns())) {
            throw new SchemaMismatchException(String.format(
                    "Feature table %s header %s does not match spec v%d %s",
                    path, header, spec.getVersion(), spec.getColumns()));
        }

        int rows = lines.size() - 1;
        long[] timestamps = new long[rows];
        Map<String, Double[]> columns = new LinkedHashMap<>();
        for (int c = 1; c < header.size(); c++) {
            columns.put(header.get(c), new Double[rows]);
        }
        for (int row = 0; row < rows; row++) {
            String[] cells = lines.get(row + 1);
            if (cells.length != header.size()) {
                throw new IOException(String.format(
                        "Line %d of %s has %d cells, expected %d", row + 2, path, cells.length, header.size()));
            }
            try {
                timestamps[row] = Long.parseLong(cells[0]);
                for (int c = 1; c < cells.length; c++) {
                    columns.get(header.get(c))[row] = Double.parseDouble(cells[c]);
                }
            } catch (NumberFormatException e) {
                throw new IOException(String.format("Non-numeric cell at line %d of %s", row + 2, path), e);
            }
        }
        return new FeatureTable(timestamps, columns);
    }
}
