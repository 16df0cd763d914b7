package com.airquality.karachi.sources;

import com.airquality.karachi.models.RawObservation;
import com.airquality.karachi.models.RawTable;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a raw table from a delimited file with a header row.
 *
 * Every non-key column is a channel. Empty, NaN, null and None cells are missing
 * readings; any other non-numeric cell fails the load.
 */
public class CsvRawSource implements RawDataSource {

    private static final Logger LOG = LoggerFactory.getLogger(CsvRawSource.class);
    private static final Set<String> NULL_TOKENS = Set.of("", "nan", "null", "none");

    private final Path path;
    private final String timestampColumn;
    private final char separator;

    public CsvRawSource(Path path) {
        this(path, "timestamp", ',');
    }

    public CsvRawSource(Path path, String timestampColumn, char separator) {
        this.path = path;
        this.timestampColumn = timestampColumn;
        this.separator = separator;
    }

    @Override
    public RawTable load() throws IOException {
        if (!Files.isReadable(path)) {
            throw new NoSuchFileException(path.toString());
        }

        CsvMapper mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);

        List<String[]> lines = new ArrayList<>();
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class)
                .with(CsvSchema.emptySchema().withColumnSeparator(separator))
                .readValues(path.toFile())) {
            while (it.hasNext()) {
                lines.add(it.next());
            }
        }
        if (lines.isEmpty()) {
            throw new IOException("Raw file has no header: " + path);
        }

        String[] header = lines.get(0);
        int keyIndex = Arrays.asList(header).indexOf(timestampColumn);
        if (keyIndex < 0) {
            throw new IOException(String.format(
                    "Raw file %s has no '%s' column", path, timestampColumn));
        }
        List<String> columns = new ArrayList<>();
        for (int c = 0; c < header.length; c++) {
            if (c != keyIndex) {
                columns.add(header[c]);
            }
        }

        List<RawObservation> observations = new ArrayList<>(lines.size() - 1);
        for (int line = 1; line < lines.size(); line++) {
            String[] cells = lines.get(line);
            Map<String, Double> values = new HashMap<>();
            for (int c = 0; c < header.length; c++) {
                if (c == keyIndex) {
                    continue;
                }
                String cell = c < cells.length ? cells[c] : "";
                values.put(header[c], parseCell(cell, line, header[c]));
            }
            String timestamp = keyIndex < cells.length ? cells[keyIndex] : null;
            observations.add(new RawObservation(timestamp, values));
        }

        LOG.info("Loaded {} raw rows with columns {} from {}", observations.size(), columns, path);
        return new RawTable(columns, observations);
    }

    private Double parseCell(String cell, int line, String column) throws IOException {
        String trimmed = cell.trim();
        if (NULL_TOKENS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return null;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw new IOException(String.format(
                    "Non-numeric value '%s' in column '%s' at line %d of %s", cell, column, line + 1, path), e);
        }
    }

    @Override
    public String describe() {
        return "csv:" + path;
    }
}
