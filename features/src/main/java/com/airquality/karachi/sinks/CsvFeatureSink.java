package com.airquality.karachi.sinks;

import com.airquality.karachi.models.FeatureSpec;
import com.airquality.karachi.models.FeatureTable;
import com.airquality.karachi.serialization.FeatureFormat;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the feature table as a flat CSV whose header is the spec column order.
 * The file is written beside the target and moved into place, so readers never
 * see a half-written table.
 */
public class CsvFeatureSink implements FeatureSink {

    private static final Logger LOG = LoggerFactory.getLogger(CsvFeatureSink.class);

    private final Path path;
    private final CsvMapper mapper = new CsvMapper();

    public CsvFeatureSink(Path path) {
        this.path = path;
    }

    @Override
    public void write(FeatureTable table, FeatureSpec spec) throws IOException {
        FeatureFormat.requireConforms(table, spec);

        List<String> header = spec.getColumns();
        CsvSchema.Builder schemaBuilder = CsvSchema.builder();
        for (String column : header) {
            schemaBuilder.addColumn(column);
        }
        CsvSchema schema = schemaBuilder.build();

        Path target = path.toAbsolutePath();
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");

        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
             SequenceWriter rows = mapper.writer(schema).writeValues(writer)) {
            // header written as a plain record so an empty table still carries it
            Map<String, String> headerRecord = new LinkedHashMap<>();
            for (String column : header) {
                headerRecord.put(column, column);
            }
            rows.write(headerRecord);
            for (int row = 0; row < table.size(); row++) {
                List<String> cells = FeatureFormat.formatRow(table, spec, row);
                Map<String, String> record = new LinkedHashMap<>();
                for (int c = 0; c < header.size(); c++) {
                    record.put(header.get(c), cells.get(c));
                }
                rows.write(record);
            }
        }

        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic move not supported for {}; replacing non-atomically", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        LOG.info("Wrote {} feature rows to {}", table.size(), target);
    }

    @Override
    public String describe() {
        return "csv:" + path;
    }
}
