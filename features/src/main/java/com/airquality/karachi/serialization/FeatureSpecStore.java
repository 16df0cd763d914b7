package com.airquality.karachi.serialization;

import com.airquality.karachi.errors.SchemaMismatchException;
import com.airquality.karachi.models.FeatureSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists the Feature Spec as JSON, once per schema version.
 *
 * Freezing a spec identical to the stored one is a no-op. A different spec under
 * the stored version is schema drift and fails the run; bump the version instead.
 */
public class FeatureSpecStore {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureSpecStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public FeatureSpecStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Optional<FeatureSpec> read() throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(path.toFile(), FeatureSpec.class));
    }

    /**
     * Writes the spec unless the same version is already stored.
     *
     * @return true if the file was (re)written
     */
    public boolean freeze(FeatureSpec spec) throws IOException {
        Optional<FeatureSpec> existing = read();
        if (existing.isPresent() && existing.get().getVersion() == spec.getVersion()) {
            if (!existing.get().equals(spec)) {
                throw new SchemaMismatchException(String.format(
                        "Feature spec v%d at %s differs from the derived spec; bump SCHEMA_VERSION",
                        spec.getVersion(), path));
            }
            LOG.info("Feature spec v{} already frozen at {}", spec.getVersion(), path);
            return false;
        }
        if (existing.isPresent()) {
            LOG.info("Replacing feature spec v{} with v{}", existing.get().getVersion(), spec.getVersion());
        }

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(path.toFile(), spec);
        LOG.info("Froze feature spec v{} ({} feature columns) to {}",
                spec.getVersion(), spec.getFeatureColumns().size(), path);
        return true;
    }

    public Path getPath() {
        return path;
    }
}
