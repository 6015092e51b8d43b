package com.notropolis.economy.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Reads and writes {@link WorldSnapshot} JSON files.
 */
public class WorldSnapshotIO {

    private static final Logger log = LoggerFactory.getLogger(WorldSnapshotIO.class);

    private final ObjectMapper mapper;

    public WorldSnapshotIO() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public WorldSnapshot read(Path file) throws IOException {
        WorldSnapshot snapshot = mapper.readValue(file.toFile(), WorldSnapshot.class);
        log.debug("Read snapshot {}: {} maps, {} tiles, {} companies, {} buildings", file, snapshot.getMaps().size(),
                snapshot.getTiles().size(), snapshot.getCompanies().size(), snapshot.getBuildings().size());
        return snapshot;
    }

    public void write(WorldSnapshot snapshot, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(file.toFile(), snapshot);
        log.debug("Wrote snapshot {}", file);
    }
}
