package com.hltvsync.infrastructure.snapshot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.UnitOfWork;
import com.hltvsync.domain.ports.SnapshotStore;
import com.hltvsync.infrastructure.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Writes one JSON file per completed unit under {@code <directory>/<PAGE_KIND>/<id>.json}.
 */
@Component
public class JsonSnapshotStore implements SnapshotStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonSnapshotStore.class);

    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final boolean enabled;
    private final Path directory;

    @Autowired
    public JsonSnapshotStore(ScraperProperties properties) {
        this(properties.getSnapshots().isEnabled(), Paths.get(properties.getSnapshots().getDirectory()));
    }

    public JsonSnapshotStore(boolean enabled, Path directory) {
        this.enabled = enabled;
        this.directory = directory;
    }

    @Override
    public void emit(UnitOfWork unit, Extraction extraction) {
        if (!enabled) {
            return;
        }
        Path target = directory.resolve(unit.pageKind().name()).resolve(unit.externalId() + ".json");
        try {
            Files.createDirectories(target.getParent());
            OBJECT_MAPPER.writeValue(target.toFile(), extraction);
            logger.debug("Wrote snapshot {}", target);
        } catch (IOException e) {
            logger.warn("Failed to write snapshot for {}: {}", unit.key(), e.getMessage());
        }
    }

    @Override
    public List<Extraction> loadAll(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Snapshot directory not found: " + root);
        }
        List<Path> files;
        try (Stream<Path> paths = Files.walk(root)) {
            files = paths
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(".json"))
                .sorted(Comparator.comparing(Path::toString))
                .toList();
        }

        List<Extraction> extractions = new ArrayList<>();
        for (Path file : files) {
            extractions.add(OBJECT_MAPPER.readValue(file.toFile(), Extraction.class));
        }
        extractions.sort(Comparator.comparingInt(extraction -> extraction.pageKind().getLevel()));
        logger.info("Loaded {} snapshots from {}", extractions.size(), root);
        return extractions;
    }
}
