package com.foiarelay.directory.persistence;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.model.CanonicalRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Keeps the directory as one pretty-printed JSON array. Writes go to a sibling temp file
 * that is then moved over the target, so readers never see a half-written list.
 */
@Repository
@ConditionalOnProperty(prefix = "directory.store", name = "backend", havingValue = "file")
public class JsonFileDirectoryRepository implements DirectoryRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonFileDirectoryRepository.class);
    private static final TypeReference<List<CanonicalRecord>> RECORD_LIST = new TypeReference<>() {};

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileDirectoryRepository(DirectoryProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getStore().getFilePath()), objectMapper);
    }

    JsonFileDirectoryRepository(Path path, ObjectMapper objectMapper) {
        this.path = path.toAbsolutePath().normalize();
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String backend() {
        return "file";
    }

    @Override
    public List<CanonicalRecord> loadAll() {
        if (!Files.exists(path)) {
            log.info("Directory file {} not found; starting with an empty directory", path);
            return List.of();
        }
        try {
            List<CanonicalRecord> records = objectMapper.readValue(path.toFile(), RECORD_LIST);
            return records == null ? List.of() : List.copyOf(records);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read directory file " + path, e);
        }
    }

    @Override
    public void replaceAll(List<CanonicalRecord> records) {
        List<CanonicalRecord> safe = records == null ? List.of() : records;
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent == null ? Path.of(".") : parent, "agency-directory", ".json.tmp");
            objectMapper.writeValue(temp.toFile(), safe);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Wrote {} directory record(s) to {}", safe.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write directory file " + path, e);
        }
    }
}
