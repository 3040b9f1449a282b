package com.foiarelay.directory.persistence;

import com.foiarelay.directory.model.CanonicalRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileDirectoryRepositoryTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void missingFileLoadsAsEmptyDirectory() {
        JsonFileDirectoryRepository repository = new JsonFileDirectoryRepository(tempDir.resolve("none.json"), objectMapper);

        assertThat(repository.loadAll()).isEmpty();
    }

    @Test
    void writesPrettyArrayAndReadsItBack() throws Exception {
        Path file = tempDir.resolve("nested/agency-directory.json");
        JsonFileDirectoryRepository repository = new JsonFileDirectoryRepository(file, objectMapper);
        Instant reconciledAt = Instant.parse("2026-04-01T09:30:00Z");
        List<CanonicalRecord> records = List.of(
            new CanonicalRecord("b", "Bravo", "B", "", "", List.of("b@agency.gov"), "", "", "", "", reconciledAt),
            new CanonicalRecord("a", "Alpha", "A", "", "", List.of(), "", "", "", "", reconciledAt)
        );

        repository.replaceAll(records);

        String json = Files.readString(file);
        assertThat(json).startsWith("[").contains("\n").contains("\"unitId\" : \"b\"").contains("2026-04-01T09:30:00Z");
        assertThat(repository.loadAll()).isEqualTo(records);
        try (var siblings = Files.list(file.getParent())) {
            assertThat(siblings.map(path -> path.getFileName().toString())).containsExactly("agency-directory.json");
        }
    }

    @Test
    void replaceOverwritesPreviousFile() {
        Path file = tempDir.resolve("agency-directory.json");
        JsonFileDirectoryRepository repository = new JsonFileDirectoryRepository(file, objectMapper);
        Instant now = Instant.EPOCH;

        repository.replaceAll(List.of(new CanonicalRecord("old", "Old", "", "", "", List.of(), "", "", "", "", now)));
        repository.replaceAll(List.of(new CanonicalRecord("new", "New", "", "", "", List.of(), "", "", "", "", now)));

        assertThat(repository.loadAll()).extracting(CanonicalRecord::unitId).containsExactly("new");
    }

    @Test
    void corruptFileSurfacesAsError() throws Exception {
        Path file = tempDir.resolve("agency-directory.json");
        Files.writeString(file, "{not an array");
        JsonFileDirectoryRepository repository = new JsonFileDirectoryRepository(file, objectMapper);

        assertThatThrownBy(repository::loadAll).isInstanceOf(UncheckedIOException.class);
    }
}
