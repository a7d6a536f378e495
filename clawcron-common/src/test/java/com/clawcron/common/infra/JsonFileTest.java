package com.clawcron.common.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void read_missingFile_returnsNull() throws IOException {
        assertNull(JsonFile.read(MAPPER, tempDir.resolve("missing.json"), Map.class));
    }

    @Test
    void read_blankFile_returnsNull() throws IOException {
        Path path = tempDir.resolve("blank.json");
        Files.writeString(path, "  \n");
        assertNull(JsonFile.read(MAPPER, path, Map.class));
    }

    @Test
    void read_malformedFile_throws() throws IOException {
        Path path = tempDir.resolve("bad.json");
        Files.writeString(path, "{ not json");
        assertThrows(JsonProcessingException.class, () -> JsonFile.read(MAPPER, path, Map.class));
    }

    @Test
    void writeAtomic_createsParentsAndLeavesNoTempFiles() throws IOException {
        Path path = tempDir.resolve("nested/dir/data.json");

        JsonFile.writeAtomic(MAPPER, path, Map.of("jobs", List.of("a", "b")));

        Map<?, ?> loaded = JsonFile.read(MAPPER, path, Map.class);
        assertEquals(List.of("a", "b"), loaded.get("jobs"));
        try (Stream<Path> files = Files.list(path.getParent())) {
            assertEquals(List.of(path.getFileName()), files.map(Path::getFileName).toList());
        }
    }

    @Test
    void writeAtomic_replacesExistingContent() throws IOException {
        Path path = tempDir.resolve("data.json");
        JsonFile.writeAtomic(MAPPER, path, Map.of("v", 1));
        JsonFile.writeAtomic(MAPPER, path, Map.of("v", 2));

        assertEquals(2, JsonFile.read(MAPPER, path, Map.class).get("v"));
    }
}
