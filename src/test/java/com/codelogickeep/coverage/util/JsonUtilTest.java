package com.codelogickeep.coverage.util;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("writeAtomically should create parent directories and leave no temp files")
    void writeAtomically_shouldReplaceTarget() throws IOException {
        Path file = tempDir.resolve("nested/dir/data.json");

        JsonUtil.writeAtomically(file, Map.of("value", 1));
        JsonUtil.writeAtomically(file, Map.of("value", 2));

        Map<String, Integer> read = JsonUtil.read(file,
                new TypeReference<Map<String, Integer>>() {
                });
        assertEquals(2, read.get("value"));
        try (var files = Files.list(file.getParent())) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    @DisplayName("read should fail on malformed documents")
    void read_shouldFailOnMalformedJson() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"value\": ");

        assertThrows(IOException.class, () -> JsonUtil.read(file, new TypeReference<Map<String, Object>>() {
        }));
    }

    @Test
    @DisplayName("toJson should indent output")
    void toJson_shouldIndent() throws IOException {
        assertTrue(JsonUtil.toJson(Map.of("a", 1)).contains("\n"));
    }
}
