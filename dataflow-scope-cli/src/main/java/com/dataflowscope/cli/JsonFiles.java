package com.dataflowscope.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared JSON reading and writing for the CLI commands.
 *
 * <p>Reading ignores unknown properties so that extractor output carrying extra fields
 * still binds. Writing is pretty-printed.
 */
final class JsonFiles {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonFiles() {
        // Utility class
    }

    static <T> T read(Path file, Class<T> type) throws IOException {
        return MAPPER.readValue(file.toFile(), type);
    }

    static String write(Object value) throws IOException {
        return MAPPER.writeValueAsString(value);
    }

    /**
     * Writes a value to a file, creating missing parent directories.
     *
     * @param file target file
     * @param value value to serialise
     * @throws IOException if the file cannot be written
     */
    static void write(Path file, Object value) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, write(value));
    }
}
