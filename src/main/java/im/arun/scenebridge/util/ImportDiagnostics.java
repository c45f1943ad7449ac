package im.arun.scenebridge.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates structured diagnostics for one import run and can write them out as JSON.
 * Every entry is also forwarded to SLF4J at the matching level.
 */
public class ImportDiagnostics {
    private static final Logger logger = LoggerFactory.getLogger(ImportDiagnostics.class);

    public enum Level { INFO, WARNING }

    public enum Category {
        STRUCTURAL_MISMATCH,
        MISSING_COMPONENT,
        FIELD_COPY,
        IMAGE_FETCH,
        CLASSIFICATION,
        GENERAL
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        @JsonProperty("level")
        private Level level;
        @JsonProperty("category")
        private Category category;
        @JsonProperty("node_id")
        private String nodeId;
        @JsonProperty("message")
        private String message;
    }

    private static final ObjectMapper WRITER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final List<Entry> entries = Collections.synchronizedList(new ArrayList<>());

    public void info(Category category, String nodeId, String message, Object... args) {
        record(Level.INFO, category, nodeId, message, args);
    }

    public void warn(Category category, String nodeId, String message, Object... args) {
        record(Level.WARNING, category, nodeId, message, args);
    }

    private void record(Level level, Category category, String nodeId, String message, Object... args) {
        String formatted = args.length > 0 ? String.format(message, args) : message;
        entries.add(new Entry(level, category, nodeId, formatted));
        if (level == Level.WARNING) {
            logger.warn("[{}] {}", category, formatted);
        } else {
            logger.info("[{}] {}", category, formatted);
        }
    }

    public List<Entry> getEntries() {
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    /**
     * Writes the given entries to a file as an indented JSON array, creating parent directories.
     */
    public static void writeTo(Path logPath, List<Entry> entries) throws IOException {
        if (logPath.getParent() != null) {
            Files.createDirectories(logPath.getParent());
        }
        WRITER.writeValue(logPath.toFile(), entries);
    }
}
