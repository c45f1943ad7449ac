package im.arun.scenebridge.backup;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.scenebridge.model.GeneratedNode;
import im.arun.scenebridge.model.RootKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Backups stored as JSON files, one per root: {@code <dir>/<Folder>/<name>.json}.
 */
public class JsonDirectoryBackupProvider implements BackupProvider {
    private static final Logger logger = LoggerFactory.getLogger(JsonDirectoryBackupProvider.class);
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonDirectoryBackupProvider(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public Optional<GeneratedNode> load(String rootKey) {
        Path file = fileFor(rootKey);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), GeneratedNode.class));
        } catch (IOException e) {
            // An unreadable backup only costs the customizations it held
            logger.warn("Ignoring unreadable backup {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Set<String> rootKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (RootKind kind : RootKind.values()) {
            Path folder = directory.resolve(kind.getFolder());
            if (!Files.isDirectory(folder)) {
                continue;
            }
            try (Stream<Path> files = Files.list(folder)) {
                files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .sorted()
                    .forEach(name -> keys.add(kind.getFolder() + "/" + name.substring(0, name.length() - EXTENSION.length())));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list backups in " + folder, e);
            }
        }
        return keys;
    }

    @Override
    public void store(String rootKey, GeneratedNode root) {
        Path file = fileFor(rootKey);
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(file.toFile(), root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write backup " + file, e);
        }
    }

    private Path fileFor(String rootKey) {
        return directory.resolve(rootKey + EXTENSION);
    }
}
