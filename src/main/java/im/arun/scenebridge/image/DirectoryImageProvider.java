package im.arun.scenebridge.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads pre-rendered images named {@code <node id with ':' replaced by '_'>.png} from a directory.
 */
public class DirectoryImageProvider implements RenderedImageProvider {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryImageProvider.class);

    private final Path directory;

    public DirectoryImageProvider(Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<byte[]> imageFor(String nodeId) {
        Path file = directory.resolve(safeFileName(nodeId) + ".png");
        if (!Files.exists(file)) {
            logger.debug("No rendered image for node {} at {}", nodeId, file);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new ImageUnavailableException("Failed to read rendered image " + file, e);
        }
    }

    public static String safeFileName(String nodeId) {
        return nodeId.replace(":", "_");
    }
}
