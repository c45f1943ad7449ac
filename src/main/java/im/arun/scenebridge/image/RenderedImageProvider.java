package im.arun.scenebridge.image;

import java.util.Optional;

/**
 * Supplies rasterized images for server rendered nodes. Retrieval is complete before the
 * core runs; the core only pulls bytes for nodes it has classified for server rendering.
 */
public interface RenderedImageProvider {

    /**
     * @return image bytes for the node, empty when the renderer produced nothing for it
     * @throws ImageUnavailableException when the image cannot be read
     */
    Optional<byte[]> imageFor(String nodeId);

    static RenderedImageProvider none() {
        return nodeId -> Optional.empty();
    }
}
