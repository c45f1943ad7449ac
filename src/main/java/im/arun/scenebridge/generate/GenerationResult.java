package im.arun.scenebridge.generate;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of one generation pass: the registry holding every generated root, plus the
 * rendered images pulled for server rendered nodes.
 */
@Getter
public class GenerationResult {
    private final ComponentRegistry registry;
    private final Map<String, byte[]> renderedImages;

    public GenerationResult(ComponentRegistry registry, Map<String, byte[]> renderedImages) {
        this.registry = registry;
        this.renderedImages = Collections.unmodifiableMap(new LinkedHashMap<>(renderedImages));
    }
}
