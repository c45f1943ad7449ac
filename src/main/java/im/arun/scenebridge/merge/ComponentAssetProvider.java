package im.arun.scenebridge.merge;

import im.arun.scenebridge.model.GeneratedNode;

import java.util.Optional;

/**
 * Creates fresh instances of reusable assets (components, screens) by root key.
 */
public interface ComponentAssetProvider {

    Optional<GeneratedNode> instantiate(String assetKey);

    static ComponentAssetProvider none() {
        return assetKey -> Optional.empty();
    }
}
