package im.arun.scenebridge.backup;

import im.arun.scenebridge.model.GeneratedNode;

import java.util.Optional;
import java.util.Set;

/**
 * Prior generations, keyed by logical root key ({@code Pages/Home}, {@code Screens/Login}, ...).
 */
public interface BackupProvider {

    Optional<GeneratedNode> load(String rootKey);

    Set<String> rootKeys();

    /**
     * Supersedes the backup of a root. Called only after a successful generation.
     */
    void store(String rootKey, GeneratedNode root);
}
