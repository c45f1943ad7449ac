package im.arun.scenebridge.backup;

import im.arun.scenebridge.model.GeneratedNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps backups in memory. Stored and loaded trees are deep copies.
 */
public class InMemoryBackupProvider implements BackupProvider {

    private final Map<String, GeneratedNode> backups = new LinkedHashMap<>();

    @Override
    public synchronized Optional<GeneratedNode> load(String rootKey) {
        GeneratedNode backup = backups.get(rootKey);
        return backup != null ? Optional.of(backup.deepCopy()) : Optional.empty();
    }

    @Override
    public synchronized Set<String> rootKeys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(backups.keySet()));
    }

    @Override
    public synchronized void store(String rootKey, GeneratedNode root) {
        backups.put(rootKey, root.deepCopy());
    }
}
