package im.arun.scenebridge.generate;

import im.arun.scenebridge.merge.ComponentAssetProvider;
import im.arun.scenebridge.model.GeneratedNode;
import im.arun.scenebridge.model.GeneratedRoot;
import im.arun.scenebridge.model.LogicalRoot;
import im.arun.scenebridge.model.RootKind;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Generated roots of one import run, addressable by source node id and by root key.
 * Components and screens double as templates that placeholders are expanded from.
 */
public class ComponentRegistry implements ComponentAssetProvider {

    @Getter
    public static class RegisteredAsset {
        private final String sourceNodeId;
        private final LogicalRoot root;
        private final GeneratedNode template;
        @Setter
        private boolean expanded;

        RegisteredAsset(String sourceNodeId, LogicalRoot root, GeneratedNode template) {
            this.sourceNodeId = sourceNodeId;
            this.root = root;
            this.template = template;
        }
    }

    private final Map<String, RegisteredAsset> bySourceId = new LinkedHashMap<>();
    private final Map<String, RegisteredAsset> byKey = new HashMap<>();
    private final Map<RootKind, Map<String, Integer>> nameCounts = new EnumMap<>(RootKind.class);
    private final Map<RootKind, Set<String>> allocatedNames = new EnumMap<>(RootKind.class);

    /**
     * Reserves a root for the given name; repeated names get {@code _1}, {@code _2}, ... suffixes.
     * The suffix keeps growing until the sanitized name is unused within the slot, so names that
     * only differ in unsafe characters still get distinct keys.
     */
    public LogicalRoot allocateRoot(RootKind kind, String nodeName) {
        Map<String, Integer> counts = nameCounts.computeIfAbsent(kind, k -> new HashMap<>());
        Set<String> taken = allocatedNames.computeIfAbsent(kind, k -> new HashSet<>());
        String baseName = nodeName != null ? nodeName : "Untitled";
        int duplicateCount = counts.getOrDefault(baseName, 0);
        LogicalRoot root = LogicalRoot.of(kind, baseName, duplicateCount);
        while (!taken.add(root.getName())) {
            root = LogicalRoot.of(kind, baseName, ++duplicateCount);
        }
        counts.put(baseName, duplicateCount + 1);
        return root;
    }

    public void register(String sourceNodeId, LogicalRoot root, GeneratedNode tree) {
        RegisteredAsset asset = new RegisteredAsset(sourceNodeId, root, tree);
        bySourceId.put(sourceNodeId, asset);
        byKey.put(root.key(), asset);
    }

    public Optional<RegisteredAsset> get(String sourceNodeId) {
        return Optional.ofNullable(bySourceId.get(sourceNodeId));
    }

    public List<RegisteredAsset> assetsOfKind(RootKind kind) {
        List<RegisteredAsset> assets = new ArrayList<>();
        for (RegisteredAsset asset : bySourceId.values()) {
            if (asset.getRoot().getKind() == kind) {
                assets.add(asset);
            }
        }
        return assets;
    }

    /**
     * All roots, components first, then screens, then pages.
     */
    public List<GeneratedRoot> roots() {
        List<GeneratedRoot> roots = new ArrayList<>();
        for (RootKind kind : List.of(RootKind.COMPONENT, RootKind.SCREEN, RootKind.PAGE)) {
            for (RegisteredAsset asset : assetsOfKind(kind)) {
                roots.add(new GeneratedRoot(asset.getRoot(), asset.getSourceNodeId(), asset.getTemplate()));
            }
        }
        return roots;
    }

    @Override
    public Optional<GeneratedNode> instantiate(String assetKey) {
        RegisteredAsset asset = byKey.get(assetKey);
        if (asset == null || asset.getRoot().getKind() == RootKind.PAGE) {
            return Optional.empty();
        }
        return Optional.of(newInstance(asset));
    }

    /**
     * Deep copy of the asset's tree, tagged with the asset it came from.
     */
    public GeneratedNode newInstance(RegisteredAsset asset) {
        GeneratedNode instance = asset.getTemplate().deepCopy();
        instance.setAssetRef(asset.getRoot().key());
        instance.setComponentRef(asset.getRoot().getKind() == RootKind.COMPONENT ? asset.getSourceNodeId() : null);
        return instance;
    }
}
