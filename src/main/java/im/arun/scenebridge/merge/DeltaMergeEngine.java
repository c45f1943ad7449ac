package im.arun.scenebridge.merge;

import im.arun.scenebridge.model.FieldCopyException;
import im.arun.scenebridge.model.GeneratedNode;
import im.arun.scenebridge.model.NodeComponent;
import im.arun.scenebridge.model.PlanAction;
import im.arun.scenebridge.model.ReconciliationPlan;
import im.arun.scenebridge.util.ImportDiagnostics;
import im.arun.scenebridge.util.ImportDiagnostics.Category;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reconciles a freshly generated tree with the backup of the same logical root so that
 * hand-made changes survive a re-import.
 *
 * <ul>
 *   <li>components only on the backup node are added to the fresh node</li>
 *   <li>fields still at their default on the fresh node take the backup value</li>
 *   <li>children pair up by exact name; backup-only children are reattached at their
 *       old sibling index</li>
 * </ul>
 *
 * The fresh tree is modified in place. Merges of the same root key never overlap.
 */
public class DeltaMergeEngine {
    private static final Logger logger = LoggerFactory.getLogger(DeltaMergeEngine.class);

    private final Map<String, Object> rootLocks = new ConcurrentHashMap<>();

    private static final class Pair {
        final GeneratedNode fresh;
        final GeneratedNode backup;
        final String path;

        Pair(GeneratedNode fresh, GeneratedNode backup, String path) {
            this.fresh = fresh;
            this.backup = backup;
            this.path = path;
        }
    }

    /**
     * Merges {@code backup} into {@code fresh}.
     *
     * @param backup prior generation of the same root, may be null
     * @return the fresh tree, for chaining
     */
    public GeneratedNode merge(String rootKey, GeneratedNode fresh, GeneratedNode backup,
                               ComponentAssetProvider assets, ReconciliationPlan plan,
                               ImportDiagnostics diagnostics) {
        Object lock = rootLocks.computeIfAbsent(rootKey, key -> new Object());
        synchronized (lock) {
            if (backup == null) {
                recordCreated(rootKey, fresh, plan);
                return fresh;
            }
            logger.debug("Merging backup into {}", rootKey);

            Deque<Pair> stack = new ArrayDeque<>();
            stack.push(new Pair(fresh, backup, fresh.getName()));
            while (!stack.isEmpty()) {
                Pair pair = stack.pop();
                plan.add(rootKey, pair.path, PlanAction.UPDATE);
                mergeComponents(pair.fresh, pair.backup, diagnostics);

                List<Pair> matched = mergeChildren(rootKey, pair, assets, plan);
                for (int i = matched.size() - 1; i >= 0; i--) {
                    stack.push(matched.get(i));
                }
            }
            return fresh;
        }
    }

    /**
     * Records a CREATE entry for every node of a tree that has no backup.
     */
    public void recordCreated(String rootKey, GeneratedNode fresh, ReconciliationPlan plan) {
        recordSubtree(rootKey, fresh, fresh.getName(), PlanAction.CREATE, plan);
    }

    void mergeComponents(GeneratedNode fresh, GeneratedNode backup, ImportDiagnostics diagnostics) {
        for (NodeComponent backupComponent : backup.getComponents().values()) {
            NodeComponent freshComponent = fresh.component(backupComponent.getKind());
            if (freshComponent == null) {
                fresh.addComponent(backupComponent.deepCopy());
                continue;
            }
            for (Map.Entry<String, Object> field : backupComponent.getFields().entrySet()) {
                if (!freshComponent.isDefault(field.getKey()) || NodeComponent.isDefaultValue(field.getValue())) {
                    continue;
                }
                try {
                    freshComponent.assign(field.getKey(), NodeComponent.copyValue(field.getValue()));
                } catch (FieldCopyException e) {
                    diagnostics.warn(Category.FIELD_COPY, fresh.getNodeId(),
                        "%s on '%s', field left as generated", e.getMessage(), fresh.getName());
                }
            }
        }
    }

    private List<Pair> mergeChildren(String rootKey, Pair pair, ComponentAssetProvider assets,
                                     ReconciliationPlan plan) {
        List<GeneratedNode> freshChildren = new ArrayList<>(pair.fresh.getChildren());
        boolean[] claimed = new boolean[freshChildren.size()];
        List<Pair> matched = new ArrayList<>();
        List<Integer> orphanIndexes = new ArrayList<>();

        List<GeneratedNode> backupChildren = pair.backup.getChildren();
        for (int i = 0; i < backupChildren.size(); i++) {
            GeneratedNode backupChild = backupChildren.get(i);
            int match = firstUnclaimed(freshChildren, claimed, backupChild.getName());
            if (match >= 0) {
                claimed[match] = true;
                GeneratedNode freshChild = freshChildren.get(match);
                matched.add(new Pair(freshChild, backupChild, pair.path + "/" + freshChild.getName()));
            } else {
                orphanIndexes.add(i);
            }
        }

        for (int i = 0; i < freshChildren.size(); i++) {
            if (!claimed[i]) {
                GeneratedNode child = freshChildren.get(i);
                recordSubtree(rootKey, child, pair.path + "/" + child.getName(), PlanAction.CREATE, plan);
            }
        }

        for (int index : orphanIndexes) {
            GeneratedNode backupChild = backupChildren.get(index);
            GeneratedNode restored = reattach(backupChild, assets);
            List<GeneratedNode> children = pair.fresh.getChildren();
            children.add(Math.min(index, children.size()), restored);
            plan.add(rootKey, pair.path + "/" + restored.getName(), PlanAction.PRESERVE);
        }
        return matched;
    }

    private GeneratedNode reattach(GeneratedNode backupChild, ComponentAssetProvider assets) {
        if (backupChild.getAssetRef() != null) {
            Optional<GeneratedNode> instance = assets.instantiate(backupChild.getAssetRef());
            if (instance.isPresent()) {
                GeneratedNode restored = instance.get();
                restored.setName(backupChild.getName());
                restored.setNodeId(backupChild.getNodeId());
                restored.setActive(backupChild.isActive());
                restored.setTransform(backupChild.getTransform().copy());
                return restored;
            }
            logger.debug("Asset {} no longer exists, restoring '{}' from backup", backupChild.getAssetRef(), backupChild.getName());
        }
        return backupChild.deepCopy();
    }

    private static int firstUnclaimed(List<GeneratedNode> children, boolean[] claimed, String name) {
        for (int i = 0; i < children.size(); i++) {
            if (!claimed[i] && Objects.equals(name, children.get(i).getName())) {
                return i;
            }
        }
        return -1;
    }

    private static void recordSubtree(String rootKey, GeneratedNode node, String path, PlanAction action,
                                      ReconciliationPlan plan) {
        Deque<GeneratedNode> nodes = new ArrayDeque<>();
        Deque<String> paths = new ArrayDeque<>();
        nodes.push(node);
        paths.push(path);
        while (!nodes.isEmpty()) {
            GeneratedNode current = nodes.pop();
            String currentPath = paths.pop();
            plan.add(rootKey, currentPath, action);
            List<GeneratedNode> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                nodes.push(children.get(i));
                paths.push(currentPath + "/" + children.get(i).getName());
            }
        }
    }
}
