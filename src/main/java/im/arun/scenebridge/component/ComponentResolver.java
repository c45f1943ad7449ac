package im.arun.scenebridge.component;

import im.arun.scenebridge.classify.ClassificationResult;
import im.arun.scenebridge.generate.ComponentRegistry;
import im.arun.scenebridge.generate.ComponentRegistry.RegisteredAsset;
import im.arun.scenebridge.generate.NodePropertyApplier;
import im.arun.scenebridge.index.DocumentIndex;
import im.arun.scenebridge.index.DocumentQueries;
import im.arun.scenebridge.model.DesignDocument;
import im.arun.scenebridge.model.DocumentNode;
import im.arun.scenebridge.model.GeneratedNode;
import im.arun.scenebridge.model.GeneratedRoot;
import im.arun.scenebridge.model.NodeComponent;
import im.arun.scenebridge.model.NodeType;
import im.arun.scenebridge.model.RootKind;
import im.arun.scenebridge.transform.TransformResolver;
import im.arun.scenebridge.util.ImportDiagnostics;
import im.arun.scenebridge.util.ImportDiagnostics.Category;
import im.arun.scenebridge.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Connects component instances to their definitions.
 *
 * <p>Two jobs: repairing documents whose instances reference definitions that are not in
 * the imported pages, and expanding the placeholders left by generation into copies of the
 * generated component (or screen) trees.</p>
 */
public class ComponentResolver {
    private static final Logger logger = LoggerFactory.getLogger(ComponentResolver.class);

    private final TransformResolver transformResolver;
    private final NodePropertyApplier propertyApplier;
    private final boolean centerPivot;

    public ComponentResolver(TransformResolver transformResolver, NodePropertyApplier propertyApplier, boolean centerPivot) {
        this.transformResolver = transformResolver;
        this.propertyApplier = propertyApplier;
        this.centerPivot = centerPivot;
    }

    /**
     * Component ids declared by the document or referenced by instances that have no
     * COMPONENT node within the given pages, in first-seen order.
     */
    public List<String> findMissingComponentDefinitions(DesignDocument document, List<DocumentNode> pages) {
        Set<String> referenced = new LinkedHashSet<>();
        if (document.getComponents() != null) {
            referenced.addAll(document.getComponents().keySet());
        }
        Set<String> defined = new HashSet<>();
        for (DocumentNode page : pages) {
            for (DocumentNode node : DocumentQueries.findAll(page,
                    n -> n.getType() == NodeType.COMPONENT || n.getType() == NodeType.INSTANCE)) {
                if (node.getType() == NodeType.COMPONENT) {
                    defined.add(node.getId());
                } else if (node.getComponentId() != null) {
                    referenced.add(node.getComponentId());
                }
            }
        }
        List<String> missing = new ArrayList<>();
        for (String componentId : referenced) {
            if (!defined.contains(componentId)) {
                missing.add(componentId);
            }
        }
        return missing;
    }

    /**
     * Promotes the first instance of each missing component to a COMPONENT node and points
     * every other instance of that id at it. Rewrites produce new node values registered
     * through the index.
     *
     * @return ids of the promoted nodes, in the order of {@code missingComponentIds}
     */
    public List<String> replaceMissingComponents(DocumentIndex index, List<DocumentNode> pages,
                                                 Collection<String> missingComponentIds,
                                                 ImportDiagnostics diagnostics) {
        List<String> promoted = new ArrayList<>();
        for (String componentId : missingComponentIds) {
            List<DocumentNode> instances = new ArrayList<>();
            for (DocumentNode page : pages) {
                instances.addAll(DocumentQueries.findInstancesOf(page, componentId));
            }
            if (instances.isEmpty()) {
                continue;
            }

            DocumentNode first = instances.get(0);
            DocumentNode definition = first.withType(NodeType.COMPONENT);
            index.replace(definition);
            for (int i = 1; i < instances.size(); i++) {
                index.replace(instances.get(i).withComponentId(definition.getId()));
            }

            promoted.add(definition.getId());
            diagnostics.info(Category.MISSING_COMPONENT, definition.getId(),
                "Component %s has no definition, promoted instance '%s' and remapped %d other instances",
                componentId, index.fullPath(definition), instances.size() - 1);
        }
        return promoted;
    }

    /**
     * Expands every placeholder in the registry's trees: components first (each one expanded
     * before it is copied anywhere), then screens, then pages.
     */
    public void instantiateAll(ComponentRegistry registry, DocumentIndex index,
                               ClassificationResult classification, ImportDiagnostics diagnostics) {
        Set<String> inProgress = new HashSet<>();
        for (RootKind kind : List.of(RootKind.COMPONENT, RootKind.SCREEN, RootKind.PAGE)) {
            for (RegisteredAsset asset : registry.assetsOfKind(kind)) {
                expand(asset, registry, index, classification, diagnostics, inProgress);
            }
        }
    }

    private void expand(RegisteredAsset asset, ComponentRegistry registry, DocumentIndex index,
                        ClassificationResult classification, ImportDiagnostics diagnostics, Set<String> inProgress) {
        if (asset.isExpanded()) {
            return;
        }
        if (!inProgress.add(asset.getSourceNodeId())) {
            diagnostics.warn(Category.MISSING_COMPONENT, asset.getSourceNodeId(),
                "Component %s contains itself, nested instance left unexpanded", asset.getRoot().key());
            return;
        }

        for (GeneratedNode[] pair : placeholdersOf(asset.getTemplate())) {
            GeneratedNode parent = pair[0];
            GeneratedNode placeholder = pair[1];

            Optional<RegisteredAsset> target = registry.get(placeholder.getPlaceholderComponentId());
            if (target.isEmpty()) {
                diagnostics.warn(Category.MISSING_COMPONENT, placeholder.getNodeId(),
                    "No generated component %s for instance '%s'", placeholder.getPlaceholderComponentId(), placeholder.getName());
                continue;
            }
            expand(target.get(), registry, index, classification, diagnostics, inProgress);
            if (inProgress.contains(target.get().getSourceNodeId())) {
                continue;
            }

            GeneratedNode instance = registry.newInstance(target.get());
            instance.setName(placeholder.getName());
            instance.setNodeId(placeholder.getNodeId());
            instance.setActive(placeholder.isActive());
            instance.setTransform(placeholder.getTransform().copy());
            parent.getChildren().set(TreeUtils.indexOfChild(parent, placeholder), instance);

            Optional<DocumentNode> node = index.lookup(placeholder.getNodeId());
            if (node.isPresent()) {
                DocumentNode documentParent = placeholder.getParentNodeId() != null
                    ? index.lookup(placeholder.getParentNodeId()).orElse(null)
                    : index.parentOf(placeholder.getNodeId()).orElse(null);
                applyProperties(node.get(), instance, documentParent, index, classification, diagnostics);
            }
        }

        inProgress.remove(asset.getSourceNodeId());
        asset.setExpanded(true);
    }

    /**
     * Placeholders with their parents, depth-first. Nothing below a placeholder or below an
     * already instantiated asset is visited.
     */
    static List<GeneratedNode[]> placeholdersOf(GeneratedNode root) {
        List<GeneratedNode[]> found = new ArrayList<>();
        Deque<GeneratedNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            GeneratedNode node = stack.pop();
            List<GeneratedNode> children = node.getChildren();
            List<GeneratedNode> descend = new ArrayList<>();
            for (GeneratedNode child : children) {
                if (child.isPlaceholder()) {
                    found.add(new GeneratedNode[] {node, child});
                } else if (child.getAssetRef() == null) {
                    descend.add(child);
                }
            }
            for (int i = descend.size() - 1; i >= 0; i--) {
                stack.push(descend.get(i));
            }
        }
        return found;
    }

    /**
     * Re-applies document properties to an instantiated copy, recursing through children
     * matched by their component-local id.
     */
    void applyProperties(DocumentNode node, GeneratedNode target, DocumentNode parent, DocumentIndex index,
                         ClassificationResult classification, ImportDiagnostics diagnostics) {
        boolean substitution = classification.isSubstitution(node.getId())
            || target.hasComponent(NodeComponent.SERVER_IMAGE);

        if (substitution) {
            target.setTransform(transformResolver.resolveAbsoluteBounds(node, parent, centerPivot));
            return;
        }

        try {
            propertyApplier.apply(node, target);
        } catch (RuntimeException e) {
            diagnostics.warn(Category.STRUCTURAL_MISMATCH, node.getId(),
                "Exception applying properties for node '%s': %s", index.fullPath(node), e.getMessage());
        }
        target.setTransform(transformResolver.resolveRelative(node, parent, centerPivot));

        for (DocumentNode child : node.childrenOrEmpty()) {
            GeneratedNode match = findMatchingChild(child, target);
            if (match != null) {
                applyProperties(child, match, node, index, classification, diagnostics);
            } else {
                diagnostics.info(Category.STRUCTURAL_MISMATCH, child.getId(),
                    "Could not find child %s '%s' of node %s in generated node '%s'",
                    child.getId(), child.getName(), node.getId(), target.getName());
            }
        }
    }

    static GeneratedNode findMatchingChild(DocumentNode child, GeneratedNode parent) {
        String localId = TreeUtils.componentLocalId(child.getId());
        for (GeneratedNode candidate : parent.getChildren()) {
            if (localId.equals(TreeUtils.componentLocalId(candidate.getNodeId()))) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Clears placeholder markers once instantiation is done. Unresolved placeholders stay as
     * empty nodes.
     *
     * @return number of placeholders that were never resolved
     */
    public int removePlaceholderMarkers(Collection<GeneratedRoot> roots) {
        int unresolved = 0;
        for (GeneratedRoot root : roots) {
            for (GeneratedNode node : TreeUtils.preOrder(root.getTree())) {
                if (node.isPlaceholder()) {
                    unresolved++;
                }
                node.setPlaceholderComponentId(null);
                node.setParentNodeId(null);
            }
        }
        if (unresolved > 0) {
            logger.warn("{} component placeholders could not be resolved", unresolved);
        }
        return unresolved;
    }
}
