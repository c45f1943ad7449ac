package im.arun.scenebridge.classify;

import im.arun.scenebridge.model.DocumentNode;
import im.arun.scenebridge.model.NodeType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a node inside a component definition is replaced by a server rendered image.
 */
public final class SubstitutionRules {

    /** Node types a vector-only subtree may consist of. */
    static final Set<NodeType> VECTOR_RENDER_TYPES = EnumSet.of(
        NodeType.VECTOR, NodeType.GROUP, NodeType.FRAME, NodeType.COMPONENT, NodeType.INSTANCE);

    private SubstitutionRules() {}

    public static boolean shouldSubstitute(DocumentNode node, int depth) {
        if (node.getType() == NodeType.CANVAS) {
            return false;
        }
        if (depth <= 1 && node.getType() == NodeType.FRAME) {
            return false;
        }
        if (node.getName() != null && node.getName().toLowerCase(Locale.ROOT).contains("render")) {
            return true;
        }
        if (node.getType() == NodeType.VECTOR || node.getType() == NodeType.BOOLEAN_OPERATION) {
            return true;
        }
        Map<NodeType, Integer> typeCounts = new EnumMap<>(NodeType.class);
        return consistsOnlyOf(node, VECTOR_RENDER_TYPES, typeCounts)
            && typeCounts.getOrDefault(NodeType.VECTOR, 0) > 0;
    }

    /**
     * Scans the subtree (inclusive) once, counting types as it goes.
     * Any type outside {@code allowed} disqualifies the whole subtree.
     */
    static boolean consistsOnlyOf(DocumentNode root, Set<NodeType> allowed, Map<NodeType, Integer> typeCounts) {
        Deque<DocumentNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            DocumentNode node = stack.pop();
            if (!allowed.contains(node.getType())) {
                return false;
            }
            typeCounts.merge(node.getType(), 1, Integer::sum);
            for (DocumentNode child : node.childrenOrEmpty()) {
                stack.push(child);
            }
        }
        return true;
    }
}
