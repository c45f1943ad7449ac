package im.arun.scenebridge.util;

import im.arun.scenebridge.model.GeneratedNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Traversal helpers for generated trees. Walks use an explicit stack so deep trees
 * do not exhaust the call stack.
 */
public final class TreeUtils {

    private TreeUtils() {}

    /**
     * All nodes of the tree in depth-first pre-order, root first.
     */
    public static List<GeneratedNode> preOrder(GeneratedNode root) {
        List<GeneratedNode> result = new ArrayList<>();
        if (root == null) {
            return result;
        }
        Deque<GeneratedNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            GeneratedNode node = stack.pop();
            result.add(node);
            List<GeneratedNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Index of a child by identity, -1 when it is not a direct child.
     */
    public static int indexOfChild(GeneratedNode parent, GeneratedNode child) {
        List<GeneratedNode> children = parent.getChildren();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Strips the instance path from a namespaced instance child id ({@code I1:2;3:4} becomes {@code 3:4}).
     */
    public static String componentLocalId(String nodeId) {
        if (nodeId == null) {
            return null;
        }
        int separator = nodeId.lastIndexOf(';');
        return separator >= 0 ? nodeId.substring(separator + 1) : nodeId;
    }
}
