package im.arun.scenebridge.index;

import im.arun.scenebridge.model.DocumentNode;
import im.arun.scenebridge.model.FlowStartingPoint;
import im.arun.scenebridge.model.NodeType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Searches over the raw document tree, independent of any index.
 */
public final class DocumentQueries {

    private DocumentQueries() {}

    /**
     * Nodes matching the predicate in depth-first pre-order.
     */
    public static List<DocumentNode> findAll(DocumentNode root, Predicate<DocumentNode> predicate) {
        List<DocumentNode> found = new ArrayList<>();
        if (root == null) {
            return found;
        }
        Deque<DocumentNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            DocumentNode node = stack.pop();
            if (predicate.test(node)) {
                found.add(node);
            }
            List<DocumentNode> children = node.childrenOrEmpty();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return found;
    }

    public static List<DocumentNode> findAllOfType(DocumentNode root, NodeType type) {
        return findAll(root, node -> node.getType() == type);
    }

    public static List<DocumentNode> findInstancesOf(DocumentNode root, String componentId) {
        return findAll(root, node -> node.getType() == NodeType.INSTANCE && componentId.equals(node.getComponentId()));
    }

    public static List<DocumentNode> pageNodes(DocumentNode document) {
        return document != null ? new ArrayList<>(document.childrenOrEmpty()) : new ArrayList<>();
    }

    /**
     * Pages to import: all pages, or only the selected ones when the selection is enforced.
     */
    public static List<DocumentNode> eligiblePages(DocumentNode document, boolean onlySelected, Set<String> selectedPageIds) {
        List<DocumentNode> pages = pageNodes(document);
        if (!onlySelected) {
            return pages;
        }
        pages.removeIf(page -> !selectedPageIds.contains(page.getId()));
        return pages;
    }

    /**
     * A screen is a frame placed directly on a page or inside a section.
     */
    public static boolean isScreen(DocumentNode node, DocumentNode parent) {
        if (node.getType() != NodeType.FRAME || parent == null) {
            return false;
        }
        return parent.getType() == NodeType.CANVAS || parent.getType() == NodeType.SECTION;
    }

    public static List<DocumentNode> screensOnPage(DocumentNode page) {
        List<DocumentNode> screens = new ArrayList<>();
        collectScreens(page, null, screens);
        return screens;
    }

    private static void collectScreens(DocumentNode node, DocumentNode parent, List<DocumentNode> screens) {
        if (isScreen(node, parent)) {
            screens.add(node);
        }
        for (DocumentNode child : node.childrenOrEmpty()) {
            collectScreens(child, node, screens);
        }
    }

    /**
     * Id of the first prototype flow starting point found on the given pages, or an empty string.
     */
    public static String prototypeFlowStartScreenId(List<DocumentNode> pages) {
        for (DocumentNode page : pages) {
            List<FlowStartingPoint> points = page.getFlowStartingPoints();
            if (points != null && !points.isEmpty()) {
                return points.get(0).getNodeId();
            }
        }
        return "";
    }
}
