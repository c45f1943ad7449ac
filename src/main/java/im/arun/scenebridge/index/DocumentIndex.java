package im.arun.scenebridge.index;

import im.arun.scenebridge.model.DocumentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Id lookup over one design document, built once per import pass.
 * The only mutation after construction is {@link #replace(DocumentNode)}, used when a
 * component instance is promoted to stand in for a missing component definition.
 */
public class DocumentIndex {
    private static final Logger logger = LoggerFactory.getLogger(DocumentIndex.class);

    private final DocumentNode root;
    private final Map<String, DocumentNode> nodesById = new HashMap<>();
    private final Map<String, String> parentIds = new HashMap<>();

    private DocumentIndex(DocumentNode root) {
        this.root = root;
    }

    /**
     * Indexes every node reachable from the root in depth-first pre-order.
     * A later node with a duplicate id overwrites the earlier one.
     */
    public static DocumentIndex build(DocumentNode document) {
        DocumentIndex index = new DocumentIndex(document);
        if (document == null) {
            return index;
        }
        Deque<DocumentNode> stack = new ArrayDeque<>();
        stack.push(document);
        while (!stack.isEmpty()) {
            DocumentNode node = stack.pop();
            index.nodesById.put(node.getId(), node);
            List<DocumentNode> children = node.childrenOrEmpty();
            for (int i = children.size() - 1; i >= 0; i--) {
                DocumentNode child = children.get(i);
                index.parentIds.put(child.getId(), node.getId());
                stack.push(child);
            }
        }
        logger.debug("Indexed {} document nodes", index.nodesById.size());
        return index;
    }

    public DocumentNode getRoot() {
        return nodesById.getOrDefault(root != null ? root.getId() : null, root);
    }

    public Optional<DocumentNode> lookup(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public boolean contains(String id) {
        return nodesById.containsKey(id);
    }

    public int size() {
        return nodesById.size();
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(nodesById.keySet());
    }

    public Optional<DocumentNode> parentOf(String id) {
        String parentId = parentIds.get(id);
        return parentId != null ? lookup(parentId) : Optional.empty();
    }

    /**
     * Names from the document root down to the given node, found by a fresh depth-first search.
     * Empty when the node is not part of the document. Intended for diagnostics only.
     */
    public List<String> pathTo(DocumentNode target) {
        Deque<String> path = new ArrayDeque<>();
        DocumentNode start = getRoot();
        if (start == null || target == null) {
            return List.of();
        }
        // Each frame remembers where it is in its children so names can be popped on the way back.
        Deque<Iterator<DocumentNode>> pending = new ArrayDeque<>();
        path.addLast(start.getName());
        if (start == target) {
            return new ArrayList<>(path);
        }
        pending.push(start.childrenOrEmpty().iterator());
        while (!pending.isEmpty()) {
            Iterator<DocumentNode> siblings = pending.peek();
            if (!siblings.hasNext()) {
                pending.pop();
                path.removeLast();
                continue;
            }
            DocumentNode node = siblings.next();
            path.addLast(node.getName());
            if (node == target) {
                return new ArrayList<>(path);
            }
            pending.push(node.childrenOrEmpty().iterator());
        }
        return List.of();
    }

    public String fullPath(DocumentNode node) {
        return String.join("/", pathTo(node));
    }

    /**
     * Swaps in a new value for the node with the same id, both in the lookup and in its
     * parent's child list.
     */
    public void replace(DocumentNode replacement) {
        String id = replacement.getId();
        DocumentNode previous = nodesById.put(id, replacement);
        Optional<DocumentNode> parent = parentOf(id);
        if (parent.isEmpty() || previous == null) {
            return;
        }
        List<DocumentNode> siblings = new ArrayList<>(parent.get().childrenOrEmpty());
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == previous) {
                siblings.set(i, replacement);
            }
        }
        parent.get().setChildren(siblings);
    }
}
