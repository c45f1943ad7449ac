package im.arun.scenebridge.classify;

import im.arun.scenebridge.index.DocumentQueries;
import im.arun.scenebridge.model.DocumentNode;
import im.arun.scenebridge.model.NodeType;
import im.arun.scenebridge.model.Paint;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the image fills that have to be downloaded, in first-seen order.
 */
public class ImageFillCollector {

    private static final class Frame {
        final DocumentNode node;
        final TraversalContext context;

        Frame(DocumentNode node, TraversalContext context) {
            this.node = node;
            this.context = context;
        }
    }

    public List<String> collect(DocumentNode document, Set<String> selectedPageIds, boolean onlySelectedPages) {
        Set<String> imageRefs = new LinkedHashSet<>();
        for (DocumentNode page : DocumentQueries.eligiblePages(document, onlySelectedPages, selectedPageIds)) {
            collectPage(page, selectedPageIds.contains(page.getId()), imageRefs);
        }
        return new ArrayList<>(imageRefs);
    }

    void collectPage(DocumentNode page, boolean includedPage, Set<String> imageRefs) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(page, TraversalContext.forPage(includedPage)));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            DocumentNode node = frame.node;
            TraversalContext context = frame.context;

            // Images dropped straight onto a page are usually reference material
            boolean strayRootImage = context.getDepth() <= 1
                && node.getType() != NodeType.FRAME && node.getType() != NodeType.COMPONENT;
            boolean ignoreFill = strayRootImage
                || (!context.isSelectedPage() && !context.isWithinComponentDefinition());

            if (!ignoreFill && node.getFills() != null) {
                for (Paint fill : node.getFills()) {
                    if (fill != null && fill.isImageWithRef()) {
                        imageRefs.add(fill.getImageRef());
                    }
                }
            }

            TraversalContext childContext = context.descend(node);
            List<DocumentNode> children = node.childrenOrEmpty();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), childContext));
            }
        }
    }
}
