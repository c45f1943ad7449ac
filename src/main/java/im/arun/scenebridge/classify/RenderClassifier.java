package im.arun.scenebridge.classify;

import im.arun.scenebridge.index.DocumentQueries;
import im.arun.scenebridge.model.DocumentNode;
import im.arun.scenebridge.model.NodeType;
import im.arun.scenebridge.model.RenderClassification;
import im.arun.scenebridge.model.ServerRenderNode;
import im.arun.scenebridge.util.ClassificationPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Walks each page and tags the nodes that must be rasterized by the design tool instead of
 * being rebuilt from live elements.
 */
public class RenderClassifier {
    private static final Logger logger = LoggerFactory.getLogger(RenderClassifier.class);

    private static final class Frame {
        final DocumentNode node;
        final TraversalContext context;

        Frame(DocumentNode node, TraversalContext context) {
            this.node = node;
            this.context = context;
        }
    }

    /**
     * Classifies all eligible pages of the document.
     *
     * @param document            document root
     * @param missingComponentIds component ids that have no definition in the document
     * @param selectedPageIds     pages chosen for import
     * @param onlySelectedPages   skip unselected pages entirely
     * @param parallel            classify pages concurrently; output order is unaffected
     */
    public ClassificationResult classify(DocumentNode document,
                                         Set<String> missingComponentIds,
                                         Set<String> selectedPageIds,
                                         boolean onlySelectedPages,
                                         boolean parallel) {
        List<DocumentNode> pages = DocumentQueries.eligiblePages(document, onlySelectedPages, selectedPageIds);
        List<ServerRenderNode> all = new ArrayList<>();

        if (parallel && pages.size() > 1) {
            ExecutorService executor = ClassificationPool.workers();
            List<CompletableFuture<List<ServerRenderNode>>> futures = pages.stream()
                .map(page -> CompletableFuture.supplyAsync(
                    () -> classifyPage(page, missingComponentIds, selectedPageIds.contains(page.getId())),
                    executor))
                .collect(Collectors.toList());
            for (CompletableFuture<List<ServerRenderNode>> future : futures) {
                all.addAll(future.join());
            }
        } else {
            for (DocumentNode page : pages) {
                all.addAll(classifyPage(page, missingComponentIds, selectedPageIds.contains(page.getId())));
            }
        }

        logger.info("Classified {} pages: {} server rendered nodes", pages.size(), all.size());
        return new ClassificationResult(all);
    }

    /**
     * Classifies one page subtree, the page itself at depth 0.
     */
    public List<ServerRenderNode> classifyPage(DocumentNode page, Set<String> missingComponentIds, boolean selectedPage) {
        List<ServerRenderNode> found = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(page, TraversalContext.forPage(selectedPage)));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            DocumentNode node = frame.node;
            TraversalContext context = frame.context;

            // Instances are covered by their definition unless that definition is missing
            boolean coveredInstance = node.getType() == NodeType.INSTANCE
                && !missingComponentIds.contains(node.getComponentId());
            if (coveredInstance || !node.isVisible()) {
                continue;
            }

            if ((context.isSelectedPage() || context.isWithinComponentDefinition())
                    && context.getDepth() == 1 && node.hasExportSettings()) {
                logger.debug("Node {} carries export settings", node.getName());
                found.add(new ServerRenderNode(node, RenderClassification.SERVER_EXPORT));
                continue;
            }

            if (context.isWithinComponentDefinition() && SubstitutionRules.shouldSubstitute(node, context.getDepth())) {
                found.add(new ServerRenderNode(node, RenderClassification.SERVER_SUBSTITUTE));
                continue;
            }

            TraversalContext childContext = context.descend(node);
            List<DocumentNode> children = node.childrenOrEmpty();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), childContext));
            }
        }
        return found;
    }
}
