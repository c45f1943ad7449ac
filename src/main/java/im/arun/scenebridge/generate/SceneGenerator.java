package im.arun.scenebridge.generate;

import im.arun.scenebridge.classify.ClassificationResult;
import im.arun.scenebridge.image.RenderedImageProvider;
import im.arun.scenebridge.index.DocumentIndex;
import im.arun.scenebridge.index.DocumentQueries;
import im.arun.scenebridge.model.DocumentNode;
import im.arun.scenebridge.model.GeneratedNode;
import im.arun.scenebridge.model.LogicalRoot;
import im.arun.scenebridge.model.NodeComponent;
import im.arun.scenebridge.model.NodeType;
import im.arun.scenebridge.model.RenderClassification;
import im.arun.scenebridge.model.RootKind;
import im.arun.scenebridge.transform.TransformResolver;
import im.arun.scenebridge.util.ImportDiagnostics;
import im.arun.scenebridge.util.ImportDiagnostics.Category;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the generated trees for pages, screens and components.
 *
 * <p>Inside a tree, instances, nested components and screens placed on a page become
 * placeholders that the component resolver later replaces with copies of the matching root.</p>
 */
public class SceneGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SceneGenerator.class);

    private final TransformResolver transformResolver;
    private final NodePropertyApplier propertyApplier;
    private final boolean centerPivot;
    private final String assetRootPath;

    public SceneGenerator(TransformResolver transformResolver, NodePropertyApplier propertyApplier,
                          boolean centerPivot, String assetRootPath) {
        this.transformResolver = transformResolver;
        this.propertyApplier = propertyApplier;
        this.centerPivot = centerPivot;
        this.assetRootPath = assetRootPath;
    }

    private static final class Pass {
        final DocumentIndex index;
        final ClassificationResult classification;
        final RenderedImageProvider images;
        final ImportDiagnostics diagnostics;
        final ComponentRegistry registry = new ComponentRegistry();
        final Map<String, byte[]> renderedImages = new LinkedHashMap<>();

        Pass(DocumentIndex index, ClassificationResult classification, RenderedImageProvider images,
             ImportDiagnostics diagnostics) {
            this.index = index;
            this.classification = classification;
            this.images = images;
            this.diagnostics = diagnostics;
        }
    }

    /**
     * Generates components, screens and pages for the given pages, in that order.
     */
    public GenerationResult generate(List<DocumentNode> pages, DocumentIndex index,
                                     ClassificationResult classification, RenderedImageProvider images,
                                     ImportDiagnostics diagnostics) {
        Pass pass = new Pass(index, classification, images, diagnostics);

        for (DocumentNode page : pages) {
            for (DocumentNode component : DocumentQueries.findAllOfType(page, NodeType.COMPONENT)) {
                DocumentNode parent = index.parentOf(component.getId()).orElse(null);
                String name = parent != null && parent.getType() == NodeType.COMPONENT_SET
                    ? parent.getName() + "-" + component.getName()
                    : component.getName();
                LogicalRoot root = pass.registry.allocateRoot(RootKind.COMPONENT, name);
                pass.registry.register(component.getId(), root, buildRoot(component, parent, pass));
            }
        }

        for (DocumentNode page : pages) {
            for (DocumentNode screen : DocumentQueries.screensOnPage(page)) {
                DocumentNode parent = index.parentOf(screen.getId()).orElse(null);
                LogicalRoot root = pass.registry.allocateRoot(RootKind.SCREEN, screen.getName());
                pass.registry.register(screen.getId(), root, buildRoot(screen, parent, pass));
            }
        }

        for (DocumentNode page : pages) {
            LogicalRoot root = pass.registry.allocateRoot(RootKind.PAGE, page.getName());
            pass.registry.register(page.getId(), root, buildRoot(page, null, pass));
        }

        logger.info("Generated {} component, {} screen and {} page roots",
            pass.registry.assetsOfKind(RootKind.COMPONENT).size(),
            pass.registry.assetsOfKind(RootKind.SCREEN).size(),
            pass.registry.assetsOfKind(RootKind.PAGE).size());
        return new GenerationResult(pass.registry, pass.renderedImages);
    }

    /**
     * Builds a root in full; only its descendants may turn into placeholders.
     */
    private GeneratedNode buildRoot(DocumentNode node, DocumentNode parent, Pass pass) {
        GeneratedNode generated = new GeneratedNode(node.getId(), node.getName());
        if (pass.classification.isServerRendered(node.getId())) {
            return buildServerRendered(node, parent, generated, pass);
        }
        generated.setTransform(transformResolver.resolveRelative(node, parent, centerPivot));
        propertyApplier.apply(node, generated);
        for (DocumentNode child : node.childrenOrEmpty()) {
            generated.addChild(buildNode(child, node, pass));
        }
        return generated;
    }

    private GeneratedNode buildNode(DocumentNode node, DocumentNode parent, Pass pass) {
        boolean placedAsset = node.getType() == NodeType.COMPONENT
            || (node.getType() == NodeType.FRAME && DocumentQueries.isScreen(node, parent));
        if (node.getType() == NodeType.INSTANCE || placedAsset) {
            GeneratedNode placeholder = new GeneratedNode(node.getId(), node.getName());
            placeholder.setActive(node.isVisible());
            placeholder.setPlaceholderComponentId(placedAsset ? node.getId() : node.getComponentId());
            placeholder.setParentNodeId(parent != null ? parent.getId() : null);
            placeholder.setTransform(transformResolver.resolveRelative(node, parent, centerPivot));
            return placeholder;
        }
        return buildRoot(node, parent, pass);
    }

    private GeneratedNode buildServerRendered(DocumentNode node, DocumentNode parent, GeneratedNode generated, Pass pass) {
        RenderClassification renderType = pass.classification.classificationOf(node.getId());
        String imagePath = renderType == RenderClassification.SERVER_EXPORT
            ? assetRootPath + "/Exports/" + LogicalRoot.safeFileName(node.getName()) + ".png"
            : assetRootPath + "/ServerRenderedImages/" + node.getId().replace(":", "_") + ".png";

        generated.setActive(node.isVisible());
        generated.setImageRef(imagePath);
        generated.setTransform(transformResolver.resolveAbsoluteBounds(node, parent, centerPivot));
        generated.addComponent(new NodeComponent(NodeComponent.SERVER_IMAGE)
            .with("image", imagePath)
            .with("render_type", renderType.name()));

        fetchImage(node, pass);
        return generated;
    }

    private void fetchImage(DocumentNode node, Pass pass) {
        if (pass.renderedImages.containsKey(node.getId())) {
            return;
        }
        try {
            Optional<byte[]> bytes = pass.images.imageFor(node.getId());
            if (bytes.isPresent()) {
                pass.renderedImages.put(node.getId(), bytes.get());
            } else {
                pass.diagnostics.warn(Category.IMAGE_FETCH, node.getId(),
                    "No rendered image for '%s'", pass.index.fullPath(node));
            }
        } catch (RuntimeException e) {
            pass.diagnostics.warn(Category.IMAGE_FETCH, node.getId(),
                "Failed to fetch rendered image for '%s': %s", pass.index.fullPath(node), e.getMessage());
        }
    }
}
