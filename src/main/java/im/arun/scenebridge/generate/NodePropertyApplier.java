package im.arun.scenebridge.generate;

import im.arun.scenebridge.model.DocumentNode;
import im.arun.scenebridge.model.GeneratedNode;
import im.arun.scenebridge.model.NodeComponent;
import im.arun.scenebridge.model.NodeType;
import im.arun.scenebridge.model.Paint;

/**
 * Copies the visual properties of a document node onto its generated counterpart.
 * Only the fields generation owns are written; other fields on existing components stay.
 */
public class NodePropertyApplier {

    private final String assetRootPath;

    public NodePropertyApplier(String assetRootPath) {
        this.assetRootPath = assetRootPath;
    }

    public void apply(DocumentNode node, GeneratedNode target) {
        target.setActive(node.isVisible());

        if (node.getType() == NodeType.TEXT) {
            component(target, NodeComponent.TEXT)
                .with("characters", node.getCharacters() != null ? node.getCharacters() : "");
        }

        Paint fill = firstVisibleFill(node);
        if (fill != null) {
            NodeComponent image = component(target, NodeComponent.IMAGE)
                .with("opacity", fill.getOpacity());
            if (fill.isImageWithRef()) {
                image.with("sprite", imageFillPath(fill.getImageRef()));
            } else if (fill.getColor() != null) {
                image.with("color", fill.getColor().toHex(fill.getOpacity()));
            }
        }
    }

    public String imageFillPath(String imageRef) {
        return assetRootPath + "/ImageFills/" + imageRef + ".png";
    }

    private static NodeComponent component(GeneratedNode target, String kind) {
        NodeComponent existing = target.component(kind);
        return existing != null ? existing : target.addComponent(new NodeComponent(kind));
    }

    private static Paint firstVisibleFill(DocumentNode node) {
        if (node.getFills() == null || node.getType() == NodeType.TEXT) {
            return null;
        }
        for (Paint paint : node.getFills()) {
            if (paint != null && paint.isVisible()) {
                return paint;
            }
        }
        return null;
    }
}
