package im.arun.scenebridge.transform;

import im.arun.scenebridge.model.DocumentNode;
import im.arun.scenebridge.model.LayoutConstraint;
import im.arun.scenebridge.model.NodeType;
import im.arun.scenebridge.model.Rect;
import im.arun.scenebridge.model.RectTransformData;
import im.arun.scenebridge.model.Vec2;
import im.arun.scenebridge.model.Vector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps document geometry onto anchored local transforms.
 *
 * <p>Document space has Y growing downward; local space has Y growing upward, so every
 * vertical offset is negated. Missing geometry falls back to zero vectors, identity
 * transforms and LEFT/TOP constraints.</p>
 */
public class TransformResolver {
    private static final Logger logger = LoggerFactory.getLogger(TransformResolver.class);

    private static final Vec2 CENTER_PIVOT = Vec2.of(0.5, 0.5);

    /**
     * Transform for a natively reconstructed node, from its relative transform and size.
     */
    public RectTransformData resolveRelative(DocumentNode node, DocumentNode parent, boolean centerPivot) {
        RectTransformData transform = new RectTransformData();

        double[][] matrix = node.getRelativeTransform();
        if (isAffine(matrix)) {
            transform.setAnchoredPosition(Vec2.of(matrix[0][2], -matrix[1][2]));
            // adding 0.0 folds -0.0 into 0.0
            transform.setRotation(Math.toDegrees(Math.atan2(-matrix[1][0], matrix[0][0])) + 0.0);
        }
        transform.setSizeDelta(toVec2(node.getSize()));

        // Groups have no constraints of their own, the first child's stand in for them
        DocumentNode constraintSource = node.getType() == NodeType.GROUP && node.hasChildren()
            ? node.getChildren().get(0)
            : node;
        applyConstraints(transform, constraintSource.getConstraints(), parent);

        if (centerPivot) {
            setPivot(transform, CENTER_PIVOT, parent);
        }
        return transform;
    }

    /**
     * Transform for a server rendered node. Rotation is baked into the image, so the
     * absolute bounds give both size and placement.
     */
    public RectTransformData resolveAbsoluteBounds(DocumentNode node, DocumentNode parent, boolean centerPivot) {
        RectTransformData transform = new RectTransformData();

        Rect bounds = node.getAbsoluteBoundingBox();
        Rect parentBounds = parent != null ? parent.getAbsoluteBoundingBox() : null;
        if (bounds != null && parentBounds == null) {
            logger.debug("No parent bounds for '{}' ({}), placing it relative to the document origin",
                node.getName(), node.getId());
        }
        if (bounds != null) {
            transform.setSizeDelta(Vec2.of(bounds.getWidth(), bounds.getHeight()));
            double parentX = parentBounds != null ? parentBounds.getX() : 0;
            double parentY = parentBounds != null ? parentBounds.getY() : 0;
            transform.setAnchoredPosition(Vec2.of(bounds.getX() - parentX, -(bounds.getY() - parentY)));
        }

        applyConstraints(transform, node.getConstraints(), parent);

        if (centerPivot) {
            setPivot(transform, CENTER_PIVOT, parent);
        }
        return transform;
    }

    /**
     * Picks anchors from the constraint table, then offsets position and size by the parent size.
     */
    void applyConstraints(RectTransformData transform, LayoutConstraint constraints, DocumentNode parent) {
        LayoutConstraint effective = constraints != null ? constraints : LayoutConstraint.topLeft();
        LayoutConstraint.Horizontal horizontal = effective.getHorizontal() != null
            ? effective.getHorizontal() : LayoutConstraint.Horizontal.LEFT;
        LayoutConstraint.Vertical vertical = effective.getVertical() != null
            ? effective.getVertical() : LayoutConstraint.Vertical.TOP;

        Vec2 anchorsX = ConstraintAnchors.horizontal(horizontal);
        Vec2 anchorsY = ConstraintAnchors.vertical(vertical);
        transform.setAnchorMin(Vec2.of(anchorsX.getX(), anchorsY.getX()));
        transform.setAnchorMax(Vec2.of(anchorsX.getY(), anchorsY.getY()));

        Vec2 parentSize = parentSize(parent);

        double offsetX;
        switch (horizontal) {
            case CENTER:
                offsetX = -parentSize.getX() * 0.5;
                break;
            case RIGHT:
                offsetX = -parentSize.getX();
                break;
            default:
                offsetX = 0;
        }
        double offsetY;
        switch (vertical) {
            case CENTER:
                offsetY = parentSize.getY() * 0.5;
                break;
            case BOTTOM:
                offsetY = parentSize.getY();
                break;
            default:
                offsetY = 0;
        }
        transform.setAnchoredPosition(transform.getAnchoredPosition().plus(Vec2.of(offsetX, offsetY)));

        Vec2 size = transform.getSizeDelta();
        if (ConstraintAnchors.stretchesHorizontally(horizontal)) {
            size = Vec2.of(size.getX() - parentSize.getX(), size.getY());
        }
        if (ConstraintAnchors.stretchesVertically(vertical)) {
            size = Vec2.of(size.getX(), size.getY() - parentSize.getY());
        }
        transform.setSizeDelta(size);
    }

    /**
     * Moves the pivot while keeping the node where it is on screen.
     */
    void setPivot(RectTransformData transform, Vec2 pivot, DocumentNode parent) {
        Vec2 rectSize = rectSize(transform, parentSize(parent));
        Vec2 offset = pivot.minus(transform.getPivot()).scale(rectSize).rotate(transform.getRotation());
        transform.setPivot(pivot);
        transform.setAnchoredPosition(transform.getAnchoredPosition().plus(offset));
    }

    /**
     * Actual rect size: the size delta plus the share of the parent spanned by the anchors.
     */
    static Vec2 rectSize(RectTransformData transform, Vec2 parentSize) {
        Vec2 anchorSpan = transform.getAnchorMax().minus(transform.getAnchorMin());
        return transform.getSizeDelta().plus(parentSize.scale(anchorSpan));
    }

    private static Vec2 parentSize(DocumentNode parent) {
        return parent != null ? toVec2(parent.getSize()) : Vec2.zero();
    }

    private static Vec2 toVec2(Vector vector) {
        return vector != null ? Vec2.of(vector.getX(), vector.getY()) : Vec2.zero();
    }

    private static boolean isAffine(double[][] matrix) {
        return matrix != null && matrix.length >= 2
            && matrix[0] != null && matrix[0].length >= 3
            && matrix[1] != null && matrix[1].length >= 3;
    }
}
