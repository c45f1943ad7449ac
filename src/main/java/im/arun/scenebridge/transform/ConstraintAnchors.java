package im.arun.scenebridge.transform;

import im.arun.scenebridge.model.LayoutConstraint;
import im.arun.scenebridge.model.Vec2;

/**
 * Fixed anchor table for layout constraints.
 * SCALE anchors like the two-sided constraints; proportional scaling is not modelled.
 */
final class ConstraintAnchors {

    private ConstraintAnchors() {}

    /** (min, max) anchor fraction along X. */
    static Vec2 horizontal(LayoutConstraint.Horizontal constraint) {
        switch (constraint) {
            case LEFT:
                return Vec2.of(0, 0);
            case RIGHT:
                return Vec2.of(1, 1);
            case CENTER:
                return Vec2.of(0.5, 0.5);
            case LEFT_RIGHT:
            case SCALE:
            default:
                return Vec2.of(0, 1);
        }
    }

    /** (min, max) anchor fraction along Y. */
    static Vec2 vertical(LayoutConstraint.Vertical constraint) {
        switch (constraint) {
            case TOP:
                return Vec2.of(1, 1);
            case BOTTOM:
                return Vec2.of(0, 0);
            case CENTER:
                return Vec2.of(0.5, 0.5);
            case TOP_BOTTOM:
            case SCALE:
            default:
                return Vec2.of(0, 1);
        }
    }

    static boolean stretchesHorizontally(LayoutConstraint.Horizontal constraint) {
        return constraint == LayoutConstraint.Horizontal.LEFT_RIGHT || constraint == LayoutConstraint.Horizontal.SCALE;
    }

    static boolean stretchesVertically(LayoutConstraint.Vertical constraint) {
        return constraint == LayoutConstraint.Vertical.TOP_BOTTOM || constraint == LayoutConstraint.Vertical.SCALE;
    }
}
