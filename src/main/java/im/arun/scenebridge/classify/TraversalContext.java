package im.arun.scenebridge.classify;

import im.arun.scenebridge.model.DocumentNode;
import im.arun.scenebridge.model.NodeType;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Flags inherited top-down while walking one page. Immutable; each step derives a child context.
 */
@Getter
@AllArgsConstructor
public final class TraversalContext {
    private final int depth;
    private final boolean withinComponentDefinition;
    private final boolean selectedPage;

    public static TraversalContext forPage(boolean selectedPage) {
        return new TraversalContext(0, false, selectedPage);
    }

    /**
     * Context for the children of the given node. Once a component is entered the flag sticks.
     */
    public TraversalContext descend(DocumentNode node) {
        boolean within = withinComponentDefinition || node.getType() == NodeType.COMPONENT;
        return new TraversalContext(depth + 1, within, selectedPage);
    }
}
