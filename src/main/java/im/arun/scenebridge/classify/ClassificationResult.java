package im.arun.scenebridge.classify;

import im.arun.scenebridge.model.RenderClassification;
import im.arun.scenebridge.model.ServerRenderNode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nodes selected for server rendering, in discovery order, plus the derived tag map.
 * Ids not present in the map are reconstructed natively.
 */
@Getter
public class ClassificationResult {
    private final List<ServerRenderNode> serverRenderNodes;
    private final Map<String, RenderClassification> classifications;

    public ClassificationResult(List<ServerRenderNode> serverRenderNodes) {
        this.serverRenderNodes = Collections.unmodifiableList(new ArrayList<>(serverRenderNodes));
        Map<String, RenderClassification> map = new LinkedHashMap<>();
        for (ServerRenderNode renderNode : serverRenderNodes) {
            map.put(renderNode.getSourceNode().getId(), renderNode.getRenderType());
        }
        this.classifications = Collections.unmodifiableMap(map);
    }

    public static ClassificationResult empty() {
        return new ClassificationResult(List.of());
    }

    public RenderClassification classificationOf(String nodeId) {
        return classifications.getOrDefault(nodeId, RenderClassification.NATIVE_RECONSTRUCT);
    }

    public boolean isSubstitution(String nodeId) {
        return classificationOf(nodeId) == RenderClassification.SERVER_SUBSTITUTE;
    }

    public boolean isServerRendered(String nodeId) {
        return classificationOf(nodeId) != RenderClassification.NATIVE_RECONSTRUCT;
    }
}
