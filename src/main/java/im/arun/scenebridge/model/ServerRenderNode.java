package im.arun.scenebridge.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A node selected for rasterization, with the reason it was selected.
 */
@Data
@AllArgsConstructor
public class ServerRenderNode {
    private DocumentNode sourceNode;
    private RenderClassification renderType;
}
