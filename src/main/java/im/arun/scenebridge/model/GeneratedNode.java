package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the generated scene tree, ready to be materialized by the native UI backend.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GeneratedNode {

    @JsonProperty("node_id")
    private String nodeId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("active")
    private boolean active = true;

    @JsonProperty("transform")
    private RectTransformData transform = new RectTransformData();

    /** Component id when this node is an instantiated component. */
    @JsonProperty("component_ref")
    private String componentRef;

    /** Logical root key of the reusable asset this node instantiates. */
    @JsonProperty("asset_ref")
    private String assetRef;

    /** Path of the server rendered image replacing this subtree. */
    @JsonProperty("image_ref")
    private String imageRef;

    /** Set while this node only marks where a component instance goes. */
    @JsonProperty("placeholder_component_id")
    private String placeholderComponentId;

    @JsonProperty("parent_node_id")
    private String parentNodeId;

    @JsonProperty("components")
    private Map<String, NodeComponent> components = new LinkedHashMap<>();

    @ToString.Exclude
    @JsonProperty("children")
    private List<GeneratedNode> children = new ArrayList<>();

    public GeneratedNode(String nodeId, String name) {
        this.nodeId = nodeId;
        this.name = name;
    }

    @JsonIgnore
    public boolean isPlaceholder() {
        return placeholderComponentId != null;
    }

    public GeneratedNode addChild(GeneratedNode child) {
        children.add(child);
        return this;
    }

    public NodeComponent addComponent(NodeComponent component) {
        components.put(component.getKind(), component);
        return component;
    }

    public NodeComponent component(String kind) {
        return components.get(kind);
    }

    public boolean hasComponent(String kind) {
        return components.containsKey(kind);
    }

    public GeneratedNode deepCopy() {
        GeneratedNode copy = new GeneratedNode(nodeId, name);
        copy.active = active;
        copy.transform = transform.copy();
        copy.componentRef = componentRef;
        copy.assetRef = assetRef;
        copy.imageRef = imageRef;
        copy.placeholderComponentId = placeholderComponentId;
        copy.parentNodeId = parentNodeId;
        components.forEach((kind, component) -> copy.components.put(kind, component.deepCopy()));
        for (GeneratedNode child : children) {
            copy.children.add(child.deepCopy());
        }
        return copy;
    }
}
