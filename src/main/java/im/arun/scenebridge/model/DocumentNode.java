package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.With;

import java.util.List;

/**
 * A node of the externally supplied design document.
 * Treated as read-only during reconciliation; the only rewrite (instance promotion)
 * goes through {@link #withType(NodeType)} / {@link #withComponentId(String)} and produces a new value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DocumentNode {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @With
    @JsonProperty("type")
    private NodeType type;

    @ToString.Exclude
    @JsonProperty("children")
    private List<DocumentNode> children;

    @JsonProperty("visible")
    private boolean visible = true;

    @With
    @JsonProperty("componentId")
    private String componentId;

    /** 2x3 affine matrix relative to the parent: [[a, b, tx], [c, d, ty]]. */
    @JsonProperty("relativeTransform")
    private double[][] relativeTransform;

    @JsonProperty("size")
    private Vector size;

    @JsonProperty("absoluteBoundingBox")
    private Rect absoluteBoundingBox;

    @JsonProperty("constraints")
    private LayoutConstraint constraints;

    @JsonProperty("fills")
    private List<Paint> fills;

    @JsonProperty("exportSettings")
    private List<ExportSetting> exportSettings;

    @JsonProperty("flowStartingPoints")
    private List<FlowStartingPoint> flowStartingPoints;

    @JsonProperty("characters")
    private String characters;

    public DocumentNode(String id, String name, NodeType type) {
        this.id = id;
        this.name = name;
        this.type = type;
    }

    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    public List<DocumentNode> childrenOrEmpty() {
        return children != null ? children : List.of();
    }

    public boolean hasExportSettings() {
        return exportSettings != null && !exportSettings.isEmpty();
    }

    public boolean ofType(NodeType nodeType) {
        return type == nodeType;
    }
}
