package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A generated tree together with the logical slot it is stored under.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedRoot {

    @JsonProperty("root")
    private LogicalRoot root;

    @JsonProperty("source_node_id")
    private String sourceNodeId;

    @JsonProperty("tree")
    private GeneratedNode tree;

    public String key() {
        return root.key();
    }
}
