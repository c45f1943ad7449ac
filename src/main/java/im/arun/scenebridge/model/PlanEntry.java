package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlanEntry {

    @JsonProperty("root")
    private String rootKey;

    @JsonProperty("path")
    private String path;

    @JsonProperty("action")
    private PlanAction action;
}
