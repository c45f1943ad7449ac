package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Horizontal and vertical layout constraints of a node relative to its parent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutConstraint {

    public enum Horizontal { LEFT, RIGHT, CENTER, LEFT_RIGHT, SCALE }

    public enum Vertical { TOP, BOTTOM, CENTER, TOP_BOTTOM, SCALE }

    @JsonProperty("horizontal")
    private Horizontal horizontal = Horizontal.LEFT;

    @JsonProperty("vertical")
    private Vertical vertical = Vertical.TOP;

    public static LayoutConstraint topLeft() {
        return new LayoutConstraint(Horizontal.LEFT, Vertical.TOP);
    }
}
