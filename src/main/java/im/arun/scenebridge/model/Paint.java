package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single fill entry of a node.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Paint {

    public enum PaintType {
        SOLID, GRADIENT_LINEAR, GRADIENT_RADIAL, GRADIENT_ANGULAR, GRADIENT_DIAMOND, IMAGE, EMOJI, VIDEO, UNKNOWN;

        @JsonCreator
        public static PaintType fromValue(String value) {
            if (value == null) {
                return UNKNOWN;
            }
            try {
                return PaintType.valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return UNKNOWN;
            }
        }
    }

    @JsonProperty("type")
    private PaintType type;

    @JsonProperty("visible")
    private boolean visible = true;

    @JsonProperty("opacity")
    private double opacity = 1;

    @JsonProperty("imageRef")
    private String imageRef;

    @JsonProperty("color")
    private Color color;

    public static Paint image(String imageRef) {
        return new Paint(PaintType.IMAGE, true, 1, imageRef, null);
    }

    public static Paint solid(Color color) {
        return new Paint(PaintType.SOLID, true, 1, null, color);
    }

    public boolean isImageWithRef() {
        return type == PaintType.IMAGE && imageRef != null && !imageRef.isEmpty();
    }
}
