package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Anchored rectangular transform of a generated node.
 * Defaults to top-left anchoring with a top-left pivot.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RectTransformData {
    private Vec2 anchorMin = Vec2.of(0, 1);
    private Vec2 anchorMax = Vec2.of(0, 1);
    private Vec2 pivot = Vec2.of(0, 1);
    private Vec2 anchoredPosition = Vec2.zero();
    private Vec2 sizeDelta = Vec2.zero();
    /** Rotation around Z in degrees, counter-clockwise. */
    private double rotation;

    public RectTransformData copy() {
        return new RectTransformData(anchorMin, anchorMax, pivot, anchoredPosition, sizeDelta, rotation);
    }
}
