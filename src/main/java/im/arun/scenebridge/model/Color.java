package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Color {
    private double r;
    private double g;
    private double b;
    private double a = 1;

    /**
     * Hex form used by generated image components, alpha premultiplied by the paint opacity.
     */
    public String toHex(double opacity) {
        return String.format("#%02X%02X%02X%02X",
            channel(r), channel(g), channel(b), channel(a * opacity));
    }

    private static int channel(double value) {
        return (int) Math.round(Math.max(0, Math.min(1, value)) * 255);
    }
}
