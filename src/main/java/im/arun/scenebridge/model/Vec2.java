package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Local-space 2D value (Y grows upward). Operations return new instances.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Vec2 {
    private double x;
    private double y;

    public static Vec2 zero() {
        return new Vec2(0, 0);
    }

    public static Vec2 of(double x, double y) {
        return new Vec2(x, y);
    }

    public Vec2 plus(Vec2 other) {
        return new Vec2(x + other.x, y + other.y);
    }

    public Vec2 minus(Vec2 other) {
        return new Vec2(x - other.x, y - other.y);
    }

    /** Component-wise product. */
    public Vec2 scale(Vec2 other) {
        return new Vec2(x * other.x, y * other.y);
    }

    /** Rotates counter-clockwise by the given angle in degrees. */
    public Vec2 rotate(double degrees) {
        if (degrees == 0) {
            return new Vec2(x, y);
        }
        double radians = Math.toRadians(degrees);
        double cos = Math.cos(radians);
        double sin = Math.sin(radians);
        return new Vec2(x * cos - y * sin, x * sin + y * cos);
    }
}
