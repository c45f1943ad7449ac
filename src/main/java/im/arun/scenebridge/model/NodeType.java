package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Closed set of design document node types.
 * Values the importer does not recognise map to {@link #UNKNOWN}.
 */
public enum NodeType {
    DOCUMENT,
    CANVAS,
    SECTION,
    FRAME,
    GROUP,
    COMPONENT,
    COMPONENT_SET,
    INSTANCE,
    VECTOR,
    BOOLEAN_OPERATION,
    TEXT,
    RECTANGLE,
    ELLIPSE,
    LINE,
    STAR,
    REGULAR_POLYGON,
    SLICE,
    UNKNOWN;

    @JsonCreator
    public static NodeType fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return NodeType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
