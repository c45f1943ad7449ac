package im.arun.scenebridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A behaviour attached to a generated node: a kind plus an ordered property bag.
 * Generation fills in the fields it knows about; anything else was added by hand and
 * is what the delta merge carries forward.
 */
@Data
@NoArgsConstructor
public class NodeComponent {

    public static final String TEXT = "Text";
    public static final String IMAGE = "Image";
    public static final String SERVER_IMAGE = "ServerImage";

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("fields")
    private Map<String, Object> fields = new LinkedHashMap<>();

    public NodeComponent(String kind) {
        this.kind = kind;
    }

    public NodeComponent with(String field, Object value) {
        fields.put(field, value);
        return this;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value != null ? value.toString() : null;
    }

    public double getNumber(String field) {
        Object value = fields.get(field);
        return value instanceof Number ? ((Number) value).doubleValue() : 0;
    }

    public boolean getBoolean(String field) {
        Object value = fields.get(field);
        return value instanceof Boolean && (Boolean) value;
    }

    public boolean isDefault(String field) {
        return isDefaultValue(fields.get(field));
    }

    /**
     * Assigns a field, refusing values whose type differs from the current non-null value.
     *
     * @throws FieldCopyException on a type mismatch
     */
    public void assign(String field, Object value) {
        Object current = fields.get(field);
        if (current != null && value != null && !compatible(current, value)) {
            throw new FieldCopyException(kind, field,
                "expected " + current.getClass().getSimpleName() + " but got " + value.getClass().getSimpleName());
        }
        fields.put(field, value);
    }

    public NodeComponent deepCopy() {
        NodeComponent copy = new NodeComponent(kind);
        fields.forEach((key, value) -> copy.fields.put(key, copyValue(value)));
        return copy;
    }

    public static boolean isDefaultValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).isEmpty();
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() == 0;
        }
        if (value instanceof Boolean) {
            return !((Boolean) value);
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        return false;
    }

    private static boolean compatible(Object current, Object value) {
        if (current instanceof Number && value instanceof Number) {
            return true;
        }
        if (current instanceof Collection && value instanceof Collection) {
            return true;
        }
        if (current instanceof Map && value instanceof Map) {
            return true;
        }
        return current.getClass().isInstance(value);
    }

    /**
     * Copies nested maps and lists so the copy shares no mutable state with the source.
     */
    public static Object copyValue(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> copy.put(k, copyValue(v)));
            return copy;
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }
}
