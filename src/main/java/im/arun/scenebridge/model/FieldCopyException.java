package im.arun.scenebridge.model;

import lombok.Getter;

/**
 * Raised when a component field cannot take a value carried over from a backup.
 */
@Getter
public class FieldCopyException extends RuntimeException {
    private final String componentKind;
    private final String field;

    public FieldCopyException(String componentKind, String field, String reason) {
        super(String.format("Cannot copy %s.%s: %s", componentKind, field, reason));
        this.componentKind = componentKind;
        this.field = field;
    }
}
