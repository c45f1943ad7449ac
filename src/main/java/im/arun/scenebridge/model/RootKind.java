package im.arun.scenebridge.model;

/**
 * Slot a generated root is stored under. The folder name is part of the root key.
 */
public enum RootKind {
    PAGE("Pages"),
    SCREEN("Screens"),
    COMPONENT("Components");

    private final String folder;

    RootKind(String folder) {
        this.folder = folder;
    }

    public String getFolder() {
        return folder;
    }
}
