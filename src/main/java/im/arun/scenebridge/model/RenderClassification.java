package im.arun.scenebridge.model;

/**
 * How a document node ends up in the generated scene.
 */
public enum RenderClassification {
    /** Rebuilt from live elements. */
    NATIVE_RECONSTRUCT,
    /** Top level node carrying explicit export settings, rasterized by the design tool. */
    SERVER_EXPORT,
    /** Vector-only subtree replaced wholesale by a rasterized image. */
    SERVER_SUBSTITUTE
}
