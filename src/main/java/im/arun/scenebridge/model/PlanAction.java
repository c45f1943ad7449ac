package im.arun.scenebridge.model;

public enum PlanAction {
    /** Produced by this generation with no prior counterpart. */
    CREATE,
    /** Present before and regenerated; updated in place. */
    UPDATE,
    /** Only present in the backup; carried over as is. */
    PRESERVE,
    /** A backed up root this generation no longer produces. */
    REMOVE
}
