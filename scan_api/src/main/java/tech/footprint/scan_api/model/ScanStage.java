package tech.footprint.scan_api.model;

/**
 * Lifecycle of one scan. Lookup stages run in any subset depending on the input type;
 * {@link #ABORTED} is only reachable from {@link #CLASSIFYING}.
 */
public enum ScanStage {
    CLASSIFYING("classifier"),
    BREACH_CHECKING("breach"),
    CORRELATING("correlation"),
    IMAGE_ANALYZING("image"),
    VERDICT_COMPUTING("verdict"),
    GUIDANCE_GENERATING("guidance"),
    TRANSPARENCY_GENERATING("transparency"),
    COMPLETE("scan"),
    ABORTED("scan");

    private final String module;

    ScanStage(String module) {
        this.module = module;
    }

    /** Module name carried by the progress events of this stage. */
    public String module() {
        return module;
    }

    public boolean isLookup() {
        return this == BREACH_CHECKING || this == CORRELATING || this == IMAGE_ANALYZING;
    }
}
