package com.astrazeneca.viralseq.modes;

/**
 * Analyses available from command line (option -m). Each type is run by one of the modes.
 */
public enum AnalysisType {
    CONSENSUS("consensus"),
    A3G("a3g"),
    PM("pm"),
    PI("pi"),
    TN93("tn93"),
    ENTROPY("entropy"),
    LOCATOR("locator"),
    QC("qc"),
    COLLAPSE("collapse"),
    PID("pid"),
    UNIQ("uniq"),
    STOP("stop"),
    STRIP("strip"),
    STRIP_ENDS("strip-ends"),
    PHYLIP("phylip"),
    TRANSLATE("translate");

    private final String option;

    AnalysisType(String option) {
        this.option = option;
    }

    public String getOption() {
        return option;
    }

    public static AnalysisType fromOption(String option) {
        for (AnalysisType type : values()) {
            if (type.option.equalsIgnoreCase(option)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown analysis mode: " + option);
    }
}
