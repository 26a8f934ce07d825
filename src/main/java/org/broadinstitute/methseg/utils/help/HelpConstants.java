package org.broadinstitute.methseg.utils.help;

public final class HelpConstants {

    private HelpConstants() {}

    public static final String MAIN_SITE = "https://github.com/broadinstitute/methseg";

    /**
     * Definition of the group names / descriptions for documentation/help purposes.
     */
    public final static String DOC_CAT_METHYLATION_SEGMENTATION = "Methylation Segmentation";
    public final static String DOC_CAT_METHYLATION_SEGMENTATION_SUMMARY = "Tools that segment per-CpG bisulfite methylation levels into hypomethylated and background regions";
}
