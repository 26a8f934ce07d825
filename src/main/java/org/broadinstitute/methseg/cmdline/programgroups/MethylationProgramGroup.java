package org.broadinstitute.methseg.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.methseg.utils.help.HelpConstants;

/**
 * Tools that segment per-CpG methylation levels produced from bisulfite sequencing
 */
public class MethylationProgramGroup implements CommandLineProgramGroup {
    @Override
    public String getName() { return HelpConstants.DOC_CAT_METHYLATION_SEGMENTATION; }

    @Override
    public String getDescription() { return HelpConstants.DOC_CAT_METHYLATION_SEGMENTATION_SUMMARY; }
}
