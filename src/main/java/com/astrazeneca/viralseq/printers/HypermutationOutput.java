package com.astrazeneca.viralseq.printers;

import com.astrazeneca.viralseq.data.HypermutationRecord;

import static com.astrazeneca.viralseq.Utils.getRoundedValueToPrint;
import static com.astrazeneca.viralseq.Utils.join;

/**
 * Row of APOBEC3G/F hypermutation table: counts of mutations and sites, rate ratio and p-value of one sequence.
 */
public class HypermutationOutput extends OutputRow {
    private static final String[] HEADER = {"sequence_name", "muts", "out_of", "controls", "out_of",
            "rate_ratio", "p_value", "hypermutated"};

    private final HypermutationRecord record;

    public HypermutationOutput(HypermutationRecord record) {
        this.record = record;
    }

    public static String header(String delimiter) {
        return join(delimiter, (Object[]) HEADER);
    }

    @Override
    public String toString() {
        return join(delimiter,
                record.name,
                record.motifMutations,
                record.motifSites,
                record.controlMutations,
                record.controlSites,
                getRoundedValueToPrint("0.00", record.rateRatio),
                record.pValue,
                record.hypermutated
        );
    }
}
