package com.astrazeneca.viralseq.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of APOBEC3G/F hypermutation detection: hypermutated and remaining sequences and statistics of every
 * sequence in input order.
 */
public class HypermutationResult extends SequenceSplit {
    public final List<HypermutationRecord> records;

    /**
     * Cutoff of G to A mutations from Poisson model, -1 if the model wasn't applied
     */
    public final int outlierCutoff;

    public HypermutationResult(SequenceCollection hypermutated, SequenceCollection remaining,
                               List<HypermutationRecord> records, int outlierCutoff) {
        super(hypermutated, remaining);
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.outlierCutoff = outlierCutoff;
    }

    public List<HypermutationRecord> getHypermutatedRecords() {
        List<HypermutationRecord> result = new ArrayList<>();
        for (HypermutationRecord record : records) {
            if (record.hypermutated) {
                result.add(record);
            }
        }
        return result;
    }
}
