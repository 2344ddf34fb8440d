package com.astrazeneca.viralseq.data;

/**
 * Result of partitioning a collection by some criterion: sequences that meet it and the rest.
 */
public class SequenceSplit {
    public final SequenceCollection selected;
    public final SequenceCollection remaining;

    public SequenceSplit(SequenceCollection selected, SequenceCollection remaining) {
        this.selected = selected;
        this.remaining = remaining;
    }
}
