package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.CoordinateRange;
import com.astrazeneca.viralseq.data.LocatorResult;
import com.astrazeneca.viralseq.data.ReferenceGenome;
import com.astrazeneca.viralseq.data.SequenceCollection;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Quality control of sequences by their location on the reference genome. Sequences must start and end
 * in the expected ranges and, optionally, have no indels.
 */
public class LocatorQcFilter {
    private final SequenceLocator locator;

    public LocatorQcFilter(SequenceLocator locator) {
        this.locator = locator;
    }

    /**
     * Filters the collection by location of the sequences. Each distinct sequence is located once in forward
     * orientation.
     * @param collection nucleotide sequences
     * @param startRange allowed start positions on the reference
     * @param endRange allowed end positions on the reference
     * @param allowIndel if false, sequences with indels are discarded
     * @param genome reference genome
     * @return sub collection of sequences passed the filter
     */
    public SequenceCollection filter(SequenceCollection collection, CoordinateRange startRange,
                                     CoordinateRange endRange, boolean allowIndel, ReferenceGenome genome) {
        Map<String, Boolean> passedSequences = new HashMap<>();
        List<String> passed = new ArrayList<>();
        for (Map.Entry<String, String> entry : collection.getDna().entrySet()) {
            boolean pass = passedSequences.computeIfAbsent(entry.getValue(), sequence -> {
                LocatorResult location = locator.locateForward(sequence, genome);
                return startRange.contains(location.start)
                        && endRange.contains(location.end)
                        && (allowIndel || !location.indel);
            });
            if (pass) {
                passed.add(entry.getKey());
            }
        }
        return collection.sub(passed);
    }
}
