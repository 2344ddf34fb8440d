package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.AlignmentResult;
import com.astrazeneca.viralseq.data.LocatorResult;
import com.astrazeneca.viralseq.data.LocatorResult.Direction;
import com.astrazeneca.viralseq.data.ReferenceGenome;
import com.astrazeneca.viralseq.data.ReferenceResource;
import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.exception.DegenerateInputException;
import org.apache.commons.math3.util.Precision;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.astrazeneca.viralseq.Utils.reverseComplement;
import static com.astrazeneca.viralseq.data.SequenceCollection.GAP;

/**
 * Locates sequences on the reference genome coordinates, resembling LANL HIV Sequence Locator.
 * The query is aligned with the reference in forward and reverse complement orientation,
 * the orientation with higher similarity is reported.
 */
public class SequenceLocator {
    private final PairwiseAligner aligner;
    private final ReferenceResource referenceResource;

    public SequenceLocator(PairwiseAligner aligner, ReferenceResource referenceResource) {
        this.aligner = aligner;
        this.referenceResource = referenceResource;
    }

    /**
     * Locates query using reference option. Unknown reference is replaced with HXB2.
     * @param query nucleotide sequence
     * @param referenceOption name of reference genome
     * @return location of the query in the best orientation
     */
    public LocatorResult locate(String query, String referenceOption) {
        return locate(query, ReferenceGenome.fromString(referenceOption));
    }

    /**
     * Locates query on both strands of the reference. Ties in similarity are resolved to forward orientation.
     * @param query nucleotide sequence
     * @param genome reference genome
     * @return location of the query in the best orientation
     */
    public LocatorResult locate(String query, ReferenceGenome genome) {
        String reference = referenceResource.getSequence(genome);
        LocatorResult forward = locate(query, reference, Direction.FORWARD);
        LocatorResult reverse = locate(reverseComplement(query), reference, Direction.REVERSE);
        return reverse.similarity > forward.similarity ? reverse : forward;
    }

    /**
     * Locates query in the orientation as given, without trying reverse complement.
     * @param query nucleotide sequence
     * @param genome reference genome
     * @return location of the query
     */
    public LocatorResult locateForward(String query, ReferenceGenome genome) {
        return locate(query, referenceResource.getSequence(genome), Direction.FORWARD);
    }

    /**
     * Locates every sequence of the collection. Identical sequences are located once.
     * @param collection nucleotide sequences, alignment is not required
     * @param genome reference genome
     * @return map of sequence name to location, in the collection order
     */
    public Map<String, LocatorResult> locate(SequenceCollection collection, ReferenceGenome genome) {
        Map<String, LocatorResult> uniqueLocations = new HashMap<>();
        Map<String, LocatorResult> locations = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : collection.getDna().entrySet()) {
            LocatorResult location = uniqueLocations.computeIfAbsent(entry.getValue(), seq -> locate(seq, genome));
            locations.put(entry.getKey(), location);
        }
        return locations;
    }

    private LocatorResult locate(String query, String reference, Direction direction) {
        AlignmentResult alignment = aligner.align(query.toUpperCase(), reference);
        return fromAlignment(alignment, direction);
    }

    /**
     * Derives location from pairwise alignment. The aligned part is between the first and the last non-gap
     * query positions. Start and end are reference positions of this part, similarity is percent of identical
     * positions in it, indel is any gap inside it in query or reference.
     * @param alignment aligned query and reference
     * @param direction orientation of query
     * @return location
     */
    static LocatorResult fromAlignment(AlignmentResult alignment, Direction direction) {
        String query = alignment.alignedQuery;
        String reference = alignment.alignedReference;
        int first = 0;
        while (first < query.length() && query.charAt(first) == GAP) {
            first++;
        }
        int last = query.length() - 1;
        while (last >= first && query.charAt(last) == GAP) {
            last--;
        }
        if (first > last) {
            throw new DegenerateInputException("Sequence location", "query", "the query has no aligned bases");
        }

        int referenceBefore = 0;
        for (int i = 0; i < first; i++) {
            if (reference.charAt(i) != GAP) {
                referenceBefore++;
            }
        }
        int matches = 0;
        int referenceCovered = 0;
        boolean indel = false;
        for (int i = first; i <= last; i++) {
            char queryBase = query.charAt(i);
            char referenceBase = reference.charAt(i);
            if (queryBase == GAP || referenceBase == GAP) {
                indel = true;
            } else if (queryBase == referenceBase) {
                matches++;
            }
            if (referenceBase != GAP) {
                referenceCovered++;
            }
        }
        int start = referenceBefore + 1;
        int end = referenceBefore + referenceCovered;
        double similarity = Precision.round(matches * 100.0 / (last - first + 1), 2);
        return new LocatorResult(start, end, similarity, indel, direction, query, reference);
    }
}
