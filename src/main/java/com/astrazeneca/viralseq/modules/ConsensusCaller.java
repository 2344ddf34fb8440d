package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.exception.EmptyInputException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.astrazeneca.viralseq.Utils.alignmentLength;
import static com.astrazeneca.viralseq.Utils.column;
import static com.astrazeneca.viralseq.Utils.countFrequencies;

/**
 * Calls consensus sequence of the alignment with IUPAC ambiguity codes for mixed positions.
 */
public class ConsensusCaller {
    public static final double DEFAULT_CUTOFF = 0.5;

    private static final Map<String, Character> AMBIGUITY_CODES = new HashMap<>();

    static {
        AMBIGUITY_CODES.put("AT", 'W');
        AMBIGUITY_CODES.put("CG", 'S');
        AMBIGUITY_CODES.put("AC", 'M');
        AMBIGUITY_CODES.put("GT", 'K');
        AMBIGUITY_CODES.put("AG", 'R');
        AMBIGUITY_CODES.put("CT", 'Y');
        AMBIGUITY_CODES.put("CGT", 'B');
        AMBIGUITY_CODES.put("AGT", 'D');
        AMBIGUITY_CODES.put("ACT", 'H');
        AMBIGUITY_CODES.put("ACG", 'V');
    }

    public String consensus(SequenceCollection collection) {
        return consensus(collection, DEFAULT_CUTOFF);
    }

    /**
     * Creates consensus of nucleotide alignment. For each column the symbols (gaps included) with frequency
     * not less than cutoff are collected and called as one base.
     * @param collection aligned nucleotide sequences
     * @param cutoff majority cutoff in (0, 1]
     * @return consensus sequence of the alignment length
     */
    public String consensus(SequenceCollection collection, double cutoff) {
        if (!(cutoff > 0 && cutoff <= 1)) {
            throw new IllegalArgumentException("Consensus cutoff must be in (0, 1], was: " + cutoff);
        }
        if (collection.isEmpty()) {
            throw new EmptyInputException(collection.getTitle(), "consensus calling");
        }
        Collection<String> sequences = collection.getDna().values();
        int length = alignmentLength(sequences, "Consensus", collection.getTitle());
        int size = sequences.size();

        StringBuilder consensus = new StringBuilder(length);
        for (int position = 0; position < length; position++) {
            List<Character> majorBases = new ArrayList<>();
            for (Map.Entry<Character, Integer> entry : countFrequencies(column(sequences, position)).entrySet()) {
                if (entry.getValue() / (double) size >= cutoff) {
                    majorBases.add(entry.getKey());
                }
            }
            consensus.append(callConsensusBase(majorBases));
        }
        return consensus.toString();
    }

    /**
     * Calls one base for the set of bases: single base is called as itself, pairs and triples of nucleotides
     * as IUPAC codes, everything else as N.
     * @param bases bases passed the cutoff
     * @return consensus base
     */
    static char callConsensusBase(List<Character> bases) {
        if (bases.size() == 1) {
            return bases.get(0);
        }
        if (bases.size() == 2 || bases.size() == 3) {
            List<Character> sorted = new ArrayList<>(bases);
            Collections.sort(sorted);
            StringBuilder key = new StringBuilder();
            for (char base : sorted) {
                key.append(base);
            }
            return AMBIGUITY_CODES.getOrDefault(key.toString(), 'N');
        }
        return 'N';
    }
}
