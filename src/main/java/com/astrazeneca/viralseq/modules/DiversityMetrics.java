package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.data.SequenceType;
import com.astrazeneca.viralseq.exception.DegenerateInputException;
import com.astrazeneca.viralseq.exception.EmptyInputException;
import org.apache.commons.math3.util.Precision;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.astrazeneca.viralseq.Utils.alignmentLength;
import static com.astrazeneca.viralseq.Utils.column;
import static com.astrazeneca.viralseq.Utils.countFrequencies;
import static com.astrazeneca.viralseq.Utils.hammingDistance;

/**
 * Positional diversity statistics of the alignment: Shannon's entropy, nucleotide diversity and
 * pairwise distance distribution.
 */
public class DiversityMetrics {
    private static final char STOP_CODON = '*';

    /**
     * Shannon's entropy with Euler's number as the base of logarithm. Stop codons are excluded from the column.
     * @param collection aligned sequences
     * @param type nucleotide or amino acid sequences of the collection
     * @return map of 1-based position to entropy
     */
    public SortedMap<Integer, Double> shannonsEntropy(SequenceCollection collection, SequenceType type) {
        Collection<String> sequences = collection.getSequences(type).values();
        if (sequences.isEmpty()) {
            throw new EmptyInputException(collection.getTitle(), "Shannon's entropy");
        }
        int length = alignmentLength(sequences, "Shannon's entropy", collection.getTitle());
        SortedMap<Integer, Double> entropies = new TreeMap<>();
        for (int position = 0; position < length; position++) {
            List<Character> symbols = column(sequences, position);
            symbols.removeIf(symbol -> symbol == STOP_CODON);
            double entropy = 0.0;
            for (int count : countFrequencies(symbols).values()) {
                double p = count / (double) symbols.size();
                entropy += -p * Math.log(p);
            }
            entropies.put(position + 1, entropy);
        }
        return entropies;
    }

    /**
     * Nucleotide pairwise diversity (pi). Gaps and ambiguous bases are excluded, columns with less than
     * two remaining bases are skipped.
     * @param collection aligned nucleotide sequences
     * @return pi rounded to 5 decimals
     */
    public double nucleotidePi(SequenceCollection collection) {
        Collection<String> sequences = collection.getDna().values();
        if (sequences.isEmpty()) {
            throw new EmptyInputException(collection.getTitle(), "nucleotide diversity");
        }
        int length = alignmentLength(sequences, "Nucleotide diversity", collection.getTitle());
        long diversity = 0;
        long combinations = 0;
        for (int position = 0; position < length; position++) {
            long a = 0;
            long c = 0;
            long g = 0;
            long t = 0;
            for (char base : column(sequences, position)) {
                switch (base) {
                    case 'A': a++; break;
                    case 'C': c++; break;
                    case 'G': g++; break;
                    case 'T': t++; break;
                    default: break;
                }
            }
            long bases = a + c + g + t;
            if (bases < 2) {
                continue;
            }
            combinations += bases * (bases - 1) / 2;
            diversity += a * c + a * t + a * g + c * t + c * g + t * g;
        }
        if (combinations == 0) {
            throw new DegenerateInputException("Nucleotide diversity", collection.getTitle(),
                    "no column has two or more A, C, G or T bases");
        }
        return Precision.round(diversity / (double) combinations, 5);
    }

    /**
     * Distribution of pairwise distances between all sequences of the collection (TN93 tabulation).
     * Identical sequences are compared once and weighted by the product of their counts.
     * @param collection aligned nucleotide sequences
     * @return map distance (number of different positions) to number of sequence pairs, sorted by distance
     */
    public SortedMap<Integer, Long> pairwiseDistanceHistogram(SequenceCollection collection) {
        if (collection.isEmpty()) {
            throw new EmptyInputException(collection.getTitle(), "pairwise distance distribution");
        }
        Map<String, Integer> frequencies = countFrequencies(collection.getDna().values());
        SortedMap<Integer, Long> histogram = new TreeMap<>();
        long identical = 0;
        for (int count : frequencies.values()) {
            identical += (long) count * (count - 1) / 2;
        }
        if (identical > 0) {
            histogram.put(0, identical);
        }

        List<Map.Entry<String, Integer>> unique = new ArrayList<>(frequencies.entrySet());
        for (int i = 0; i < unique.size(); i++) {
            for (int j = i + 1; j < unique.size(); j++) {
                int distance = hammingDistance(unique.get(i).getKey(), unique.get(j).getKey());
                long pairs = (long) unique.get(i).getValue() * unique.get(j).getValue();
                histogram.merge(distance, pairs, Long::sum);
            }
        }
        return histogram;
    }
}
