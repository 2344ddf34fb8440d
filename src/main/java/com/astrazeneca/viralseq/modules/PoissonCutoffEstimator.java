package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.data.poisson.PoissonModel;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.astrazeneca.viralseq.Utils.alignmentLength;
import static com.astrazeneca.viralseq.Utils.column;
import static com.astrazeneca.viralseq.Utils.countFrequencies;

/**
 * Poisson cutoff for minority variants (Zhou, et al. J Virol 2015). Mutations observed at least cutoff times
 * are very likely to be real rather than random errors of the sequencing method.
 */
public class PoissonCutoffEstimator {
    public static final double DEFAULT_ERROR_RATE = 0.0001;
    public static final int DEFAULT_FOLD_CUTOFF = 20;

    public int minorityCutoff(SequenceCollection collection) {
        return minorityCutoff(collection, DEFAULT_ERROR_RATE, DEFAULT_FOLD_CUTOFF);
    }

    /**
     * Calculates cutoff for minority variants. The expected number of positions with k variants is
     * L * P(k), P is Poisson with rate N * errorRate. The first k with observed positions at least
     * foldCutoff times more than expected is the cutoff.
     * @param collection aligned nucleotide sequences
     * @param errorRate estimated sequencing error rate per base
     * @param foldCutoff fold of observed over expected positions, 20 means less than 5% of variants are errors
     * @return cutoff (variants with count &gt;= cutoff are real), 0 for empty collection; maximum observed
     * variant count plus one if no count passes
     */
    public int minorityCutoff(SequenceCollection collection, double errorRate, int foldCutoff) {
        if (errorRate < 0) {
            throw new IllegalArgumentException("Error rate can't be negative, was: " + errorRate);
        }
        if (collection.isEmpty()) {
            return 0;
        }
        Collection<String> sequences = collection.getDna().values();
        int length = alignmentLength(sequences, "Poisson minority cutoff", collection.getTitle());
        SortedMap<Integer, Integer> observed = variantDistribution(sequences, length);
        int maxCount = observed.isEmpty() ? 0 : observed.lastKey();
        double[] probabilities = new PoissonModel(sequences.size() * errorRate).probabilities(maxCount);

        for (int k = 1; k <= maxCount; k++) {
            double expectedPositions = length * probabilities[k];
            int observedPositions = observed.getOrDefault(k, 0);
            if (observedPositions >= foldCutoff * expectedPositions) {
                return k;
            }
        }
        return maxCount + 1;
    }

    /**
     * Distribution of variant counts over alignment columns. Variant count of column is number of sequences
     * minus count of the most frequent symbol.
     * @param sequences aligned sequences
     * @param length alignment length
     * @return map variant count to number of columns, sorted by variant count
     */
    static SortedMap<Integer, Integer> variantDistribution(Collection<String> sequences, int length) {
        SortedMap<Integer, Integer> distribution = new TreeMap<>();
        for (int position = 0; position < length; position++) {
            Map<Character, Integer> counts = countFrequencies(column(sequences, position));
            int variants = sequences.size() - Collections.max(counts.values());
            distribution.merge(variants, 1, Integer::sum);
        }
        return distribution;
    }
}
