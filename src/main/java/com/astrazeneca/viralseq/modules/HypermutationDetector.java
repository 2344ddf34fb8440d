package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.HypermutationRecord;
import com.astrazeneca.viralseq.data.HypermutationResult;
import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.data.fishertest.FisherExact;
import com.astrazeneca.viralseq.data.poisson.PoissonModel;
import com.astrazeneca.viralseq.exception.EmptyInputException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.astrazeneca.viralseq.Utils.alignmentLength;
import static com.astrazeneca.viralseq.Utils.countFrequencies;
import static com.astrazeneca.viralseq.data.Patterns.APOBEC_GRD;
import static com.astrazeneca.viralseq.data.SequenceCollection.GAP;

/**
 * Detects APOBEC3G/F hypermutated sequences in the alignment. APOBEC3G/F pattern: GRD -> ARD,
 * control pattern: G[YN|RC] -> A[YN|RC]. Potential APOBEC3G/F sites are searched on the consensus of alignment.
 * <p>
 * Two criteria are used:
 * <ol>
 *     <li>Fisher's exact test on G to A mutations at APOBEC3G/F positions vs. control positions;</li>
 *     <li>outliers of the Poisson distribution of G to A mutations at APOBEC3G/F positions. Applied only on
 *     collections with more than 20 sequences, as Poisson model doesn't do well on small samples.</li>
 * </ol>
 */
public class HypermutationDetector {
    public static final double DEFAULT_P_VALUE_CUTOFF = 0.05;
    public static final int DEFAULT_OUTLIER_FOLD_CUTOFF = 20;
    public static final int DEFAULT_MIN_SEQUENCES_FOR_POISSON = 20;

    private final ConsensusCaller consensusCaller;
    private final double pValueCutoff;
    private final int outlierFoldCutoff;
    private final int minSequencesForPoisson;

    public HypermutationDetector() {
        this(new ConsensusCaller(), DEFAULT_P_VALUE_CUTOFF, DEFAULT_OUTLIER_FOLD_CUTOFF,
                DEFAULT_MIN_SEQUENCES_FOR_POISSON);
    }

    public HypermutationDetector(ConsensusCaller consensusCaller, double pValueCutoff, int outlierFoldCutoff,
                                 int minSequencesForPoisson) {
        this.consensusCaller = consensusCaller;
        this.pValueCutoff = pValueCutoff;
        this.outlierFoldCutoff = outlierFoldCutoff;
        this.minSequencesForPoisson = minSequencesForPoisson;
    }

    /**
     * Classifies each sequence of the alignment as hypermutated or not.
     * @param collection aligned nucleotide sequences
     * @return hypermutated sequences (title with suffix "_hypermut"), remaining sequences and statistics
     * of all sequences
     */
    public HypermutationResult detect(SequenceCollection collection) {
        if (collection.isEmpty()) {
            throw new EmptyInputException(collection.getTitle(), "APOBEC3G/F hypermutation detection");
        }
        alignmentLength(collection.getDna().values(), "APOBEC3G/F hypermutation", collection.getTitle());

        String consensus = consensusCaller.consensus(collection, ConsensusCaller.DEFAULT_CUTOFF);
        ApobecSites sites = apobecSites(consensus);

        Map<String, HypermutationRecord> records = new LinkedHashMap<>();
        Map<String, Integer> mutations = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : collection.getDna().entrySet()) {
            String sequence = entry.getValue();
            int[] motif = countGtoA(sequence, sites.motifPositions);
            int[] control = countGtoA(sequence, sites.controlPositions);
            HypermutationRecord record = testSequence(entry.getKey(), motif[0], motif[1], control[0], control[1]);
            records.put(entry.getKey(), record);
            mutations.put(entry.getKey(), motif[0]);
        }

        int cutoff = -1;
        if (collection.size() > minSequencesForPoisson) {
            cutoff = outlierCutoff(mutations.values(), outlierFoldCutoff);
            for (Map.Entry<String, Integer> entry : mutations.entrySet()) {
                if (entry.getValue() > cutoff) {
                    records.put(entry.getKey(), records.get(entry.getKey()).asHypermutated());
                }
            }
        }

        List<String> hypermutated = new ArrayList<>();
        List<String> remaining = new ArrayList<>();
        for (HypermutationRecord record : records.values()) {
            if (record.hypermutated) {
                hypermutated.add(record.name);
            } else {
                remaining.add(record.name);
            }
        }
        return new HypermutationResult(
                collection.sub(hypermutated).withTitle(collection.getTitle() + "_hypermut"),
                collection.sub(remaining),
                new ArrayList<>(records.values()),
                cutoff);
    }

    /**
     * Fisher's exact test on table [[b - a, a], [d - c, c]].
     */
    HypermutationRecord testSequence(String name, int a, int b, int c, int d) {
        double rateRatio = (a / (double) b) / (c / (double) d);
        double pValue = new FisherExact(b - a, a, d - c, c).getPValue();
        return new HypermutationRecord(name, a, b, c, d, rateRatio, pValue, pValue < pValueCutoff);
    }

    /**
     * Poisson cutoff for number of G to A mutations at APOBEC3G/F positions. Scanning k from 1 to the maximum
     * observed count, the first k where observed number of sequences with k mutations is at least foldCutoff times
     * more than expected by Poisson model with mean rate becomes the cutoff.
     * @param mutationCounts G to A mutations at APOBEC3G/F positions of each sequence
     * @param foldCutoff fold of observed over expected sequences
     * @return cutoff, sequences with more mutations are outliers. Maximum observed count if no k was found.
     */
    public static int outlierCutoff(Collection<Integer> mutationCounts, int foldCutoff) {
        if (mutationCounts.isEmpty()) {
            return 0;
        }
        int size = mutationCounts.size();
        long total = 0;
        for (int count : mutationCounts) {
            total += count;
        }
        Map<Integer, Integer> observed = countFrequencies(mutationCounts);
        int maxCount = Collections.max(mutationCounts);
        double[] expected = new PoissonModel(total / (double) size).probabilities(maxCount);

        for (int k = 1; k <= maxCount; k++) {
            int observedSequences = observed.getOrDefault(k, 0);
            if (observedSequences >= foldCutoff * size * expected[k]) {
                return k;
            }
        }
        return maxCount;
    }

    /**
     * Finds potential APOBEC3G/F positions (GRD) and control positions (other G) on the consensus without gaps.
     * The last two positions are not considered.
     * @param consensus consensus of alignment
     * @return positions of both types
     */
    static ApobecSites apobecSites(String consensus) {
        String reference = consensus.replace(String.valueOf(GAP), "");
        ApobecSites sites = new ApobecSites();
        for (int n = 0; n + 3 <= reference.length(); n++) {
            if (APOBEC_GRD.matcher(reference.substring(n, n + 3)).find()) {
                sites.motifPositions.add(n);
            } else if (reference.charAt(n) == 'G') {
                sites.controlPositions.add(n);
            }
        }
        return sites;
    }

    /**
     * Counts A at the positions and all non-gap positions.
     * @return array of two elements: mutations and sites
     */
    private static int[] countGtoA(String sequence, List<Integer> positions) {
        int mutations = 0;
        int sites = 0;
        for (int position : positions) {
            char base = sequence.charAt(position);
            if (base == GAP) {
                continue;
            }
            if (base == 'A') {
                mutations++;
            }
            sites++;
        }
        return new int[] {mutations, sites};
    }

    static class ApobecSites {
        final List<Integer> motifPositions = new ArrayList<>();
        final List<Integer> controlPositions = new ArrayList<>();
    }
}
