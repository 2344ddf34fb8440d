package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.SequenceCollection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

import static com.astrazeneca.viralseq.Utils.countFrequencies;
import static com.astrazeneca.viralseq.Utils.hammingDistance;
import static com.astrazeneca.viralseq.data.Patterns.PID_NAME;

/**
 * Removes redundant sequences: Primer ID resampling artifacts and sequences within small edit distance
 * from more frequent ones.
 */
public class SequenceCollapser {
    public static final int DEFAULT_PID_CUTOFF = 10;
    public static final int DEFAULT_COLLAPSE_CUTOFF = 1;

    public SequenceCollection filterSimilarPid(SequenceCollection collection) {
        return filterSimilarPid(collection, DEFAULT_PID_CUTOFF);
    }

    /**
     * Filters out sequences of Primer IDs that are likely to be PCR or sequencing errors of another Primer ID.
     * Sequence names must start with Primer ID and its read count, e.g. AGGCGTAGA_32_sample1_RT.
     * For identical sequences, if two Primer IDs differ at most at one position and the count of one of them
     * is at least cutoff times the count of other, all sequences of the minor Primer ID are removed.
     * @param collection sequences named by Primer ID
     * @param cutoff fold of counts of major and minor Primer IDs
     * @return new collection without sequences of minor Primer IDs
     */
    public SequenceCollection filterSimilarPid(SequenceCollection collection, int cutoff) {
        Map<String, Map<String, Integer>> pidsBySequence = new LinkedHashMap<>();
        Map<String, String> pidByName = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : collection.getDna().entrySet()) {
            Matcher matcher = PID_NAME.matcher(entry.getKey());
            if (!matcher.find()) {
                System.err.println("Sequence name \"" + entry.getKey() + "\" has no Primer ID and read count, "
                        + "the sequence is kept.");
                continue;
            }
            String pid = matcher.group(1);
            pidByName.put(entry.getKey(), pid);
            pidsBySequence.computeIfAbsent(entry.getValue(), k -> new LinkedHashMap<>())
                    .put(pid, Integer.parseInt(matcher.group(2)));
        }

        Set<String> minorPids = new HashSet<>();
        for (Map<String, Integer> pidCounts : pidsBySequence.values()) {
            List<String> pids = new ArrayList<>(pidCounts.keySet());
            for (int i = 0; i < pids.size(); i++) {
                for (int j = i + 1; j < pids.size(); j++) {
                    String pid1 = pids.get(i);
                    String pid2 = pids.get(j);
                    if (hammingDistance(pid1, pid2) > 1) {
                        continue;
                    }
                    long count1 = pidCounts.get(pid1);
                    long count2 = pidCounts.get(pid2);
                    if (count1 >= cutoff * count2) {
                        minorPids.add(pid2);
                    } else if (count2 >= cutoff * count1) {
                        minorPids.add(pid1);
                    }
                }
            }
        }

        List<String> kept = new ArrayList<>();
        for (String name : collection.getDna().keySet()) {
            String pid = pidByName.get(name);
            if (pid == null || !minorPids.contains(pid)) {
                kept.add(name);
            }
        }
        return collection.sub(kept);
    }

    public SequenceCollection collapse(SequenceCollection collection) {
        return collapse(collection, DEFAULT_COLLAPSE_CUTOFF);
    }

    /**
     * Collapses sequences that differ at most at cutoff positions. Of each such pair of distinct sequences
     * the less frequent one is removed, the first one is kept on equal frequencies.
     * @param collection nucleotide sequences, aligned
     * @param cutoff maximum number of different positions to collapse
     * @return new collection of remaining distinct sequences named seq_rank_frequency, title has
     * suffix "_collapse"
     */
    public SequenceCollection collapse(SequenceCollection collection, int cutoff) {
        Map<String, Integer> frequencies = countFrequencies(collection.getDna().values());
        List<String> unique = new ArrayList<>(frequencies.keySet());
        Set<String> collapsed = new HashSet<>();
        for (int i = 0; i < unique.size(); i++) {
            for (int j = i + 1; j < unique.size(); j++) {
                String first = unique.get(i);
                String second = unique.get(j);
                if (hammingDistance(first, second) <= cutoff) {
                    collapsed.add(frequencies.get(first) >= frequencies.get(second) ? second : first);
                }
            }
        }

        Map<String, String> representatives = new LinkedHashMap<>();
        int rank = 1;
        for (String sequence : unique) {
            if (!collapsed.contains(sequence)) {
                representatives.put("seq_" + rank + "_" + frequencies.get(sequence), sequence);
                rank++;
            }
        }
        return new SequenceCollection(representatives, Collections.emptyMap(), Collections.emptyMap(),
                collection.getTitle() + "_collapse", collection.getFile());
    }
}
