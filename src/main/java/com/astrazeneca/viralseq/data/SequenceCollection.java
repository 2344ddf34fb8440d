package com.astrazeneca.viralseq.data;

import com.astrazeneca.viralseq.modules.Translator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.astrazeneca.viralseq.Utils.alignmentLength;
import static com.astrazeneca.viralseq.Utils.countFrequencies;

/**
 * Named sequences sharing identifiers between three roles: nucleotide sequences, amino acid sequences and
 * quality strings. Maps are copied on construction and exposed as read-only views, so each transformation
 * returns an independent collection. The only in-place operation is {@link #translate(int)}.
 */
public class SequenceCollection {
    public static final char GAP = '-';

    private final Map<String, String> dna;
    private final Map<String, String> aa;
    private final Map<String, String> quality;
    private final String title;
    private final String file;

    public SequenceCollection(Map<String, String> dna, String title) {
        this(dna, Collections.emptyMap(), Collections.emptyMap(), title, "");
    }

    public SequenceCollection(Map<String, String> dna, Map<String, String> aa, Map<String, String> quality,
                              String title, String file) {
        this.dna = new LinkedHashMap<>(dna);
        this.aa = new LinkedHashMap<>(aa);
        this.quality = new LinkedHashMap<>(quality);
        this.title = title == null ? "" : title;
        this.file = file == null ? "" : file;
    }

    /**
     * Creates collection from the list of nucleotide sequences. Sequences are named masterTag_1, masterTag_2...
     * @param sequences nucleotide sequences
     * @param masterTag prefix of sequence names, also used as a title
     * @return new collection
     */
    public static SequenceCollection fromArray(List<String> sequences, String masterTag) {
        Map<String, String> dna = new LinkedHashMap<>();
        int n = 1;
        for (String sequence : sequences) {
            dna.put(masterTag + "_" + n, sequence);
            n++;
        }
        return new SequenceCollection(dna, masterTag);
    }

    public static SequenceCollection fromArray(List<String> sequences) {
        return fromArray(sequences, "seq");
    }

    public Map<String, String> getDna() {
        return Collections.unmodifiableMap(dna);
    }

    public Map<String, String> getAa() {
        return Collections.unmodifiableMap(aa);
    }

    public Map<String, String> getQuality() {
        return Collections.unmodifiableMap(quality);
    }

    public Map<String, String> getSequences(SequenceType type) {
        return type == SequenceType.AA ? getAa() : getDna();
    }

    public String getTitle() {
        return title;
    }

    public String getFile() {
        return file;
    }

    /**
     * @return number of nucleotide sequences
     */
    public int size() {
        return dna.size();
    }

    public boolean isEmpty() {
        return dna.isEmpty();
    }

    /**
     * Creates collection with the same content and other title.
     * @param newTitle title of new collection
     * @return new collection
     */
    public SequenceCollection withTitle(String newTitle) {
        return new SequenceCollection(dna, aa, quality, newTitle, file);
    }

    /**
     * Sub collection of sequences with the specified names. Names absent from nucleotide sequences are skipped.
     * @param keys names of sequences
     * @return new collection contains nucleotide, amino acid and quality entries for the names
     */
    public SequenceCollection sub(Collection<String> keys) {
        Map<String, String> subDna = new LinkedHashMap<>();
        Map<String, String> subAa = new LinkedHashMap<>();
        Map<String, String> subQuality = new LinkedHashMap<>();
        for (String key : keys) {
            String sequence = dna.get(key);
            if (sequence == null) {
                continue;
            }
            subDna.put(key, sequence);
            if (aa.containsKey(key)) {
                subAa.put(key, aa.get(key));
            }
            if (quality.containsKey(key)) {
                subQuality.put(key, quality.get(key));
            }
        }
        return new SequenceCollection(subDna, subAa, subQuality, title, file);
    }

    /**
     * Collapses nucleotide sequences to unique ones. Sequences are named tag_order_count in order of first appearance.
     * @param tag master tag for names
     * @return new collection of unique sequences
     */
    public SequenceCollection uniq(String tag) {
        Map<String, Integer> frequencies = countFrequencies(dna.values());
        Map<String, String> unique = new LinkedHashMap<>();
        int n = 1;
        for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
            unique.put(tag + "_" + n + "_" + entry.getValue(), entry.getKey());
            n++;
        }
        return new SequenceCollection(unique, Collections.emptyMap(), Collections.emptyMap(), title + "_uniq", file);
    }

    /**
     * Translates nucleotide sequences and replaces amino acid sequences of this collection.
     * @param codonPosition reading frame, 0, 1 or 2
     */
    public void translate(int codonPosition) {
        aa.clear();
        for (Map.Entry<String, String> entry : dna.entrySet()) {
            aa.put(entry.getKey(), Translator.translate(entry.getValue(), codonPosition));
        }
    }

    /**
     * Translates sequences and splits them by presence of stop codons.
     * @param codonPosition reading frame, 0, 1 or 2
     * @return split where selected are sequences with stop codons (title has suffix "_stop")
     */
    public SequenceSplit stopCodon(int codonPosition) {
        translate(codonPosition);
        List<String> withStop = new ArrayList<>();
        List<String> withoutStop = new ArrayList<>();
        for (Map.Entry<String, String> entry : aa.entrySet()) {
            if (entry.getValue().indexOf('*') >= 0) {
                withStop.add(entry.getKey());
            } else {
                withoutStop.add(entry.getKey());
            }
        }
        return new SequenceSplit(sub(withStop).withTitle(title + "_stop"), sub(withoutStop));
    }

    /**
     * Removes all alignment columns containing gaps.
     * @param type which sequences to strip
     * @return new collection, other sequences are carried unchanged
     */
    public SequenceCollection gapStrip(SequenceType type) {
        Map<String, String> alignment = type == SequenceType.AA ? aa : dna;
        int length = alignmentLength(alignment.values(), "Gap strip", title);
        boolean[] keep = new boolean[length];
        for (int position = 0; position < length; position++) {
            keep[position] = !columnHasGap(alignment.values(), position);
        }
        Map<String, String> stripped = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : alignment.entrySet()) {
            StringBuilder sb = new StringBuilder();
            for (int position = 0; position < length; position++) {
                if (keep[position]) {
                    sb.append(entry.getValue().charAt(position));
                }
            }
            stripped.put(entry.getKey(), sb.toString());
        }
        return withStripped(type, stripped);
    }

    /**
     * Removes alignment columns with gaps only at the both ends of alignment.
     * @param type which sequences to strip
     * @return new collection, other sequences are carried unchanged
     */
    public SequenceCollection gapStripEnds(SequenceType type) {
        Map<String, String> alignment = type == SequenceType.AA ? aa : dna;
        int length = alignmentLength(alignment.values(), "Gap strip of alignment ends", title);
        int begin = 0;
        while (begin < length && columnHasGap(alignment.values(), begin)) {
            begin++;
        }
        int end = length;
        while (end > begin && columnHasGap(alignment.values(), end - 1)) {
            end--;
        }
        Map<String, String> stripped = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : alignment.entrySet()) {
            stripped.put(entry.getKey(), entry.getValue().substring(begin, end));
        }
        return withStripped(type, stripped);
    }

    private static boolean columnHasGap(Collection<String> sequences, int position) {
        for (String sequence : sequences) {
            if (sequence.charAt(position) == GAP) {
                return true;
            }
        }
        return false;
    }

    private SequenceCollection withStripped(SequenceType type, Map<String, String> stripped) {
        return type == SequenceType.AA
                ? new SequenceCollection(dna, stripped, quality, title + "_strip", file)
                : new SequenceCollection(stripped, aa, quality, title + "_strip", file);
    }

    /**
     * Relaxed sequential PHYLIP representation of nucleotide sequences.
     * @return string with header line " N L" and one line per sequence
     */
    public String toRelaxedPhylip() {
        int length = dna.isEmpty() ? 0 : dna.values().iterator().next().length();
        StringBuilder sb = new StringBuilder();
        sb.append(' ').append(dna.size()).append(' ').append(length).append('\n');
        int nameBlock = 10;
        for (String name : dna.keySet()) {
            nameBlock = Math.max(nameBlock, name.length());
        }
        for (Map.Entry<String, String> entry : dna.entrySet()) {
            String name = entry.getKey();
            sb.append(name);
            for (int i = name.length(); i < nameBlock + 2; i++) {
                sb.append(' ');
            }
            String sequence = entry.getValue();
            for (int i = 0; i < sequence.length(); i += 10) {
                if (i > 0) {
                    sb.append(' ');
                }
                sb.append(sequence, i, Math.min(i + 10, sequence.length()));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SequenceCollection that = (SequenceCollection) o;
        return Objects.equals(dna, that.dna) &&
                Objects.equals(aa, that.aa) &&
                Objects.equals(quality, that.quality) &&
                Objects.equals(title, that.title) &&
                Objects.equals(file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dna, aa, quality, title, file);
    }

    @Override
    public String toString() {
        return "SequenceCollection [title=" + title + ", file=" + file + ", size=" + dna.size() + "]";
    }
}
