package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.AlignmentResult;
import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.data.SequenceType;
import com.astrazeneca.viralseq.exception.AlignmentUnavailableException;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs MUSCLE (v3 command line) as external process to align sequences. Used both for multiple alignment of
 * collections and for pairwise alignment of query with reference.
 */
public class MuscleAligner implements PairwiseAligner {
    public static final String DEFAULT_MUSCLE = "muscle";
    private static final String QUERY = "query";
    private static final String REFERENCE = "reference";

    private final String muscle;

    public MuscleAligner() {
        this(DEFAULT_MUSCLE);
    }

    public MuscleAligner(String muscle) {
        this.muscle = muscle;
    }

    @Override
    public AlignmentResult align(String query, String reference) {
        Map<String, String> input = new LinkedHashMap<>();
        input.put(QUERY, query);
        input.put(REFERENCE, reference);
        Map<String, String> aligned = run(input);
        String alignedQuery = aligned.get(QUERY);
        String alignedReference = aligned.get(REFERENCE);
        if (alignedQuery == null || alignedReference == null || alignedQuery.length() != alignedReference.length()) {
            throw new AlignmentUnavailableException(muscle, "output doesn't contain aligned query and reference");
        }
        return new AlignmentResult(alignedQuery, alignedReference);
    }

    /**
     * Multiple alignment of the nucleotide or amino acid sequences of collection. MUSCLE is not started
     * when there is nothing to align, the collection is returned as is.
     * @param collection sequences to align
     * @param type which sequences to align, the others are carried unchanged
     * @return new collection of aligned sequences in the input order, title has suffix "_aligned"
     */
    public SequenceCollection align(SequenceCollection collection, SequenceType type) {
        Map<String, String> sequences = collection.getSequences(type);
        if (sequences.isEmpty()) {
            return collection;
        }
        Map<String, String> aligned = run(sequences);
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String name : sequences.keySet()) {
            String sequence = aligned.get(name);
            if (sequence == null) {
                throw new AlignmentUnavailableException(muscle, "sequence \"" + name + "\" is missing in the output");
            }
            ordered.put(name, sequence);
        }
        String title = collection.getTitle() + "_aligned";
        return type == SequenceType.AA
                ? new SequenceCollection(collection.getDna(), ordered, collection.getQuality(), title,
                        collection.getFile())
                : new SequenceCollection(ordered, collection.getAa(), collection.getQuality(), title,
                        collection.getFile());
    }

    private Map<String, String> run(Map<String, String> sequences) {
        File input = null;
        File output = null;
        try {
            input = File.createTempFile("_temp_muscle_in", ".fasta");
            output = File.createTempFile("_temp_muscle_aln", ".fasta");
            try (PrintWriter writer = new PrintWriter(input, StandardCharsets.UTF_8)) {
                for (Map.Entry<String, String> entry : sequences.entrySet()) {
                    writer.println(">" + entry.getKey());
                    writer.println(entry.getValue());
                }
            }
            execute(input, output);
            try (BufferedReader reader = new BufferedReader(new FileReader(output, StandardCharsets.UTF_8))) {
                return SequenceFileParser.parseFasta(reader, output.getPath());
            }
        } catch (IOException e) {
            throw new AlignmentUnavailableException(muscle, e);
        } finally {
            deleteQuietly(input);
            deleteQuietly(output);
        }
    }

    private void execute(File input, File output) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(muscle);
        command.add("-in");
        command.add(input.getPath());
        command.add("-out");
        command.add(output.getPath());
        command.add("-quiet");

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(true);
        Process proc = builder.start();
        StringBuilder messages = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(proc.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                messages.append(line).append('\n');
            }
        }
        try {
            int exitValue = proc.waitFor();
            if (exitValue != 0) {
                System.err.print(messages);
                throw new AlignmentUnavailableException(muscle, "process exit with error code(" + exitValue + ")");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlignmentUnavailableException(muscle, e);
        }
    }

    private static void deleteQuietly(File file) {
        if (file != null && file.exists() && !file.delete()) {
            System.err.println("Temporary file " + file.getPath() + " can't be deleted.");
        }
    }

    public String getMuscle() {
        return muscle;
    }
}
