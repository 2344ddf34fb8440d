package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.data.SequenceType;
import com.astrazeneca.viralseq.exception.SequenceInputException;
import htsjdk.samtools.SAMException;
import htsjdk.samtools.fastq.FastqReader;
import htsjdk.samtools.fastq.FastqRecord;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.astrazeneca.viralseq.data.Patterns.FASTQ_EXTENSION;
import static com.astrazeneca.viralseq.data.Patterns.FILE_EXTENSION;

/**
 * Reads sequence collections from FASTA and FASTQ files.
 */
public class SequenceFileParser {

    /**
     * Reads file as FASTQ if it has .fastq or .fq extension, otherwise as FASTA.
     * @param path path to file
     * @param type role of sequences in FASTA file
     * @return collection titled by the file name without extension
     */
    public SequenceCollection read(String path, SequenceType type) {
        if (FASTQ_EXTENSION.matcher(path).find()) {
            return readFastq(path);
        }
        return type == SequenceType.AA ? readAminoAcidFasta(path) : readFasta(path);
    }

    public SequenceCollection readFasta(String path) {
        Map<String, String> sequences = parseFastaFile(path);
        return new SequenceCollection(sequences, Collections.emptyMap(), Collections.emptyMap(), title(path), path);
    }

    public SequenceCollection readAminoAcidFasta(String path) {
        Map<String, String> sequences = parseFastaFile(path);
        return new SequenceCollection(Collections.emptyMap(), sequences, Collections.emptyMap(), title(path), path);
    }

    /**
     * Reads FASTQ file, bases are stored as nucleotide sequences and qualities as quality strings.
     * @param path path to file
     * @return collection
     */
    public SequenceCollection readFastq(String path) {
        File file = checkFile(path);
        Map<String, String> sequences = new LinkedHashMap<>();
        Map<String, String> qualities = new LinkedHashMap<>();
        try (FastqReader reader = new FastqReader(file)) {
            for (FastqRecord record : reader) {
                sequences.put(record.getReadName(), record.getReadString().toUpperCase());
                qualities.put(record.getReadName(), record.getBaseQualityString());
            }
        } catch (SAMException e) {
            throw new SequenceInputException(path, e);
        }
        return new SequenceCollection(sequences, Collections.emptyMap(), qualities, title(path), path);
    }

    private Map<String, String> parseFastaFile(String path) {
        File file = checkFile(path);
        try (BufferedReader reader = new BufferedReader(new FileReader(file, StandardCharsets.UTF_8))) {
            return parseFasta(reader, path);
        } catch (IOException e) {
            throw new SequenceInputException(path, e);
        }
    }

    /**
     * Method reads FASTA records line by line. Blank lines and lines starting with '=' are skipped,
     * sequence lines are upper cased and concatenated.
     * @param reader reader of FASTA content
     * @param source name of source for error messages
     * @return map of sequence names (header without '&gt;') to sequences
     * @throws IOException if content can't be read
     */
    public static Map<String, String> parseFasta(BufferedReader reader, String source) throws IOException {
        Map<String, StringBuilder> records = new LinkedHashMap<>();
        StringBuilder current = null;
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.replace("\u0000", "");
            if (line.trim().isEmpty() || line.startsWith("=")) {
                continue;
            }
            if (line.startsWith(">")) {
                current = new StringBuilder();
                records.put(line.substring(1).trim(), current);
            } else if (current == null) {
                throw new SequenceInputException(source, "sequence data found before the first '>' header");
            } else {
                current.append(line.trim().toUpperCase());
            }
        }
        Map<String, String> sequences = new LinkedHashMap<>();
        for (Map.Entry<String, StringBuilder> entry : records.entrySet()) {
            sequences.put(entry.getKey(), entry.getValue().toString());
        }
        return sequences;
    }

    private static File checkFile(String path) {
        File file = new File(path);
        if (!file.isFile() || !file.canRead()) {
            throw new SequenceInputException(path, "file doesn't exist or is not readable");
        }
        return file;
    }

    /**
     * @return file name without directory and extension
     */
    static String title(String path) {
        String name = new File(path).getName();
        return FILE_EXTENSION.matcher(name).replaceFirst("");
    }
}
