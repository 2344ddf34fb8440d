package com.astrazeneca.viralseq.data;

import com.astrazeneca.viralseq.exception.SequenceInputException;
import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.FastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.reference.ReferenceSequenceFile;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Utility class for access to reference genome sequences. All references from the directory are read once in
 * constructor and kept read-only.
 */
public class ReferenceResource {
    private final String directory;
    private final Map<ReferenceGenome, String> sequences;

    /**
     * Reads all reference genomes found in directory as NAME.fasta files (HXB2.fasta, NL43.fasta, MAC239.fasta).
     * Missing files are skipped, request of such reference fails.
     * @param directory path to directory with reference FASTA files
     */
    public ReferenceResource(String directory) {
        this.directory = directory;
        Map<ReferenceGenome, String> loaded = new EnumMap<>(ReferenceGenome.class);
        for (ReferenceGenome genome : ReferenceGenome.values()) {
            File file = new File(directory, genome.getFileName());
            if (file.isFile()) {
                loaded.put(genome, readReference(file));
            }
        }
        this.sequences = Collections.unmodifiableMap(loaded);
    }

    /**
     * Method reads the first record of FASTA file.
     * @param file reference FASTA
     * @return upper cased sequence of reference
     */
    private String readReference(File file) {
        try (ReferenceSequenceFile fasta = new FastaSequenceFile(file, true)) {
            ReferenceSequence sequence = fasta.nextSequence();
            if (sequence == null) {
                throw new SequenceInputException(file.getPath(), "file contains no sequences");
            }
            return sequence.getBaseString().toUpperCase();
        } catch (SAMException | IOException e) {
            throw new SequenceInputException(file.getPath(), e);
        }
    }

    /**
     * Get sequence of the reference genome.
     * @param genome reference genome
     * @return nucleotide sequence
     */
    public String getSequence(ReferenceGenome genome) {
        String sequence = sequences.get(genome);
        if (sequence == null) {
            throw new SequenceInputException(new File(directory, genome.getFileName()).getPath(),
                    "reference genome " + genome.name() + " is not found in the reference directory");
        }
        return sequence;
    }

    public Set<ReferenceGenome> getAvailableGenomes() {
        return sequences.keySet();
    }
}
