package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.AlignmentResult;

/**
 * Collaborator aligning query sequence to reference sequence.
 */
@FunctionalInterface
public interface PairwiseAligner {

    /**
     * Aligns two sequences.
     * @param query query nucleotide sequence
     * @param reference reference nucleotide sequence
     * @return aligned query and reference of the same length with '-' for gaps
     * @throws com.astrazeneca.viralseq.exception.AlignmentUnavailableException if alignment can't be done
     */
    AlignmentResult align(String query, String reference);
}
