package com.astrazeneca.viralseq.data;

import java.util.regex.Pattern;

/**
 * Regex Patterns from all classes of ViralSeq stored in one place.
 */
public class Patterns {
    //APOBEC3G/F patterns
    /**
     * Regexp finds GRD trinucleotide (G followed by purine followed by not C), APOBEC3G/F target motif
     */
    public static final jregex.Pattern APOBEC_GRD = new jregex.Pattern("^G[AG][AGT]");

    //Sequence name patterns
    /**
     * Regexp finds Primer ID and its count at the start of the sequence name, e.g. AGGCGTAGA_32_sample1_RT
     */
    public static final Pattern PID_NAME = Pattern.compile("^([^_]+)_(\\d+)");

    //File patterns
    public static final Pattern FASTQ_EXTENSION = Pattern.compile("\\.(fastq|fq)(\\.gz)?$", Pattern.CASE_INSENSITIVE);
    public static final Pattern FILE_EXTENSION = Pattern.compile("\\.[^.\\/]*$");
}
