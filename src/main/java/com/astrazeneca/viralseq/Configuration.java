package com.astrazeneca.viralseq;

import com.astrazeneca.viralseq.data.CoordinateRange;
import com.astrazeneca.viralseq.data.ReferenceGenome;
import com.astrazeneca.viralseq.data.SequenceType;
import com.astrazeneca.viralseq.modes.AnalysisType;
import com.astrazeneca.viralseq.modules.ConsensusCaller;
import com.astrazeneca.viralseq.modules.HypermutationDetector;
import com.astrazeneca.viralseq.modules.MuscleAligner;
import com.astrazeneca.viralseq.modules.PoissonCutoffEstimator;
import com.astrazeneca.viralseq.modules.SequenceCollapser;
import com.astrazeneca.viralseq.printers.PrinterType;

public class Configuration {
    public static final String DEFAULT_REFERENCE_DIR = "/ngs/reference_data/genomes/HIV";

    /**
     * Print a header row describing columns
     */
    public boolean printHeader; //-h
    /**
     * The delimiter of tabular output
     */
    public String delimiter = "\t"; // -d
    /**
     * Path to FASTA or FASTQ file with sequences
     */
    public String input; // -i
    /**
     * Which sequences of FASTA file are analyzed: nucleotide or amino acid
     */
    public SequenceType sequenceType = SequenceType.NT; // -t
    /**
     * Analysis to run
     */
    public AnalysisType analysisType; // -m

    /**
     * Majority cutoff for consensus calling. Default: 0.5
     */
    public double consensusCutoff = ConsensusCaller.DEFAULT_CUTOFF; // -c
    /**
     * Estimated sequencing error rate per base for Poisson minority cutoff. Default: 0.0001
     */
    public double errorRate = PoissonCutoffEstimator.DEFAULT_ERROR_RATE; // -e
    /**
     * Fold of observed over expected positions for Poisson minority cutoff. Default: 20
     */
    public int poissonFoldCutoff = PoissonCutoffEstimator.DEFAULT_FOLD_CUTOFF; // -f

    /**
     * P-value cutoff of Fisher's exact test for APOBEC3G/F hypermutation. Default: 0.05
     */
    public double pValueCutoff = HypermutationDetector.DEFAULT_P_VALUE_CUTOFF; // -p
    /**
     * Fold of observed over expected sequences for the Poisson outlier cutoff of APOBEC3G/F mutations. Default: 20
     */
    public int outlierFoldCutoff = HypermutationDetector.DEFAULT_OUTLIER_FOLD_CUTOFF; // -F
    /**
     * Poisson outlier cutoff is applied only on collections larger than this. Default: 20
     */
    public int minSequencesForPoisson = HypermutationDetector.DEFAULT_MIN_SEQUENCES_FOR_POISSON; // -n

    /**
     * Fold of read counts of similar Primer IDs to remove the minor one. Default: 10
     */
    public int pidCutoff = SequenceCollapser.DEFAULT_PID_CUTOFF; // -P
    /**
     * Maximum number of different positions to collapse sequences. Default: 1
     */
    public int collapseCutoff = SequenceCollapser.DEFAULT_COLLAPSE_CUTOFF; // -x
    /**
     * Reading frame for translation: 0, 1 or 2
     */
    public int codonPosition = 0; // -cp

    /**
     * Reference genome for sequence locator
     */
    public ReferenceGenome referenceGenome = ReferenceGenome.DEFAULT; // -r
    /**
     * Directory with reference genome FASTA files
     */
    public String referenceDirectory = DEFAULT_REFERENCE_DIR; // -G
    /**
     * Path to MUSCLE executable
     */
    public String muscle = MuscleAligner.DEFAULT_MUSCLE; // -muscle
    /**
     * Align sequences with MUSCLE before analysis
     */
    public boolean align; // -align

    /**
     * Allowed start positions on reference for QC
     */
    public CoordinateRange startRange; // -S
    /**
     * Allowed end positions on reference for QC
     */
    public CoordinateRange endRange; // -E
    /**
     * Keep sequences with indels in QC
     */
    public boolean allowIndel; // -indel

    /**
     * Verbose mode. Will output the analysis steps and times.
     */
    public boolean y; //-y

    /**
     * Default printer for results
     */
    public PrinterType printerType = PrinterType.OUT; // -DP
}
