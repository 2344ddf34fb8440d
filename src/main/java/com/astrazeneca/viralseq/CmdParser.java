package com.astrazeneca.viralseq;

import com.astrazeneca.viralseq.data.CoordinateRange;
import com.astrazeneca.viralseq.data.ReferenceGenome;
import com.astrazeneca.viralseq.data.SequenceType;
import com.astrazeneca.viralseq.modes.AnalysisType;
import com.astrazeneca.viralseq.printers.PrinterType;
import org.apache.commons.cli.*;

import java.util.Iterator;
import java.util.List;

/**
 * Class to parse the parameters from the command line
 */
public class CmdParser {
    /**
     * Parses the array of command line parameters and fills configuration parameters.
     * @param args arguments from command line to be parsed
     * @return configuration with parameters from command line
     * @throws ParseException if parse can't be finished
     */
    public Configuration parseParams(String[] args) throws ParseException {
        Options options = buildOptions();

        CommandLineParser parser = new BasicParser();

        Configuration config = null;

        try {
            CommandLine cmd = parser.parse(options, args);
            if (cmd.getOptions().length == 0 || cmd.hasOption("H")) {
                help(options);
            }
            config = parseCmd(cmd);
        } catch (MissingOptionException e) {
            List<?> missingOptions = e.getMissingOptions();
            System.err.print("Missing required option(s): ");
            for (Iterator<?> iterator = missingOptions.iterator(); iterator.hasNext(); ) {
                Object object = iterator.next();
                System.err.print(object);
                if (iterator.hasNext()) {
                    System.err.print(", ");
                }
            }
            System.err.println();
            help(options);
        }

        return config;
    }

    /**
     * For each parameter in CMD set the Configuration variable
     * @param cmd parsed CommandLine from apache CLI
     * @return configuration with parameters from command line
     * @throws ParseException if numeric option can't be parsed
     */
    Configuration parseCmd(CommandLine cmd) throws ParseException {
        Configuration config = new Configuration();

        config.input = cmd.getOptionValue("i");
        config.analysisType = AnalysisType.fromOption(cmd.getOptionValue("m"));
        if (cmd.hasOption("t")) {
            config.sequenceType = SequenceType.fromString(cmd.getOptionValue("t"));
        }
        config.printHeader = cmd.hasOption('h');
        config.delimiter = cmd.getOptionValue("d", "\t");

        config.consensusCutoff = getDoubleValue(cmd, "c", config.consensusCutoff);
        config.errorRate = getDoubleValue(cmd, "e", config.errorRate);
        config.poissonFoldCutoff = getIntValue(cmd, "f", config.poissonFoldCutoff);
        config.pValueCutoff = getDoubleValue(cmd, "p", config.pValueCutoff);
        config.outlierFoldCutoff = getIntValue(cmd, "F", config.outlierFoldCutoff);
        config.minSequencesForPoisson = getIntValue(cmd, "n", config.minSequencesForPoisson);
        config.pidCutoff = getIntValue(cmd, "P", config.pidCutoff);
        config.collapseCutoff = getIntValue(cmd, "x", config.collapseCutoff);
        config.codonPosition = getIntValue(cmd, "cp", config.codonPosition);

        if (cmd.hasOption("r")) {
            config.referenceGenome = ReferenceGenome.fromString(cmd.getOptionValue("r"));
        }
        config.referenceDirectory = setReferenceDirectory(cmd);
        config.muscle = cmd.getOptionValue("muscle", config.muscle);
        config.align = cmd.hasOption("align");

        if (cmd.hasOption("S")) {
            config.startRange = CoordinateRange.parse(cmd.getOptionValue("S"));
        }
        if (cmd.hasOption("E")) {
            config.endRange = CoordinateRange.parse(cmd.getOptionValue("E"));
        }
        config.allowIndel = cmd.hasOption("indel");

        config.y = cmd.hasOption("y");

        if (cmd.hasOption("DP")) {
            config.printerType = PrinterType.fromString(cmd.getOptionValue("DP", PrinterType.OUT.name()));
        }
        return config;
    }

    /**
     * Reference directory is used only by locator and qc analyses, the default is the AZ path.
     * @param cmd parsed CommandLine from apache CLI
     * @return path to directory with reference genome FASTA files
     */
    private String setReferenceDirectory(CommandLine cmd) {
        String directory = cmd.getOptionValue("G");
        if (directory == null) {
            AnalysisType type = AnalysisType.fromOption(cmd.getOptionValue("m"));
            if (type == AnalysisType.LOCATOR || type == AnalysisType.QC) {
                System.err.println("Reference directory wasn't set (option -G). Will be used the default path "
                        + Configuration.DEFAULT_REFERENCE_DIR + ".");
            }
            directory = Configuration.DEFAULT_REFERENCE_DIR;
        }
        return directory;
    }

    /**
     * Help information about options contains long and short option names and their descriptions
     * @return options from apache CLI
     */
    @SuppressWarnings("static-access")
    Options buildOptions() {
        Options options = new Options();
        options.addOption("H", "?", false, "Print this help page");
        options.addOption("h", "header", false, "Print a header row describing columns");
        options.addOption("align", false, "Align sequences with MUSCLE before the analysis");
        options.addOption("indel", false, "Keep sequences with indels in qc analysis. Default: sequences with indels are removed");

        options.addOption(OptionBuilder.withArgName("file")
                .hasArg(true)
                .withDescription("FASTA or FASTQ (.fastq, .fq) file with sequences")
                .withType(String.class)
                .isRequired(true)
                .withLongOpt("input")
                .create('i'));

        options.addOption(OptionBuilder.withArgName("mode")
                .hasArg(true)
                .withDescription("Analysis to run: consensus, a3g, pm, pi, tn93, entropy, locator, qc, collapse, pid, "
                        + "uniq, stop, strip, strip-ends, phylip, translate")
                .withType(String.class)
                .isRequired(true)
                .withLongOpt("mode")
                .create('m'));

        options.addOption(OptionBuilder.withArgName("nt/aa")
                .hasArg(true)
                .withDescription("Type of sequences for entropy and gap stripping. Default: nt")
                .withType(String.class)
                .isRequired(false)
                .create('t'));

        options.addOption(OptionBuilder.withArgName("string")
                .hasArg(true)
                .withDescription("The delimiter of tabular output. Default: tab")
                .withType(String.class)
                .isRequired(false)
                .create('d'));

        options.addOption(OptionBuilder.withArgName("double")
                .hasArg(true)
                .withDescription("Majority cutoff for consensus calling, in (0, 1]. Default: 0.5")
                .withType(Number.class)
                .isRequired(false)
                .create('c'));

        options.addOption(OptionBuilder.withArgName("double")
                .hasArg(true)
                .withDescription("Estimated sequencing error rate per base for Poisson minority cutoff. Default: 0.0001")
                .withType(Number.class)
                .isRequired(false)
                .create('e'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("Fold of observed over expected positions for Poisson minority cutoff. Default: 20")
                .withType(Number.class)
                .isRequired(false)
                .create('f'));

        options.addOption(OptionBuilder.withArgName("double")
                .hasArg(true)
                .withDescription("P-value cutoff of Fisher's exact test for APOBEC3G/F hypermutation. Default: 0.05")
                .withType(Number.class)
                .isRequired(false)
                .create('p'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("Fold of observed over expected sequences for the Poisson outlier cutoff of "
                        + "APOBEC3G/F mutations. Default: 20")
                .withType(Number.class)
                .isRequired(false)
                .create('F'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The Poisson outlier cutoff of APOBEC3G/F mutations is applied only if there are more "
                        + "sequences than INT. Default: 20")
                .withType(Number.class)
                .isRequired(false)
                .create('n'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("Fold of read counts of similar Primer IDs to remove the minor one. Default: 10")
                .withType(Number.class)
                .isRequired(false)
                .create('P'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("Maximum number of different positions to collapse sequences. Default: 1")
                .withType(Number.class)
                .isRequired(false)
                .create('x'));

        options.addOption(OptionBuilder.withArgName("0/1/2")
                .hasArg(true)
                .withDescription("Codon position (reading frame) for translation. Default: 0")
                .withType(Number.class)
                .isRequired(false)
                .create("cp"));

        options.addOption(OptionBuilder.withArgName("HXB2 | NL43 | MAC239")
                .hasArg(true)
                .withDescription("Reference genome for locator and qc. Default: HXB2")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("ref")
                .create('r'));

        options.addOption(OptionBuilder.withArgName("dir")
                .hasArg(true)
                .withDescription("Directory with reference genomes HXB2.fasta, NL43.fasta, MAC239.fasta. Default: "
                        + Configuration.DEFAULT_REFERENCE_DIR)
                .withType(String.class)
                .isRequired(false)
                .create('G'));

        options.addOption(OptionBuilder.withArgName("path")
                .hasArg(true)
                .withDescription("Path to MUSCLE executable. Default: muscle")
                .withType(String.class)
                .isRequired(false)
                .create("muscle"));

        options.addOption(OptionBuilder.withArgName("start[-end]")
                .hasArg(true)
                .withDescription("Allowed start position(s) on the reference for qc, e.g. 4384 or 4384-4386")
                .withType(String.class)
                .isRequired(false)
                .create('S'));

        options.addOption(OptionBuilder.withArgName("start[-end]")
                .hasArg(true)
                .withDescription("Allowed end position(s) on the reference for qc, e.g. 4751 or 4750-4752")
                .withType(String.class)
                .isRequired(false)
                .create('E'));

        options.addOption(OptionBuilder
                .isRequired(false)
                .withLongOpt("verbose")
                .create('y'));

        options.addOption(OptionBuilder.withArgName("string")
                .hasArg(true)
                .withDescription("The printer type used for different outputs. Default: OUT (i.e. System.out).")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("default-printer")
                .create("DP"));

        return options;
    }

    private int getIntValue(CommandLine cmd, String option, int defaultValue) throws ParseException {
        Object value = cmd.getParsedOptionValue(option);
        return value == null ? defaultValue : ((Number) value).intValue();
    }

    private double getDoubleValue(CommandLine cmd, String opt, double defaultValue) throws ParseException {
        Object value = cmd.getParsedOptionValue(opt);
        return value == null ? defaultValue : ((Number) value).doubleValue();
    }

    private void help(Options options) {
        HelpFormatter formater = new HelpFormatter();
        formater.setOptionComparator(null);
        formater.printHelp(142, "viralseq -i sequences.fasta -m mode [-c cutoff] [-e error_rate] [-r ref] [-G ref_dir] "
                        + "[-S start] [-E end]",
                "ViralSeq analyses collections of viral sequences: consensus calling, APOBEC3G/F hypermutation\n"
                        + "detection, Poisson cutoff for minority variants, nucleotide diversity, pairwise distances,\n"
                        + "Shannon's entropy and location of sequences on HIV/SIV reference genomes.\nOptions:",
                options, "");

        System.exit(0);
    }
}
