package com.astrazeneca.viralseq.modes;

import com.astrazeneca.viralseq.Configuration;
import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.data.SequenceSplit;
import com.astrazeneca.viralseq.data.SequenceType;

import static com.astrazeneca.viralseq.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Mode applies one transformation to the collection and prints the result: unique sequences, sequences with
 * stop codons, gap stripped alignment, relaxed PHYLIP or translation.
 */
public class TransformMode extends AbstractMode {
    private final AnalysisType analysisType;

    public TransformMode(SequenceCollection collection, AnalysisType analysisType) {
        super(collection);
        this.analysisType = analysisType;
    }

    @Override
    public void process() {
        Configuration conf = instance().conf;
        switch (analysisType) {
            case UNIQ:
                printer.printFasta(collection.uniq("seq"), SequenceType.NT);
                break;
            case STOP:
                SequenceSplit split = collection.stopCodon(conf.codonPosition);
                if (conf.y) {
                    System.err.println(split.selected.size() + " of " + collection.size()
                            + " sequences have stop codons");
                }
                printer.printFasta(split.selected, SequenceType.NT);
                break;
            case STRIP:
                printer.printFasta(collection.gapStrip(sequenceType(conf)), conf.sequenceType);
                break;
            case STRIP_ENDS:
                printer.printFasta(collection.gapStripEnds(sequenceType(conf)), conf.sequenceType);
                break;
            case PHYLIP:
                printer.getOut().print(collection.toRelaxedPhylip());
                break;
            case TRANSLATE:
                collection.translate(conf.codonPosition);
                printer.printFasta(collection, SequenceType.AA);
                break;
            default:
                throw new IllegalArgumentException("Transform mode can't run analysis " + analysisType.getOption());
        }
    }

    /**
     * Amino acid alignment is translated from nucleotide sequences if the input has no amino acid sequences.
     */
    private SequenceType sequenceType(Configuration conf) {
        if (conf.sequenceType == SequenceType.AA && collection.getAa().isEmpty()) {
            collection.translate(conf.codonPosition);
        }
        return conf.sequenceType;
    }

    /**
     * FASTA and PHYLIP outputs have no header.
     */
    @Override
    public void printHeader() {
    }
}
