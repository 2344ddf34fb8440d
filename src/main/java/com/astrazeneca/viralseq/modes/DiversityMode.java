package com.astrazeneca.viralseq.modes;

import com.astrazeneca.viralseq.Configuration;
import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.data.SequenceType;
import com.astrazeneca.viralseq.modules.DiversityMetrics;

import java.util.Map;

import static com.astrazeneca.viralseq.Utils.getRoundedValueToPrint;
import static com.astrazeneca.viralseq.Utils.join;
import static com.astrazeneca.viralseq.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Mode prints diversity statistics of the alignment: nucleotide diversity (pi), pairwise distance
 * distribution (tn93) or Shannon's entropy of each position (entropy).
 */
public class DiversityMode extends AbstractMode {
    private final AnalysisType analysisType;
    private final DiversityMetrics metrics = new DiversityMetrics();

    public DiversityMode(SequenceCollection collection, AnalysisType analysisType) {
        super(collection);
        if (analysisType != AnalysisType.PI && analysisType != AnalysisType.TN93
                && analysisType != AnalysisType.ENTROPY) {
            throw new IllegalArgumentException("Diversity mode can't run analysis " + analysisType.getOption());
        }
        this.analysisType = analysisType;
    }

    @Override
    public void process() {
        Configuration conf = instance().conf;
        switch (analysisType) {
            case PI:
                printer.printLine(join(conf.delimiter, collection.getTitle(), metrics.nucleotidePi(collection)));
                break;
            case TN93:
                for (Map.Entry<Integer, Long> entry : metrics.pairwiseDistanceHistogram(collection).entrySet()) {
                    printer.printLine(join(conf.delimiter, entry.getKey(), entry.getValue()));
                }
                break;
            case ENTROPY:
                if (conf.sequenceType == SequenceType.AA && collection.getAa().isEmpty()) {
                    collection.translate(conf.codonPosition);
                }
                Map<Integer, Double> entropies = metrics.shannonsEntropy(collection, conf.sequenceType);
                for (Map.Entry<Integer, Double> entry : entropies.entrySet()) {
                    printer.printLine(join(conf.delimiter, entry.getKey(),
                            getRoundedValueToPrint("0.0000", entry.getValue())));
                }
                break;
            default:
                break;
        }
    }

    @Override
    public void printHeader() {
        String delimiter = instance().conf.delimiter;
        switch (analysisType) {
            case PI: printer.printLine(join(delimiter, "title", "pi")); break;
            case TN93: printer.printLine(join(delimiter, "distance", "count")); break;
            case ENTROPY: printer.printLine(join(delimiter, "position", "entropy")); break;
            default: break;
        }
    }
}
