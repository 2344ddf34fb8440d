package com.astrazeneca.viralseq.modes;

import com.astrazeneca.viralseq.Configuration;
import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.data.SequenceType;
import com.astrazeneca.viralseq.modules.SequenceCollapser;

import static com.astrazeneca.viralseq.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Mode removes redundant sequences: collapses similar sequences (collapse) or filters Primer ID
 * artifacts (pid). The remaining sequences are printed as FASTA.
 */
public class CollapseMode extends AbstractMode {
    private final AnalysisType analysisType;
    private final SequenceCollapser collapser = new SequenceCollapser();

    public CollapseMode(SequenceCollection collection, AnalysisType analysisType) {
        super(collection);
        if (analysisType != AnalysisType.COLLAPSE && analysisType != AnalysisType.PID) {
            throw new IllegalArgumentException("Collapse mode can't run analysis " + analysisType.getOption());
        }
        this.analysisType = analysisType;
    }

    @Override
    public void process() {
        Configuration conf = instance().conf;
        SequenceCollection result = analysisType == AnalysisType.COLLAPSE
                ? collapser.collapse(collection, conf.collapseCutoff)
                : collapser.filterSimilarPid(collection, conf.pidCutoff);
        if (conf.y) {
            System.err.println(collection.size() + " sequences reduced to " + result.size());
        }
        printer.printFasta(result, SequenceType.NT);
    }

    /**
     * FASTA output has no header.
     */
    @Override
    public void printHeader() {
    }
}
