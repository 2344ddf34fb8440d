package com.astrazeneca.viralseq.modes;

import com.astrazeneca.viralseq.Configuration;
import com.astrazeneca.viralseq.data.LocatorResult;
import com.astrazeneca.viralseq.data.ReferenceResource;
import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.data.SequenceType;
import com.astrazeneca.viralseq.modules.LocatorQcFilter;
import com.astrazeneca.viralseq.modules.PairwiseAligner;
import com.astrazeneca.viralseq.modules.SequenceLocator;
import com.astrazeneca.viralseq.printers.LocatorOutput;

import java.util.Map;

import static com.astrazeneca.viralseq.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Mode locates sequences on the reference genome. In locator analysis the CSV report is printed for each
 * sequence, in qc analysis the sequences passed location QC are printed as FASTA.
 */
public class LocatorMode extends AbstractMode {
    private final AnalysisType analysisType;
    private final SequenceLocator locator;

    public LocatorMode(SequenceCollection collection, ReferenceResource referenceResource, PairwiseAligner aligner,
                       AnalysisType analysisType) {
        super(collection);
        if (analysisType != AnalysisType.LOCATOR && analysisType != AnalysisType.QC) {
            throw new IllegalArgumentException("Locator mode can't run analysis " + analysisType.getOption());
        }
        this.analysisType = analysisType;
        this.locator = new SequenceLocator(aligner, referenceResource);
    }

    @Override
    public void start() {
        // the CSV report always has a header row, QC output is FASTA
        if (analysisType == AnalysisType.LOCATOR) {
            printHeader();
        }
        process();
    }

    @Override
    public void process() {
        Configuration conf = instance().conf;
        if (conf.y) {
            System.err.println("Locating " + collection.size() + " sequences on " + conf.referenceGenome.name()
                    + " (" + conf.referenceGenome.getDescription() + ")");
        }
        if (analysisType == AnalysisType.QC) {
            if (conf.startRange == null || conf.endRange == null) {
                throw new IllegalArgumentException("QC of sequence location requires start (-S) and end (-E) ranges");
            }
            SequenceCollection passed = new LocatorQcFilter(locator)
                    .filter(collection, conf.startRange, conf.endRange, conf.allowIndel, conf.referenceGenome);
            if (conf.y) {
                System.err.println(passed.size() + " of " + collection.size() + " sequences passed location QC");
            }
            printer.printFasta(passed, SequenceType.NT);
            return;
        }
        Map<String, LocatorResult> locations = locator.locate(collection, conf.referenceGenome);
        for (Map.Entry<String, LocatorResult> entry : locations.entrySet()) {
            printer.print(new LocatorOutput(collection.getTitle(), entry.getKey(), conf.referenceGenome,
                    entry.getValue()));
        }
    }

    @Override
    public void printHeader() {
        if (analysisType == AnalysisType.LOCATOR) {
            printer.printLine(LocatorOutput.header(","));
        }
    }
}
