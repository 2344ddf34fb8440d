package com.astrazeneca.viralseq.modes;

import com.astrazeneca.viralseq.Configuration;
import com.astrazeneca.viralseq.data.HypermutationRecord;
import com.astrazeneca.viralseq.data.HypermutationResult;
import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.modules.ConsensusCaller;
import com.astrazeneca.viralseq.modules.HypermutationDetector;
import com.astrazeneca.viralseq.printers.HypermutationOutput;

import static com.astrazeneca.viralseq.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Mode prints APOBEC3G/F hypermutation statistics for every sequence of the alignment.
 */
public class HypermutationMode extends AbstractMode {

    public HypermutationMode(SequenceCollection collection) {
        super(collection);
    }

    @Override
    public void process() {
        Configuration conf = instance().conf;
        HypermutationDetector detector = new HypermutationDetector(new ConsensusCaller(), conf.pValueCutoff,
                conf.outlierFoldCutoff, conf.minSequencesForPoisson);
        HypermutationResult result = detector.detect(collection);
        for (HypermutationRecord record : result.records) {
            HypermutationOutput row = new HypermutationOutput(record);
            row.setDelimiter(conf.delimiter);
            printer.print(row);
        }
        if (conf.y) {
            System.err.println(result.selected.size() + " of " + collection.size()
                    + " sequences are APOBEC3G/F hypermutated"
                    + (result.outlierCutoff >= 0 ? ", Poisson cutoff of mutations: " + result.outlierCutoff : ""));
        }
    }

    @Override
    public void printHeader() {
        printer.printLine(HypermutationOutput.header(instance().conf.delimiter));
    }
}
