package com.astrazeneca.viralseq.modes;

import com.astrazeneca.viralseq.Configuration;
import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.modules.PoissonCutoffEstimator;

import static com.astrazeneca.viralseq.Utils.join;
import static com.astrazeneca.viralseq.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Mode prints Poisson cutoff for minority variants of the alignment.
 */
public class PoissonCutoffMode extends AbstractMode {

    public PoissonCutoffMode(SequenceCollection collection) {
        super(collection);
    }

    @Override
    public void process() {
        Configuration conf = instance().conf;
        int cutoff = new PoissonCutoffEstimator().minorityCutoff(collection, conf.errorRate, conf.poissonFoldCutoff);
        printer.printLine(join(conf.delimiter, collection.getTitle(), cutoff));
    }

    @Override
    public void printHeader() {
        printer.printLine(join(instance().conf.delimiter, "title", "minority_cutoff"));
    }
}
