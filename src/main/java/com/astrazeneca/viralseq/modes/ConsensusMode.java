package com.astrazeneca.viralseq.modes;

import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.modules.ConsensusCaller;

import static com.astrazeneca.viralseq.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Mode prints consensus of the alignment as FASTA record named by the collection title.
 */
public class ConsensusMode extends AbstractMode {
    private final ConsensusCaller consensusCaller;

    public ConsensusMode(SequenceCollection collection) {
        this(collection, new ConsensusCaller());
    }

    ConsensusMode(SequenceCollection collection, ConsensusCaller consensusCaller) {
        super(collection);
        this.consensusCaller = consensusCaller;
    }

    @Override
    public void process() {
        String consensus = consensusCaller.consensus(collection, instance().conf.consensusCutoff);
        printer.printLine(">" + collection.getTitle() + "_consensus");
        printer.printLine(consensus);
    }

    /**
     * FASTA output has no header.
     */
    @Override
    public void printHeader() {
    }
}
