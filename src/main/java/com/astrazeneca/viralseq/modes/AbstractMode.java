package com.astrazeneca.viralseq.modes;

import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.printers.ResultPrinter;

import static com.astrazeneca.viralseq.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Abstract Mode of ViralSeq. Each mode runs one group of analyses on the loaded collection and prints
 * results with the printer set in configuration.
 */
public abstract class AbstractMode {
    protected final SequenceCollection collection;
    protected final ResultPrinter printer;

    public AbstractMode(SequenceCollection collection) {
        this.collection = collection;
        this.printer = ResultPrinter.createPrinter(instance().printerTypeOut);
    }

    /**
     * Prints header (with option -h) and results of the mode.
     */
    public void start() {
        if (instance().conf.printHeader) {
            printHeader();
        }
        process();
    }

    /**
     * Runs the analysis and prints results.
     */
    public abstract void process();

    /**
     * Print header to output with option -h. Each mode creates own string for header.
     */
    public abstract void printHeader();

    public ResultPrinter getPrinter() {
        return printer;
    }
}
