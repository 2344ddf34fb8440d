package com.astrazeneca.viralseq.printers;

import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.data.SequenceType;

import java.io.PrintStream;
import java.util.Map;

/**
 * Universal class for printing analysis results. The "out" stream can be set by implementing
 * new type in enum PrinterType, adding it to method createPrinter() and creating new child ResultPrinter class
 * extending this class. The choice of printer can be made by parameter --default-printer (PrinterType.OUT by default)
 */
public abstract class ResultPrinter {
    protected PrintStream out;

    /**
     * Prints one row of tabular output to the set output
     * @param row output row structure
     */
    public void print(OutputRow row) {
        out.println(row.toString());
    }

    public void printLine(String line) {
        out.println(line);
    }

    /**
     * Prints sequences of the collection in FASTA format, one line per sequence.
     * @param collection sequences to print
     * @param type nucleotide or amino acid sequences of collection
     */
    public void printFasta(SequenceCollection collection, SequenceType type) {
        for (Map.Entry<String, String> entry : collection.getSequences(type).entrySet()) {
            out.println(">" + entry.getKey());
            out.println(entry.getValue());
        }
    }

    public void setOut(PrintStream printStream) {
        out = printStream;
    }

    public PrintStream getOut() {
        return out;
    }

    /**
     * Factory method for creating needed printer classes for each printer type set in configuration.
     * @param type needed type (usually from instance)
     * @return created specific ResultPrinter
     */
    public static ResultPrinter createPrinter(PrinterType type) {
        switch(type) {
            case OUT: return new SystemOutResultPrinter();
            case ERR: return new SystemErrResultPrinter();
            default:  return new SystemOutResultPrinter();
        }
    }
}
