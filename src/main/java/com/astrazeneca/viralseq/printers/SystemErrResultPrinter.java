package com.astrazeneca.viralseq.printers;

/**
 * Standard error output for result printer (will print to STDERR).
 */
public class SystemErrResultPrinter extends ResultPrinter {
    public SystemErrResultPrinter() {
        out = System.err;
    }
}
