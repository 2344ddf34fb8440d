package com.astrazeneca.viralseq.printers;

/**
 * Standard output for result printer (will print to STDOUT).
 */
public class SystemOutResultPrinter extends ResultPrinter {
    public SystemOutResultPrinter() {
        out = System.out;
    }
}
