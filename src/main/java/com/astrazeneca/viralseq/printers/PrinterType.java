package com.astrazeneca.viralseq.printers;

/**
 * Printer types for further extending of possible types to rule them through command line. The needed result
 * printer will be created for each type of PrinterType.
 */
public enum PrinterType {
    OUT,
    ERR;

    /**
     * Parses printer type from command line, unknown values fall back to OUT.
     * @param value name of printer type
     * @return printer type
     */
    public static PrinterType fromString(String value) {
        switch (value) {
            case "ERR": return ERR;
            case "OUT": return OUT;
            default: return OUT;
        }
    }
}
