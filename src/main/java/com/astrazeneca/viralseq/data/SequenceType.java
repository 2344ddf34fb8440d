package com.astrazeneca.viralseq.data;

/**
 * Role of the sequences in collection: nucleotide or amino acid.
 */
public enum SequenceType {
    NT,
    AA;

    /**
     * Parses sequence type from command line value ("nt" or "aa", case insensitive).
     * @param value string value
     * @return parsed type
     */
    public static SequenceType fromString(String value) {
        switch (value.toLowerCase()) {
            case "nt": return NT;
            case "aa": return AA;
            default: throw new IllegalArgumentException("Sequence type must be \"nt\" or \"aa\", was: " + value);
        }
    }
}
