package com.astrazeneca.viralseq.data;

/**
 * Reference genomes for the coordinate system of located sequences. Positions are reported as 1-based
 * inclusive coordinates on the reference sequence.
 */
public enum ReferenceGenome {
    HXB2("HIV-1 HXB2, GenBank K03455"),
    NL43("HIV-1 NL4-3, GenBank AF324493"),
    MAC239("SIV mac239, GenBank M33262");

    public static final ReferenceGenome DEFAULT = HXB2;

    private final String description;

    ReferenceGenome(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Name of the FASTA file of reference in the reference directory.
     * @return file name
     */
    public String getFileName() {
        return name() + ".fasta";
    }

    /**
     * Parses reference option. Unknown references are replaced with HXB2 with a warning.
     * @param value name of reference (case insensitive)
     * @return reference genome
     */
    public static ReferenceGenome fromString(String value) {
        if (value != null) {
            for (ReferenceGenome genome : values()) {
                if (genome.name().equalsIgnoreCase(value.trim())) {
                    return genome;
                }
            }
        }
        System.err.println("Reference option \"" + value + "\" is not recognized, " + DEFAULT.name()
                + " will be used as reference genome.");
        return DEFAULT;
    }
}
