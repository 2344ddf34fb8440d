package com.astrazeneca.viralseq.modules;

import java.util.HashMap;
import java.util.Map;

/**
 * Translation of nucleotide sequences with the standard genetic code.
 */
public final class Translator {
    private static final String BASES = "TCAG";
    private static final String AMINO_ACIDS = "FFLLSSSSYY**CC*WLLLLPPPPHHQQRRRRIIIMTTTTNNKKSSRRVVVVAAAADDEEGGGG";
    private static final Map<String, Character> CODON_TABLE = new HashMap<>();

    static {
        int index = 0;
        for (char first : BASES.toCharArray()) {
            for (char second : BASES.toCharArray()) {
                for (char third : BASES.toCharArray()) {
                    CODON_TABLE.put("" + first + second + third, AMINO_ACIDS.charAt(index++));
                }
            }
        }
    }

    private Translator() {
    }

    /**
     * Translates nucleotide sequence starting from the reading frame. Trailing incomplete codon is ignored.
     * @param sequence nucleotide sequence
     * @param codonPosition reading frame, 0, 1 or 2
     * @return amino acid sequence, '-' for gap codons and 'X' for codons with ambiguous bases
     */
    public static String translate(String sequence, int codonPosition) {
        if (codonPosition < 0 || codonPosition > 2) {
            throw new IllegalArgumentException("Codon position must be 0, 1 or 2, was: " + codonPosition);
        }
        String upper = sequence.toUpperCase();
        StringBuilder protein = new StringBuilder(upper.length() / 3);
        for (int i = codonPosition; i + 3 <= upper.length(); i += 3) {
            protein.append(translateCodon(upper.substring(i, i + 3)));
        }
        return protein.toString();
    }

    public static char translateCodon(String codon) {
        if ("---".equals(codon)) {
            return '-';
        }
        Character aminoAcid = CODON_TABLE.get(codon);
        return aminoAcid == null ? 'X' : aminoAcid;
    }
}
