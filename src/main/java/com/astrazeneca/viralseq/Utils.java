package com.astrazeneca.viralseq;

import com.astrazeneca.viralseq.exception.DegenerateInputException;
import htsjdk.samtools.util.SequenceUtil;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class Utils {
    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);

    private Utils() {
    }

    /**
     * Method creates string from arguments by appending them with specified delimiter
     * @param delim specified delimiter
     * @param args array of arguments
     * @return generated string
     */
    public static String join(String delim, Object... args) {
        if (args.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            sb.append(args[i]);
            if (i + 1 != args.length) {
                sb.append(delim);
            }
        }
        return sb.toString();
    }

    /**
     * Method counts occurrences of each element of the collection.
     * @param elements any collection
     * @param <E> generic type of collection elements
     * @return map element to count, keys are in the order of first appearance
     */
    public static <E> Map<E, Integer> countFrequencies(Collection<E> elements) {
        Map<E, Integer> counts = new LinkedHashMap<>();
        for (E element : elements) {
            counts.merge(element, 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Method collects symbols of all sequences at the specified alignment column.
     * @param sequences aligned sequences
     * @param position 0-based column
     * @return list of symbols in the order of sequences
     */
    public static List<Character> column(Collection<String> sequences, int position) {
        List<Character> symbols = new ArrayList<>(sequences.size());
        for (String sequence : sequences) {
            symbols.add(sequence.charAt(position));
        }
        return symbols;
    }

    /**
     * Number of positions where two sequences differ. Positions past the end of the shorter sequence are
     * counted as differences.
     * @param first first sequence
     * @param second second sequence
     * @return distance between sequences
     */
    public static int hammingDistance(String first, String second) {
        int common = Math.min(first.length(), second.length());
        int distance = Math.abs(first.length() - second.length());
        for (int i = 0; i < common; i++) {
            if (first.charAt(i) != second.charAt(i)) {
                distance++;
            }
        }
        return distance;
    }

    /**
     * Method formats value for output: integer values are printed without decimals, trailing zeros are removed.
     * NaN and infinite values are printed as is.
     * @param pattern DecimalFormat pattern
     * @param value double value to print
     * @return formatted value
     */
    public static String getRoundedValueToPrint(String pattern, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        if (value == Math.round(value)) {
            return new DecimalFormat("0", SYMBOLS).format(value);
        }
        String formatted = new DecimalFormat(pattern, SYMBOLS).format(value);
        return formatted.indexOf('.') >= 0 ? formatted.replaceAll("\\.?0+$", "") : formatted;
    }

    public static String reverseComplement(String sequence) {
        return SequenceUtil.reverseComplement(sequence);
    }

    /**
     * Checks that all sequences have the same length and returns this length.
     * @param sequences sequences of alignment
     * @param statistic name of the statistic requiring alignment (for the error message)
     * @param title title of the collection (for the error message)
     * @return alignment length, 0 for empty collection
     */
    public static int alignmentLength(Collection<String> sequences, String statistic, String title) {
        int length = -1;
        for (String sequence : sequences) {
            if (length == -1) {
                length = sequence.length();
            } else if (length != sequence.length()) {
                throw new DegenerateInputException(statistic, title,
                        "sequences have different lengths (" + length + " and " + sequence.length()
                                + "), an alignment is required");
            }
        }
        return Math.max(length, 0);
    }
}
