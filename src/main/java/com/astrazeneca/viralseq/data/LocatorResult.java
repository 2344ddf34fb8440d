package com.astrazeneca.viralseq.data;

import java.util.Objects;

/**
 * Location of the query sequence on the reference genome.
 */
public class LocatorResult {
    public enum Direction {
        FORWARD("+"),
        REVERSE("-");

        private final String symbol;

        Direction(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    /**
     * First reference position covered by the query (1-based)
     */
    public final int start;

    /**
     * Last reference position covered by the query (1-based, inclusive)
     */
    public final int end;

    /**
     * Percent of identical positions in the aligned part, 0-100
     */
    public final double similarity;

    public final boolean indel;
    public final Direction direction;
    public final String alignedQuery;
    public final String alignedReference;

    public LocatorResult(int start, int end, double similarity, boolean indel, Direction direction,
                         String alignedQuery, String alignedReference) {
        this.start = start;
        this.end = end;
        this.similarity = similarity;
        this.indel = indel;
        this.direction = direction;
        this.alignedQuery = alignedQuery;
        this.alignedReference = alignedReference;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LocatorResult that = (LocatorResult) o;
        return start == that.start &&
                end == that.end &&
                Double.compare(that.similarity, similarity) == 0 &&
                indel == that.indel &&
                direction == that.direction &&
                Objects.equals(alignedQuery, that.alignedQuery) &&
                Objects.equals(alignedReference, that.alignedReference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, similarity, indel, direction, alignedQuery, alignedReference);
    }

    @Override
    public String toString() {
        return "LocatorResult [start=" + start + ", end=" + end + ", similarity=" + similarity + ", indel=" + indel
                + ", direction=" + direction.getSymbol() + "]";
    }
}
