package com.astrazeneca.viralseq.data;

import java.util.Objects;

/**
 * Pairwise alignment of query and reference: two strings of the same length with '-' for gaps.
 */
public class AlignmentResult {
    public final String alignedQuery;
    public final String alignedReference;

    public AlignmentResult(String alignedQuery, String alignedReference) {
        if (alignedQuery.length() != alignedReference.length()) {
            throw new IllegalArgumentException("Aligned query and reference must have the same length, were: "
                    + alignedQuery.length() + " and " + alignedReference.length());
        }
        this.alignedQuery = alignedQuery;
        this.alignedReference = alignedReference;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AlignmentResult that = (AlignmentResult) o;
        return Objects.equals(alignedQuery, that.alignedQuery) &&
                Objects.equals(alignedReference, that.alignedReference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alignedQuery, alignedReference);
    }
}
