package com.astrazeneca.viralseq.data;

import java.util.Objects;

/**
 * APOBEC3G/F hypermutation statistics of one sequence.
 */
public class HypermutationRecord {
    /**
     * Sequence name
     */
    public final String name;

    /**
     * G to A mutations at APOBEC3G/F (GRD) positions
     */
    public final int motifMutations;

    /**
     * Non-gap APOBEC3G/F positions in the sequence
     */
    public final int motifSites;

    /**
     * G to A mutations at control positions
     */
    public final int controlMutations;

    /**
     * Non-gap control positions in the sequence
     */
    public final int controlSites;

    /**
     * Mutation rate at APOBEC3G/F positions divided by mutation rate at control positions.
     * NaN or Infinity when one of the rates is undefined or zero.
     */
    public final double rateRatio;

    /**
     * Two-sided p-value of Fisher's exact test
     */
    public final double pValue;

    public final boolean hypermutated;

    public HypermutationRecord(String name, int motifMutations, int motifSites, int controlMutations,
                               int controlSites, double rateRatio, double pValue, boolean hypermutated) {
        this.name = name;
        this.motifMutations = motifMutations;
        this.motifSites = motifSites;
        this.controlMutations = controlMutations;
        this.controlSites = controlSites;
        this.rateRatio = rateRatio;
        this.pValue = pValue;
        this.hypermutated = hypermutated;
    }

    /**
     * Copy of the record classified as hypermutated.
     * @return new record
     */
    public HypermutationRecord asHypermutated() {
        return new HypermutationRecord(name, motifMutations, motifSites, controlMutations, controlSites,
                rateRatio, pValue, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HypermutationRecord that = (HypermutationRecord) o;
        return motifMutations == that.motifMutations &&
                motifSites == that.motifSites &&
                controlMutations == that.controlMutations &&
                controlSites == that.controlSites &&
                Double.compare(that.rateRatio, rateRatio) == 0 &&
                Double.compare(that.pValue, pValue) == 0 &&
                hypermutated == that.hypermutated &&
                Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, motifMutations, motifSites, controlMutations, controlSites, rateRatio, pValue,
                hypermutated);
    }

    @Override
    public String toString() {
        return "HypermutationRecord [name=" + name + ", a=" + motifMutations + ", b=" + motifSites
                + ", c=" + controlMutations + ", d=" + controlSites + ", rr=" + rateRatio + ", p=" + pValue
                + ", hypermutated=" + hypermutated + "]";
    }
}
