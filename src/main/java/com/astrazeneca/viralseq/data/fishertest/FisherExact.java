package com.astrazeneca.viralseq.data.fishertest;

import org.apache.commons.math3.distribution.HypergeometricDistribution;

import java.util.ArrayList;
import java.util.List;

/**
 * Implementation of Fisher's exact test for 2x2 contingency table as it is implemented in R (fisher.test).
 * <p>
 * The table is
 * <pre>
 *     | n11 n12 |
 *     | n21 n22 |
 * </pre>
 * Conditionally on the margins, n11 follows the central hypergeometric distribution. Two-sided p-value is the
 * sum of probabilities of all tables that are not more probable than the observed one (with R's relative
 * tolerance 1e-7).
 * <p>
 * The object is immutable, all p-values are calculated in constructor.
 */
public class FisherExact {
    private static final double RELATIVE_ERROR = 1 + 1E-7;

    private final int m;
    private final int n;
    private final int k;
    private final int x;
    private final int lo;
    private final List<Integer> support;
    private final List<Double> density;

    private final double pValueLess;
    private final double pValueGreater;
    private final double pValueTwoSided;

    public FisherExact(int n11, int n12, int n21, int n22) {
        if (n11 < 0 || n12 < 0 || n21 < 0 || n22 < 0) {
            throw new IllegalArgumentException("Contingency table counts can't be negative: ["
                    + n11 + ", " + n12 + "], [" + n21 + ", " + n22 + "]");
        }
        m = n11 + n12;
        n = n21 + n22;
        k = n11 + n21;
        x = n11;
        lo = Math.max(0, k - n);
        int hi = Math.min(k, m);
        support = new ArrayList<>();
        for (int j = lo; j <= hi; j++) {
            support.add(j);
        }
        density = densityOnSupport();

        pValueLess = pnhyper(x, false);
        pValueGreater = pnhyper(x, true);
        pValueTwoSided = twoSided();
    }

    // Density of the central hypergeometric distribution on its support, normalized to sum 1.
    private List<Double> densityOnSupport() {
        List<Double> logdc = new ArrayList<>();
        if (m + n == 0) {
            logdc.add(0.0);
        } else {
            // m + n - population, m - number of successes (first row), k - sample size (first column)
            HypergeometricDistribution dhyper = new HypergeometricDistribution(null, m + n, m, k);
            for (int element : support) {
                double value = dhyper.logProbability(element);
                logdc.add(Double.isNaN(value) ? 0.0 : value);
            }
        }
        double max = Double.NEGATIVE_INFINITY;
        for (double value : logdc) {
            max = Math.max(max, value);
        }
        List<Double> result = new ArrayList<>();
        double sum = 0.0;
        for (double value : logdc) {
            double exp = Math.exp(value - max);
            result.add(exp);
            sum += exp;
        }
        for (int i = 0; i < result.size(); i++) {
            result.set(i, result.get(i) / sum);
        }
        return result;
    }

    private double twoSided() {
        double observed = density.get(x - lo) * RELATIVE_ERROR;
        double sum = 0.0;
        for (double probability : density) {
            if (probability <= observed) {
                sum += probability;
            }
        }
        return Math.min(sum, 1.0);
    }

    private double pnhyper(int q, boolean upperTail) {
        if (m + n == 0) {
            return 1.0;
        }
        HypergeometricDistribution dhyper = new HypergeometricDistribution(null, m + n, m, k);
        return upperTail ? dhyper.upperCumulativeProbability(q) : dhyper.cumulativeProbability(q);
    }

    /**
     * @return two-sided p-value
     */
    public double getPValue() {
        return pValueTwoSided;
    }

    /**
     * @return p-value for alternative "less" (odds ratio is less than 1)
     */
    public double getPValueLess() {
        return pValueLess;
    }

    /**
     * @return p-value for alternative "greater" (odds ratio is greater than 1)
     */
    public double getPValueGreater() {
        return pValueGreater;
    }

    public List<Double> getDensity() {
        return new ArrayList<>(density);
    }
}
