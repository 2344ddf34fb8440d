package com.astrazeneca.viralseq.data.poisson;

import org.apache.commons.math3.distribution.PoissonDistribution;

import java.util.Locale;

/**
 * Poisson distribution with rate lambda. Zero rate is allowed and gives all the probability mass to 0.
 */
public class PoissonModel {
    private final PoissonDistribution distribution;

    public PoissonModel(double lambda) {
        if (Double.isNaN(lambda) || Double.isInfinite(lambda) || lambda < 0) {
            throw new IllegalArgumentException(String.format(Locale.US,
                    "Poisson rate must be a finite non-negative number, was: %f", lambda));
        }
        this.distribution = lambda > 0 ? new PoissonDistribution(null, lambda,
                PoissonDistribution.DEFAULT_EPSILON, PoissonDistribution.DEFAULT_MAX_ITERATIONS) : null;
    }

    /**
     * Probability mass function.
     * @param k number of events
     * @return P(X = k)
     */
    public double probability(int k) {
        if (k < 0) {
            return 0.0;
        }
        if (distribution == null) {
            return k == 0 ? 1.0 : 0.0;
        }
        return distribution.probability(k);
    }

    /**
     * Probability mass function on the support 0..maxK.
     * @param maxK the last value of support
     * @return array where element k is P(X = k)
     */
    public double[] probabilities(int maxK) {
        double[] result = new double[Math.max(maxK, -1) + 1];
        for (int k = 0; k < result.length; k++) {
            result[k] = probability(k);
        }
        return result;
    }
}
