package com.astrazeneca.viralseq.data.poisson;

import org.testng.Assert;
import org.testng.annotations.Test;

public class PoissonModelTest {

    @Test
    public void testProbabilities() {
        double[] probabilities = new PoissonModel(2.0).probabilities(3);
        Assert.assertEquals(probabilities.length, 4);
        Assert.assertEquals(probabilities[0], Math.exp(-2), 1e-12);
        Assert.assertEquals(probabilities[1], 2 * Math.exp(-2), 1e-12);
        Assert.assertEquals(probabilities[2], 2 * Math.exp(-2), 1e-12);
        Assert.assertEquals(probabilities[3], 4.0 / 3 * Math.exp(-2), 1e-12);
    }

    @Test
    public void testZeroRate() {
        PoissonModel model = new PoissonModel(0);
        Assert.assertEquals(model.probability(0), 1.0);
        Assert.assertEquals(model.probability(1), 0.0);
        double[] probabilities = model.probabilities(2);
        Assert.assertEquals(probabilities.length, 3);
        Assert.assertEquals(probabilities[0], 1.0);
        Assert.assertEquals(probabilities[2], 0.0);
    }

    @Test
    public void testNegativeEventsHaveZeroProbability() {
        Assert.assertEquals(new PoissonModel(1.5).probability(-1), 0.0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeRate() {
        new PoissonModel(-0.1);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNaNRate() {
        new PoissonModel(Double.NaN);
    }
}
