package com.astrazeneca.viralseq.data.fishertest;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.List;

public class FisherExactTest {

    @DataProvider(name = "counts")
    public Object[][] counts() {
        return new Object[][]{
                { new FisherExact(121, 55, 18, 23), 0.00378, 0.99908, 0.00287 },
                { new FisherExact(37, 76, 1, 1), 1.0, 0.55362, 0.89275 },
                { new FisherExact(0, 0, 0, 0), 1.0, 1.0, 1.0 },
                { new FisherExact(0, 1, 1, 0), 1.0, 0.5, 1.0 },
                { new FisherExact(1, 1, 1, 1), 1.0, 0.83333, 0.83333 },
                { new FisherExact(10, 10, 10, 1), 0.04722, 0.02599, 0.99802 },
                { new FisherExact(10, 10, 10, 0), 0.01099, 0.00615, 1.0 },
                { new FisherExact(83, 40, 1, 2), 0.25746, 0.96473, 0.25746 },
                { new FisherExact(60, 62, 2, 0), 0.49593, 0.24797, 1.0 },
        };
    }

    @Test(dataProvider = "counts")
    public void test_fexact(FisherExact fisherExact, double pValue, double pValueLess, double pValueGreater) {
        Assert.assertEquals(fisherExact.getPValue(), pValue, 0.000005);
        Assert.assertEquals(fisherExact.getPValueLess(), pValueLess, 0.000005);
        Assert.assertEquals(fisherExact.getPValueGreater(), pValueGreater, 0.000005);
    }

    /**
     * G to A mutation tables [[b - a, a], [d - c, c]] of hypermutated sequences with p-values of R fisher.test
     */
    @DataProvider(name = "hypermutationTables")
    public Object[][] hypermutationTables() {
        return new Object[][]{
                { 23, 68, 1, 54, 4.308329383113039e-06 },
                { 45, 68, 9, 54, 5.214357197159082e-08 },
                { 4, 35, 0, 51, 0.024656766601288876 },
                { 4, 35, 1, 51, 0.15344873538396353 },
        };
    }

    @Test(dataProvider = "hypermutationTables")
    public void testTwoSidedPValueOfMutationTable(int a, int b, int c, int d, double expected) {
        double pValue = new FisherExact(b - a, a, d - c, c).getPValue();
        Assert.assertEquals(pValue, expected, expected * 1e-6);
    }

    @Test
    public void testDensitySumsToOne() {
        List<Double> density = new FisherExact(11, 12, 1, 2).getDensity();
        double sum = 0;
        for (double value : density) {
            sum += value;
        }
        Assert.assertEquals(density.size(), 4);
        Assert.assertEquals(sum, 1.0, 1e-12);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeCount() {
        new FisherExact(1, -1, 2, 3);
    }
}
