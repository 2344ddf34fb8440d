package com.astrazeneca.viralseq;

import com.astrazeneca.viralseq.exception.DegenerateInputException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

public class UtilsTest {

    @DataProvider(name = "distances")
    public Object[][] distances() {
        return new Object[][]{
                { "ACGT", "ACGT", 0 },
                { "ACGT", "ACCA", 2 },
                { "ACGT", "AC-T", 1 },
                { "ACGT", "AC", 2 },
                { "", "", 0 },
        };
    }

    @Test(dataProvider = "distances")
    public void testHammingDistance(String first, String second, int expected) {
        Assert.assertEquals(Utils.hammingDistance(first, second), expected);
        Assert.assertEquals(Utils.hammingDistance(second, first), expected);
    }

    @DataProvider(name = "roundedValues")
    public Object[][] roundedValues() {
        return new Object[][]{
                { "0.00", 100.0, "100" },
                { "0.00", 83.333333, "83.33" },
                { "0.00", 0.001, "0" },
                { "0.00", 0.5, "0.5" },
                { "0.0000", Math.log(2), "0.6931" },
                { "0.00", Double.NaN, "NaN" },
                { "0.00", Double.POSITIVE_INFINITY, "Infinity" },
        };
    }

    @Test(dataProvider = "roundedValues")
    public void testGetRoundedValueToPrint(String pattern, double value, String expected) {
        Assert.assertEquals(Utils.getRoundedValueToPrint(pattern, value), expected);
    }

    @Test
    public void testJoin() {
        Assert.assertEquals(Utils.join("\t", "a", 1, 2.5, true), "a\t1\t2.5\ttrue");
        Assert.assertEquals(Utils.join(","), "");
    }

    @Test
    public void testCountFrequenciesKeepsFirstAppearanceOrder() {
        Map<String, Integer> counts = Utils.countFrequencies(Arrays.asList("b", "a", "b", "c", "a", "b"));
        Assert.assertEquals(counts.keySet().toString(), "[b, a, c]");
        Assert.assertEquals(counts.get("b"), Integer.valueOf(3));
    }

    @Test
    public void testColumn() {
        Assert.assertEquals(Utils.column(Arrays.asList("ACG", "TTT"), 1), Arrays.asList('C', 'T'));
    }

    @Test
    public void testReverseComplement() {
        Assert.assertEquals(Utils.reverseComplement("AACCGT"), "ACGGTT");
    }

    @Test
    public void testAlignmentLength() {
        Assert.assertEquals(Utils.alignmentLength(Arrays.asList("ACG", "TTT"), "pi", "t"), 3);
        Assert.assertEquals(Utils.alignmentLength(Collections.emptyList(), "pi", "t"), 0);
    }

    @Test(expectedExceptions = DegenerateInputException.class,
            expectedExceptionsMessageRegExp = "Nucleotide diversity is undefined for the collection \"t\".*")
    public void testAlignmentLengthOfUnalignedSequences() {
        Utils.alignmentLength(Arrays.asList("ACG", "TT"), "Nucleotide diversity", "t");
    }
}
