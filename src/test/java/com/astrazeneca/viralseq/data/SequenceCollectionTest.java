package com.astrazeneca.viralseq.data;

import com.astrazeneca.viralseq.exception.DegenerateInputException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class SequenceCollectionTest {

    @Test
    public void testFromArray() {
        SequenceCollection collection = SequenceCollection.fromArray(Arrays.asList("AAA", "CCC"), "s");
        Map<String, String> expected = new LinkedHashMap<>();
        expected.put("s_1", "AAA");
        expected.put("s_2", "CCC");
        Assert.assertEquals(collection.getDna(), expected);
        Assert.assertEquals(collection.getTitle(), "s");
        Assert.assertEquals(collection.size(), 2);
    }

    @Test
    public void testSubKeepsOrderOfKeysAndSkipsMissing() {
        SequenceCollection collection = SequenceCollection.fromArray(Arrays.asList("AAA", "CCC", "GGG"), "s");
        collection.translate(0);
        SequenceCollection sub = collection.sub(Arrays.asList("s_3", "missing", "s_1"));
        Assert.assertEquals(sub.getDna().keySet().toArray(), new Object[] {"s_3", "s_1"});
        Assert.assertEquals(sub.getAa().get("s_3"), "G");
        Assert.assertEquals(sub.getTitle(), "s");
    }

    @Test
    public void testUniq() {
        SequenceCollection collection = SequenceCollection.fromArray(Arrays.asList("AAA", "CCC", "AAA"), "s");
        SequenceCollection unique = collection.uniq("seq");
        Map<String, String> expected = new LinkedHashMap<>();
        expected.put("seq_1_2", "AAA");
        expected.put("seq_2_1", "CCC");
        Assert.assertEquals(unique.getDna(), expected);
        Assert.assertEquals(unique.getTitle(), "s_uniq");
    }

    @Test
    public void testTranslateReplacesAminoAcids() {
        SequenceCollection collection = SequenceCollection.fromArray(Arrays.asList("ATGTAA", "ATGTGGGC"), "s");
        collection.translate(0);
        Assert.assertEquals(collection.getAa().get("s_1"), "M*");
        Assert.assertEquals(collection.getAa().get("s_2"), "MW");
        collection.translate(1);
        Assert.assertEquals(collection.getAa().get("s_1"), "C");
    }

    @Test
    public void testStopCodon() {
        SequenceCollection collection = SequenceCollection.fromArray(Arrays.asList("ATGTAA", "ATGTGG"), "s");
        SequenceSplit split = collection.stopCodon(0);
        Assert.assertEquals(split.selected.getDna().keySet(), Collections.singleton("s_1"));
        Assert.assertEquals(split.selected.getTitle(), "s_stop");
        Assert.assertEquals(split.remaining.getDna().keySet(), Collections.singleton("s_2"));
        Assert.assertEquals(split.remaining.getTitle(), "s");
    }

    @Test
    public void testGapStrip() {
        SequenceCollection collection = SequenceCollection.fromArray(Arrays.asList("A-CG", "AT-G", "ATCG"), "s");
        SequenceCollection stripped = collection.gapStrip(SequenceType.NT);
        Assert.assertEquals(stripped.getDna().values().toArray(), new Object[] {"AG", "AG", "AG"});
        Assert.assertEquals(stripped.getTitle(), "s_strip");
        Assert.assertEquals(collection.getDna().get("s_1"), "A-CG");
    }

    @Test
    public void testGapStripEnds() {
        SequenceCollection collection = SequenceCollection.fromArray(
                Arrays.asList("--ACG-", "-TA-GT", "ATACGT"), "s");
        SequenceCollection stripped = collection.gapStripEnds(SequenceType.NT);
        Assert.assertEquals(stripped.getDna().values().toArray(), new Object[] {"ACG", "A-G", "ACG"});
    }

    @Test(expectedExceptions = DegenerateInputException.class)
    public void testGapStripOfUnalignedSequences() {
        SequenceCollection.fromArray(Arrays.asList("A-GT", "AC"), "s").gapStrip(SequenceType.NT);
    }

    @Test(expectedExceptions = DegenerateInputException.class)
    public void testGapStripEndsOfUnalignedSequences() {
        SequenceCollection.fromArray(Arrays.asList("-AGT", "AC"), "s").gapStripEnds(SequenceType.NT);
    }

    @Test
    public void testGapStripAminoAcidsKeepsNucleotides() {
        SequenceCollection collection = SequenceCollection.fromArray(Arrays.asList("ATG---TGG", "ATGTGGTGG"), "s");
        collection.translate(0);
        SequenceCollection stripped = collection.gapStrip(SequenceType.AA);
        Assert.assertEquals(stripped.getAa().values().toArray(), new Object[] {"MW", "MW"});
        Assert.assertEquals(stripped.getDna(), collection.getDna());
    }

    @Test
    public void testRelaxedPhylip() {
        SequenceCollection collection = SequenceCollection.fromArray(
                Arrays.asList("ACGTACGTACGTA", "ACGTACGTACGTT"), "s");
        String expected = " 2 13\n"
                + "s_1         ACGTACGTAC GTA\n"
                + "s_2         ACGTACGTAC GTT\n";
        Assert.assertEquals(collection.toRelaxedPhylip(), expected);
    }

    @Test
    public void testCollectionDoesNotAliasSourceMap() {
        Map<String, String> source = new LinkedHashMap<>();
        source.put("a", "ACGT");
        SequenceCollection collection = new SequenceCollection(source, "t");
        source.put("b", "TTTT");
        Assert.assertEquals(collection.size(), 1);
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testSequencesAreReadOnly() {
        SequenceCollection collection = SequenceCollection.fromArray(Collections.singletonList("ACGT"));
        collection.getDna().put("x", "A");
    }
}
