package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.SequenceCollection;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

public class SequenceCollapserTest {
    private final SequenceCollapser collapser = new SequenceCollapser();

    @Test
    public void testCollapse() {
        SequenceCollection collection = SequenceCollection.fromArray(Arrays.asList(
                "AAAA", "TTTT", "AAAT", "AAAA", "TTTA", "AAAA", "TTTT", "TTTA"), "sample");

        SequenceCollection collapsed = collapser.collapse(collection);

        Map<String, String> expected = new LinkedHashMap<>();
        expected.put("seq_1_3", "AAAA");
        expected.put("seq_2_2", "TTTT");
        Assert.assertEquals(collapsed.getDna(), expected);
        Assert.assertEquals(collapsed.getTitle(), "sample_collapse");
    }

    @Test
    public void testCollapseWithZeroCutoffKeepsDistinctSequences() {
        SequenceCollection collection = SequenceCollection.fromArray(Arrays.asList("AAAA", "AAAT", "AAAA"));
        SequenceCollection collapsed = collapser.collapse(collection, 0);
        Assert.assertEquals(collapsed.getDna().get("seq_1_2"), "AAAA");
        Assert.assertEquals(collapsed.getDna().get("seq_2_1"), "AAAT");
        Assert.assertEquals(collapsed.size(), 2);
    }

    @Test
    public void testCollapseKeepsFirstOnEqualFrequencies() {
        SequenceCollection collection = SequenceCollection.fromArray(Arrays.asList("AAAT", "AAAA"));
        Assert.assertEquals(collapser.collapse(collection).getDna().get("seq_1_1"), "AAAT");
    }

    @Test
    public void testFilterSimilarPid() {
        Map<String, String> dna = new LinkedHashMap<>();
        dna.put("AAAAAAAA_50_r1", "ACGTACGT");
        dna.put("AAAAAAAT_3_r1", "ACGTACGT");
        dna.put("AAAAAAAT_3_r2", "ACGTACGA");
        dna.put("GGGGGGGG_20", "TTTTCCCC");
        dna.put("GGGGGGGA_2", "TTTTCCCC");
        dna.put("TTTTTTTT_4", "GGGGAAAA");
        dna.put("TTTTTTTA_1", "GGGGAAAA");
        dna.put("untagged", "ACGTACGT");
        SequenceCollection collection = new SequenceCollection(dna, "pid");

        SequenceCollection filtered = collapser.filterSimilarPid(collection);

        Assert.assertEquals(filtered.getDna().keySet(), new LinkedHashSet<>(Arrays.asList(
                "AAAAAAAA_50_r1", "GGGGGGGG_20", "TTTTTTTT_4", "TTTTTTTA_1", "untagged")));
    }

    @Test
    public void testFilterSimilarPidWithLowCutoff() {
        Map<String, String> dna = new LinkedHashMap<>();
        dna.put("TTTTTTTT_4", "GGGGAAAA");
        dna.put("TTTTTTTA_1", "GGGGAAAA");
        SequenceCollection filtered = collapser.filterSimilarPid(new SequenceCollection(dna, "pid"), 4);
        Assert.assertEquals(filtered.getDna().keySet(), Collections.singleton("TTTTTTTT_4"));
    }
}
