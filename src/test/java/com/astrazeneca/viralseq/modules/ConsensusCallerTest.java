package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.exception.DegenerateInputException;
import com.astrazeneca.viralseq.exception.EmptyInputException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ConsensusCallerTest {
    private final ConsensusCaller consensusCaller = new ConsensusCaller();

    private static SequenceCollection diagonal() {
        List<String> sequences = new ArrayList<>();
        for (int k = 1; k <= 10; k++) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 10; i++) {
                sb.append(i < k ? 'A' : 'T');
            }
            sequences.add(sb.toString());
        }
        return SequenceCollection.fromArray(sequences, "diagonal");
    }

    @Test
    public void testDiagonalAtDefaultCutoff() {
        Assert.assertEquals(consensusCaller.consensus(diagonal()), "AAAAAWTTTT");
    }

    @Test
    public void testDiagonalAtStrictCutoff() {
        Assert.assertEquals(consensusCaller.consensus(diagonal(), 0.7), "AAAANNNTTT");
    }

    @Test
    public void testIdempotentOnUniformCollection() {
        SequenceCollection uniform = SequenceCollection.fromArray(Arrays.asList("ACGT-A", "ACGT-A", "ACGT-A"));
        String consensus = consensusCaller.consensus(uniform, 1.0);
        Assert.assertEquals(consensus, "ACGT-A");
        String again = consensusCaller.consensus(SequenceCollection.fromArray(Collections.singletonList(consensus)), 1.0);
        Assert.assertEquals(again, consensus);
    }

    @Test
    public void testGapsAreCountedAsSymbols() {
        SequenceCollection collection = SequenceCollection.fromArray(Arrays.asList("A-", "A-", "AC"));
        Assert.assertEquals(consensusCaller.consensus(collection), "A-");
    }

    @DataProvider(name = "ambiguities")
    public Object[][] ambiguities() {
        return new Object[][]{
                { Collections.singletonList('G'), 'G' },
                { Arrays.asList('T', 'A'), 'W' },
                { Arrays.asList('G', 'C'), 'S' },
                { Arrays.asList('C', 'A'), 'M' },
                { Arrays.asList('G', 'T'), 'K' },
                { Arrays.asList('G', 'A'), 'R' },
                { Arrays.asList('T', 'C'), 'Y' },
                { Arrays.asList('T', 'G', 'C'), 'B' },
                { Arrays.asList('A', 'T', 'G'), 'D' },
                { Arrays.asList('C', 'T', 'A'), 'H' },
                { Arrays.asList('G', 'C', 'A'), 'V' },
                { Arrays.asList('A', '-'), 'N' },
                { Arrays.asList('A', 'C', 'G', 'T'), 'N' },
                { Collections.emptyList(), 'N' },
        };
    }

    @Test(dataProvider = "ambiguities")
    public void testCallConsensusBase(List<Character> bases, char expected) {
        Assert.assertEquals(ConsensusCaller.callConsensusBase(bases), expected);
    }

    @Test(expectedExceptions = EmptyInputException.class)
    public void testEmptyCollection() {
        consensusCaller.consensus(SequenceCollection.fromArray(Collections.emptyList()));
    }

    @Test(expectedExceptions = DegenerateInputException.class)
    public void testUnalignedCollection() {
        consensusCaller.consensus(SequenceCollection.fromArray(Arrays.asList("ACGT", "ACG")));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testWrongCutoff() {
        consensusCaller.consensus(diagonal(), 0);
    }
}
