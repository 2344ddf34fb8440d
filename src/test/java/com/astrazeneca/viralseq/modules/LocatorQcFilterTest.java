package com.astrazeneca.viralseq.modules;

import com.astrazeneca.viralseq.data.CoordinateRange;
import com.astrazeneca.viralseq.data.LocatorResult;
import com.astrazeneca.viralseq.data.LocatorResult.Direction;
import com.astrazeneca.viralseq.data.ReferenceGenome;
import com.astrazeneca.viralseq.data.SequenceCollection;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class LocatorQcFilterTest {
    private SequenceLocator locator;
    private SequenceCollection collection;

    @BeforeMethod
    public void setUp() {
        locator = mock(SequenceLocator.class);
        when(locator.locateForward("AAAA", ReferenceGenome.HXB2)).thenReturn(location(100, 200, false));
        when(locator.locateForward("CCCC", ReferenceGenome.HXB2)).thenReturn(location(101, 200, true));
        when(locator.locateForward("GGGG", ReferenceGenome.HXB2)).thenReturn(location(150, 200, false));
        when(locator.locateForward("TTTT", ReferenceGenome.HXB2)).thenReturn(location(100, 250, false));

        Map<String, String> dna = new LinkedHashMap<>();
        dna.put("s1", "AAAA");
        dna.put("s2", "CCCC");
        dna.put("s3", "GGGG");
        dna.put("s4", "TTTT");
        dna.put("s5", "AAAA");
        collection = new SequenceCollection(dna, "qc");
    }

    private static LocatorResult location(int start, int end, boolean indel) {
        return new LocatorResult(start, end, 99.0, indel, Direction.FORWARD, "", "");
    }

    @Test
    public void testFilterAllowingIndels() {
        SequenceCollection passed = new LocatorQcFilter(locator).filter(collection,
                new CoordinateRange(100, 110), CoordinateRange.single(200), true, ReferenceGenome.HXB2);
        Assert.assertEquals(passed.getDna().keySet(), new LinkedHashSet<>(Arrays.asList("s1", "s2", "s5")));
        Assert.assertEquals(passed.getTitle(), "qc");
    }

    @Test
    public void testFilterWithoutIndels() {
        SequenceCollection passed = new LocatorQcFilter(locator).filter(collection,
                new CoordinateRange(100, 110), CoordinateRange.single(200), false, ReferenceGenome.HXB2);
        Assert.assertEquals(passed.getDna().keySet(), new LinkedHashSet<>(Arrays.asList("s1", "s5")));
    }

    @Test
    public void testIdenticalSequencesAreLocatedOnce() {
        new LocatorQcFilter(locator).filter(collection, new CoordinateRange(1, 1000), new CoordinateRange(1, 1000),
                true, ReferenceGenome.HXB2);
        verify(locator, times(1)).locateForward("AAAA", ReferenceGenome.HXB2);
        verify(locator, times(4)).locateForward(anyString(), eq(ReferenceGenome.HXB2));
    }
}
