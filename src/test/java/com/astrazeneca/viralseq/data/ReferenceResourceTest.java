package com.astrazeneca.viralseq.data;

import com.astrazeneca.viralseq.exception.SequenceInputException;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.File;
import java.util.EnumSet;

public class ReferenceResourceTest {
    private ReferenceResource referenceResource;

    @BeforeMethod
    public void setUp() {
        String directory = new File(getClass().getResource("/references").getPath()).getPath();
        referenceResource = new ReferenceResource(directory);
    }

    @Test
    public void testLoadsReferencesFromDirectory() {
        Assert.assertEquals(referenceResource.getAvailableGenomes(),
                EnumSet.of(ReferenceGenome.HXB2, ReferenceGenome.NL43));
        Assert.assertEquals(referenceResource.getSequence(ReferenceGenome.HXB2), "AAAACCCCGGGGTTTT");
        Assert.assertEquals(referenceResource.getSequence(ReferenceGenome.NL43), "ACGTACGTACGTACGTACGT");
    }

    @Test(expectedExceptions = SequenceInputException.class)
    public void testMissingReference() {
        referenceResource.getSequence(ReferenceGenome.MAC239);
    }

    @Test
    public void testMissingDirectoryHasNoReferences() {
        Assert.assertTrue(new ReferenceResource("/not/existing/directory").getAvailableGenomes().isEmpty());
    }
}
