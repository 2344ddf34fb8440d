package com.astrazeneca.viralseq;

import com.astrazeneca.viralseq.data.ReferenceResource;
import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.data.SequenceType;
import com.astrazeneca.viralseq.data.scopedata.GlobalReadOnlyScope;
import com.astrazeneca.viralseq.exception.AlignmentUnavailableException;
import com.astrazeneca.viralseq.exception.SequenceInputException;
import com.astrazeneca.viralseq.modes.*;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Collections;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class ViralSeqLauncherTest {
    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private ViralSeqLauncher launcher;

    @BeforeMethod
    public void setUp() {
        originalOut = System.out;
        System.setOut(new PrintStream(outContent));
        launcher = new ViralSeqLauncher(new ReferenceResource(getClass().getResource("/references").getPath()));
    }

    @AfterMethod
    public void cleanUp() {
        System.setOut(originalOut);
        outContent.reset();
        GlobalReadOnlyScope.clear();
    }

    private Configuration config(AnalysisType type) {
        Configuration config = new Configuration();
        config.input = getClass().getResource("/sequences/sample.fasta").getPath();
        config.analysisType = type;
        return config;
    }

    @Test
    public void testConsensus() {
        launcher.start(config(AnalysisType.CONSENSUS));
        assertEquals(outContent.toString().split("\\R"), new String[] {">sample_consensus", "ACGTACGTAC"});
    }

    @Test
    public void testNucleotideDiversityWithHeader() {
        Configuration config = config(AnalysisType.PI);
        config.printHeader = true;
        launcher.start(config);
        assertEquals(outContent.toString().split("\\R"), new String[] {"title\tpi", "sample\t0.07143"});
    }

    @Test(expectedExceptions = SequenceInputException.class)
    public void testMissingInput() {
        Configuration config = config(AnalysisType.CONSENSUS);
        config.input = "/nonexistent/sample.fasta";
        launcher.start(config);
    }

    @Test(expectedExceptions = AlignmentUnavailableException.class)
    public void testAlignmentWithoutMuscle() {
        Configuration config = config(AnalysisType.CONSENSUS);
        config.align = true;
        config.muscle = "/nonexistent/bin/muscle";
        launcher.start(config);
    }

    @Test(expectedExceptions = AlignmentUnavailableException.class)
    public void testAminoAcidAlignmentWithoutMuscle() {
        Configuration config = config(AnalysisType.ENTROPY);
        config.sequenceType = SequenceType.AA;
        config.align = true;
        config.muscle = "/nonexistent/bin/muscle";
        launcher.start(config);
    }

    @Test
    public void testCreateMode() {
        GlobalReadOnlyScope.init(new Configuration());
        SequenceCollection collection = SequenceCollection.fromArray(Collections.singletonList("ACGT"));
        assertTrue(launcher.createMode(AnalysisType.CONSENSUS, collection) instanceof ConsensusMode);
        assertTrue(launcher.createMode(AnalysisType.A3G, collection) instanceof HypermutationMode);
        assertTrue(launcher.createMode(AnalysisType.PM, collection) instanceof PoissonCutoffMode);
        assertTrue(launcher.createMode(AnalysisType.TN93, collection) instanceof DiversityMode);
        assertTrue(launcher.createMode(AnalysisType.QC, collection) instanceof LocatorMode);
        assertTrue(launcher.createMode(AnalysisType.PID, collection) instanceof CollapseMode);
        assertTrue(launcher.createMode(AnalysisType.PHYLIP, collection) instanceof TransformMode);
    }
}
