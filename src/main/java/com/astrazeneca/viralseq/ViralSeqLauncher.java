package com.astrazeneca.viralseq;

import com.astrazeneca.viralseq.data.ReferenceResource;
import com.astrazeneca.viralseq.data.SequenceCollection;
import com.astrazeneca.viralseq.data.scopedata.GlobalReadOnlyScope;
import com.astrazeneca.viralseq.modes.*;
import com.astrazeneca.viralseq.modules.MuscleAligner;
import com.astrazeneca.viralseq.modules.SequenceFileParser;

import java.time.LocalDateTime;

import static com.astrazeneca.viralseq.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Class starts the ViralSeq for current run
 */
public class ViralSeqLauncher {
    private final ReferenceResource referenceResource;

    public ViralSeqLauncher(ReferenceResource referenceResource) {
        this.referenceResource = referenceResource;
    }

    /**
     * Reads sequences, aligns them if needed and starts the mode of the analysis set in configuration.
     * @param config starting configuration
     */
    public void start(Configuration config) {
        GlobalReadOnlyScope.init(config);
        final Configuration conf = instance().conf;

        if (conf.y) {
            System.err.println("TIME: Start reading " + conf.input + ": " + LocalDateTime.now());
        }
        SequenceCollection collection = new SequenceFileParser().read(conf.input, conf.sequenceType);
        if (conf.align) {
            if (conf.y) {
                System.err.println("TIME: Start aligning " + collection.size() + " sequences: " + LocalDateTime.now());
            }
            collection = new MuscleAligner(conf.muscle).align(collection, conf.sequenceType);
        }

        if (conf.y) {
            System.err.println("TIME: Start " + conf.analysisType.getOption() + ": " + LocalDateTime.now());
        }
        try {
            createMode(conf.analysisType, collection).start();
        } catch (RuntimeException e) {
            System.err.println("Critical exception occurs on collection \"" + collection.getTitle() + "\" ("
                    + conf.input + "), program will be stopped.");
            throw e;
        }
        if (conf.y) {
            System.err.println("TIME: Finish: " + LocalDateTime.now());
        }
    }

    /**
     * Factory method for the mode of analysis type.
     * @param type analysis type
     * @param collection loaded sequences
     * @return mode running the analysis
     */
    AbstractMode createMode(AnalysisType type, SequenceCollection collection) {
        switch (type) {
            case CONSENSUS:
                return new ConsensusMode(collection);
            case A3G:
                return new HypermutationMode(collection);
            case PM:
                return new PoissonCutoffMode(collection);
            case PI:
            case TN93:
            case ENTROPY:
                return new DiversityMode(collection, type);
            case LOCATOR:
            case QC:
                return new LocatorMode(collection, referenceResource, new MuscleAligner(instance().conf.muscle), type);
            case COLLAPSE:
            case PID:
                return new CollapseMode(collection, type);
            default:
                return new TransformMode(collection, type);
        }
    }
}
