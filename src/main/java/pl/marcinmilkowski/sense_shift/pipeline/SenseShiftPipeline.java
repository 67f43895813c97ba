package pl.marcinmilkowski.sense_shift.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_shift.config.SenseShiftConfig;
import pl.marcinmilkowski.sense_shift.cooccurrence.AssociationMatrix;
import pl.marcinmilkowski.sense_shift.corpus.Corpus;
import pl.marcinmilkowski.sense_shift.corpus.Document;
import pl.marcinmilkowski.sense_shift.sampling.PartitionInitializer;
import pl.marcinmilkowski.sense_shift.sampling.SenseSampler;
import pl.marcinmilkowski.sense_shift.scoring.NoveltyScore;
import pl.marcinmilkowski.sense_shift.scoring.NoveltyScorer;
import pl.marcinmilkowski.sense_shift.scoring.WordSenseProfile;
import pl.marcinmilkowski.sense_shift.snapshot.CorpusSnapshotWriter;
import pl.marcinmilkowski.sense_shift.tagging.CorpusTokenizer;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs a full sense-shift analysis: load, partition, sample, snapshot, score.
 *
 * Any failure aborts the run with a {@link PipelineException} naming the stage.
 */
public class SenseShiftPipeline {

    private static final Logger log = LoggerFactory.getLogger(SenseShiftPipeline.class);

    private final SenseShiftConfig config;
    private final CorpusTokenizer tokenizer;
    private final SenseSampler sampler;
    private final CorpusSnapshotWriter snapshots;

    public SenseShiftPipeline(SenseShiftConfig config, CorpusTokenizer tokenizer, SenseSampler sampler,
                              Path snapshotDir) {
        this.config = config;
        this.tokenizer = tokenizer;
        this.sampler = sampler;
        this.snapshots = new CorpusSnapshotWriter(snapshotDir);
    }

    /**
     * Load both corpora and give every document its initial partition.
     */
    public Corpus prepare(Path reference, Path focus) throws PipelineException {
        Corpus corpus;
        try {
            corpus = Corpus.load(config, tokenizer, reference, focus);
        } catch (Exception e) {
            throw new PipelineException(PipelineException.Stage.LOAD, e);
        }

        try {
            new PartitionInitializer(config).initializeAll(corpus.documents());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(PipelineException.Stage.PARTITION, e);
        } catch (RuntimeException e) {
            throw new PipelineException(PipelineException.Stage.PARTITION, e);
        }
        return corpus;
    }

    /**
     * Run the sampler for the configured number of sweeps, snapshotting periodically.
     */
    public void sample(Corpus corpus) throws PipelineException {
        try {
            sampler.initialize(corpus.documents());
        } catch (RuntimeException e) {
            throw new PipelineException(PipelineException.Stage.SAMPLING, e);
        }

        AssociationMatrix associations = corpus.associations();
        log.info("Running sampling for {} iterations over {} documents", config.maxIterations(),
            corpus.documents().size());

        for (int iteration = 1; iteration <= config.maxIterations(); iteration++) {
            long start = System.currentTimeMillis();
            try {
                for (Document doc : corpus.documents()) {
                    for (int position = 0; position < doc.length(); position++) {
                        sampler.resample(doc, position, associations.row(doc.wordAt(position)));
                        doc.partition().validate(doc.length());
                        doc.validateSenses();
                    }
                }
            } catch (RuntimeException e) {
                throw new PipelineException(PipelineException.Stage.SAMPLING, e);
            }
            log.debug("Iteration {} done in {} ms", iteration, System.currentTimeMillis() - start);

            if (iteration % config.snapshotInterval() == 0) {
                snapshot(corpus);
                log.info("Finished {} iterations", iteration);
            }
        }
    }

    /**
     * Write the next snapshot of the corpus.
     */
    public Path snapshot(Corpus corpus) throws PipelineException {
        try {
            return snapshots.save(corpus);
        } catch (Exception e) {
            throw new PipelineException(PipelineException.Stage.SNAPSHOT, e);
        }
    }

    /**
     * Tally senses per word and rank the words by novelty.
     */
    public List<NoveltyScore> score(Corpus corpus) throws PipelineException {
        try {
            NoveltyScorer scorer = new NoveltyScorer(sampler.senseCount());
            Map<String, WordSenseProfile> profiles = scorer.collect(corpus);
            return scorer.score(profiles);
        } catch (RuntimeException e) {
            throw new PipelineException(PipelineException.Stage.SCORING, e);
        }
    }

    /**
     * Everything in order.
     *
     * @return the {@code topK} most novel words
     */
    public List<NoveltyScore> run(Path reference, Path focus) throws PipelineException {
        long start = System.currentTimeMillis();
        Corpus corpus = prepare(reference, focus);
        sample(corpus);
        List<NoveltyScore> top = NoveltyScorer.top(score(corpus), config.topK());
        log.info("Run finished in {} ms", System.currentTimeMillis() - start);
        return top;
    }
}
