package pl.marcinmilkowski.sense_shift.sampling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_shift.config.SenseShiftConfig;
import pl.marcinmilkowski.sense_shift.corpus.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Gives every document its initial CRP partition.
 *
 * Each document draws from its own {@link Random} seeded from the run seed and the document
 * index, so the result is the same for any thread count and processing order.
 */
public class PartitionInitializer {

    private static final Logger log = LoggerFactory.getLogger(PartitionInitializer.class);

    private final double alpha;
    private final long seed;
    private final int threads;

    public PartitionInitializer(SenseShiftConfig config) {
        this(config.alpha(), config.seed(), config.threads());
    }

    public PartitionInitializer(double alpha, long seed, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        this.alpha = alpha;
        this.seed = seed;
        this.threads = threads;
    }

    /**
     * Seed used for a given document.
     */
    public static long documentSeed(long runSeed, int documentIndex) {
        // SplitMix64 finalizer
        long z = runSeed + 0x9E3779B97F4A7C15L * (documentIndex + 1L);
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    public void initialize(Document document) {
        new CrpPartitioner(alpha, new Random(documentSeed(seed, document.index()))).initialize(document);
    }

    /**
     * Partition all documents.
     *
     * @throws IllegalStateException if a document was already partitioned
     */
    public void initializeAll(List<Document> documents) throws InterruptedException {
        long start = System.currentTimeMillis();
        if (threads == 1 || documents.size() < 2) {
            for (Document doc : documents) {
                initialize(doc);
            }
        } else {
            initializeConcurrently(documents);
        }

        long tables = 0;
        for (Document doc : documents) {
            tables += doc.partition().clusterCount();
        }
        log.info("Initial partitions: {} documents, {} tables, alpha={}, {} ms",
            documents.size(), tables, alpha, System.currentTimeMillis() - start);
    }

    private void initializeConcurrently(List<Document> documents) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>(documents.size());
            for (Document doc : documents) {
                futures.add(executor.submit(() -> initialize(doc)));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException re) {
                        throw re;
                    }
                    throw new IllegalStateException("Partition initialization failed", cause);
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
