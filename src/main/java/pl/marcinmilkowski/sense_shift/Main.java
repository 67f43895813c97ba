package pl.marcinmilkowski.sense_shift;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_shift.config.SenseShiftConfig;
import pl.marcinmilkowski.sense_shift.corpus.Corpus;
import pl.marcinmilkowski.sense_shift.corpus.Document;
import pl.marcinmilkowski.sense_shift.sampling.PartitionInitializer;
import pl.marcinmilkowski.sense_shift.scoring.NoveltyScore;
import pl.marcinmilkowski.sense_shift.scoring.NoveltyScorer;
import pl.marcinmilkowski.sense_shift.scoring.SenseDistributionComparator;
import pl.marcinmilkowski.sense_shift.scoring.TargetWords;
import pl.marcinmilkowski.sense_shift.scoring.WordSenseProfile;
import pl.marcinmilkowski.sense_shift.snapshot.CorpusSnapshotReader;
import pl.marcinmilkowski.sense_shift.snapshot.CorpusSnapshotWriter;
import pl.marcinmilkowski.sense_shift.tagging.LuceneCorpusTokenizer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point.
 *
 * {@code prepare} builds the corpus and its initial partitions and writes the first snapshot for
 * the sense sampler; {@code score} ranks words from a snapshot whose senses have been assigned.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase();

            switch (command) {
                case "prepare":
                    handlePrepareCommand(args);
                    break;
                case "score":
                    handleScoreCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: " + command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void handlePrepareCommand(String[] args) throws Exception {
        String reference = null;
        String focus = null;
        String output = null;
        String configFile = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--reference":
                case "-r":
                    reference = args[++i];
                    break;
                case "--focus":
                case "-f":
                    focus = args[++i];
                    break;
                case "--output":
                case "-o":
                    output = args[++i];
                    break;
                case "--config":
                case "-c":
                    configFile = args[++i];
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (reference == null || output == null) {
            System.err.println("Error: --reference and --output are required");
            System.err.println("Usage: java -jar sense-shift.jar prepare --reference <file> [--focus <file>] --output <dir>");
            return;
        }

        SenseShiftConfig config = configFile != null ? SenseShiftConfig.load(Paths.get(configFile))
            : SenseShiftConfig.defaults();

        Corpus corpus = Corpus.load(config, new LuceneCorpusTokenizer(config.lowercase()),
            Paths.get(reference), focus != null ? Paths.get(focus) : null);
        new PartitionInitializer(config).initializeAll(corpus.documents());
        Path snapshot = new CorpusSnapshotWriter(Paths.get(output)).save(corpus);

        System.out.println("Vocabulary: " + corpus.vocabularySize() + " words");
        System.out.println("Documents: " + corpus.documents().size());
        System.out.println("Associations: " + corpus.associations());
        System.out.println("Snapshot: " + snapshot);
    }

    private static void handleScoreCommand(String[] args) throws Exception {
        String snapshot = null;
        String targets = null;
        Integer topK = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--snapshot":
                case "-s":
                    snapshot = args[++i];
                    break;
                case "--targets":
                case "-t":
                    targets = args[++i];
                    break;
                case "--top-k":
                    topK = Integer.parseInt(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (snapshot == null) {
            System.err.println("Error: --snapshot is required");
            System.err.println("Usage: java -jar sense-shift.jar score --snapshot <file> [--targets <file>] [--top-k N]");
            return;
        }

        Corpus corpus = CorpusSnapshotReader.read(Paths.get(snapshot));
        int limit = topK != null ? topK : corpus.config().topK();

        NoveltyScorer scorer = new NoveltyScorer(senseCount(corpus));
        Map<String, WordSenseProfile> profiles = scorer.collect(corpus);
        List<NoveltyScore> top = NoveltyScorer.top(scorer.score(profiles), limit);

        System.out.println("Top " + limit + " most differing words:");
        for (NoveltyScore score : top) {
            System.out.printf("  %s: novelty=%.4f sense=%d%n", score.word(), score.score(), score.sense());
        }

        if (targets != null) {
            System.out.println();
            System.out.println("Target word distances:");
            for (var distance : SenseDistributionComparator.compare(profiles, TargetWords.load(Paths.get(targets)))) {
                System.out.printf("  %s: jsd=%.4f%n", distance.word(), distance.distance());
            }
        }
    }

    private static int senseCount(Corpus corpus) {
        int max = -1;
        for (Document doc : corpus.documents()) {
            for (int sense : doc.senseMapping()) {
                max = Math.max(max, sense);
            }
        }
        if (max < 0) {
            throw new IllegalStateException("Snapshot has no sense assignments");
        }
        return max + 1;
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar sense-shift.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  prepare   Build vocabulary, associations and initial partitions");
        System.out.println("            --reference <file> [--focus <file>] --output <dir> [--config <json>]");
        System.out.println("  score     Rank words by sense novelty from a sampled snapshot");
        System.out.println("            --snapshot <file> [--targets <file>] [--top-k N]");
        System.out.println("  help      Show this message");
    }
}
