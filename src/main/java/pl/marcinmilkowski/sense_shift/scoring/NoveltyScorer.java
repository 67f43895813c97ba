package pl.marcinmilkowski.sense_shift.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_shift.corpus.Corpus;
import pl.marcinmilkowski.sense_shift.corpus.Document;
import pl.marcinmilkowski.sense_shift.corpus.Partition;
import pl.marcinmilkowski.sense_shift.corpus.Vocabulary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tallies every token's sense per corpus side and ranks words by novelty.
 */
public class NoveltyScorer {

    private static final Logger log = LoggerFactory.getLogger(NoveltyScorer.class);

    private final int senseCount;

    /**
     * @param senseCount number of global senses reported by the sampler
     */
    public NoveltyScorer(int senseCount) {
        if (senseCount < 1) {
            throw new IllegalArgumentException("senseCount must be >= 1, got " + senseCount);
        }
        this.senseCount = senseCount;
    }

    /**
     * Build one profile per word seen in any partition.
     *
     * @throws IllegalStateException if a document has no sense mapping, a mapping that does not match
     *                               its clusters, or a broken partition
     */
    public Map<String, WordSenseProfile> collect(Corpus corpus) {
        Vocabulary vocabulary = corpus.vocabulary();
        Map<String, WordSenseProfile> profiles = new LinkedHashMap<>();

        for (Document doc : corpus.documents()) {
            Partition partition = doc.partition();
            partition.validate(doc.length());
            doc.validateSenses();
            for (int c = 0; c < partition.clusterCount(); c++) {
                int sense = doc.senseOf(c);
                for (int position : partition.cluster(c)) {
                    int wordId = doc.wordAt(position);
                    String word = vocabulary.word(wordId);
                    WordSenseProfile profile = profiles.get(word);
                    if (profile == null) {
                        profile = new WordSenseProfile(word, wordId, senseCount);
                        profiles.put(word, profile);
                    }
                    profile.record(sense, doc.side());
                }
            }
        }

        log.info("Collected sense profiles for {} words over {} senses", profiles.size(), senseCount);
        return profiles;
    }

    /**
     * Score every profile.
     *
     * @return scores sorted by novelty, highest first
     * @throws IllegalStateException if a score leaves {@code [-1, 1]}
     */
    public List<NoveltyScore> score(Map<String, WordSenseProfile> profiles) {
        List<NoveltyScore> scores = new ArrayList<>(profiles.size());
        for (WordSenseProfile profile : profiles.values()) {
            NoveltyScore score = profile.calculate();
            if (score.score() < -1.0 || score.score() > 1.0) {
                throw new IllegalStateException("Novelty of '" + score.word() + "' outside [-1, 1]: " + score.score());
            }
            scores.add(score);
        }
        Collections.sort(scores);
        return scores;
    }

    /**
     * The {@code topK} most novel words.
     */
    public static List<NoveltyScore> top(List<NoveltyScore> sorted, int topK) {
        return sorted.stream()
            .limit(topK)
            .toList();
    }
}
