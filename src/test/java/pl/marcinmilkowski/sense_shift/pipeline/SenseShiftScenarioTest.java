package pl.marcinmilkowski.sense_shift.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.sense_shift.config.AssociationWeighting;
import pl.marcinmilkowski.sense_shift.config.SenseShiftConfig;
import pl.marcinmilkowski.sense_shift.cooccurrence.AssociationMatrix;
import pl.marcinmilkowski.sense_shift.corpus.Corpus;
import pl.marcinmilkowski.sense_shift.corpus.Document;
import pl.marcinmilkowski.sense_shift.corpus.Vocabulary;
import pl.marcinmilkowski.sense_shift.sampling.PartitionInitializer;
import pl.marcinmilkowski.sense_shift.tagging.LuceneCorpusTokenizer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two tiny corpora that use the same words in swapped contexts.
 */
class SenseShiftScenarioTest {

    private static final Path REFERENCE = Paths.get("src/test/resources/reference.txt");
    private static final Path FOCUS = Paths.get("src/test/resources/focus.txt");

    private static Corpus load(SenseShiftConfig config) throws Exception {
        return Corpus.load(config, new LuceneCorpusTokenizer(), REFERENCE, FOCUS);
    }

    private static SenseShiftConfig config() {
        return SenseShiftConfig.defaults()
            .withFloor(0)
            .withWindowSize(4)
            .withAssociationWeighting(AssociationWeighting.RAW_COUNT);
    }

    @Test
    @DisplayName("Shared vocabulary and co-occurrence of adjacent words")
    void vocabularyAndCounts() throws Exception {
        Corpus corpus = load(config());
        Vocabulary vocab = corpus.vocabulary();

        assertEquals(List.of("cat", "sat", "mat", "dog", "log"), vocab.words());
        assertEquals(4, vocab.count("sat"));

        AssociationMatrix m = corpus.associations();
        for (List<String> sentence : corpus.sentences()) {
            for (int i = 0; i + 1 < sentence.size(); i++) {
                int a = vocab.id(sentence.get(i));
                int b = vocab.id(sentence.get(i + 1));
                assertTrue(m.get(a, b) > 0 || m.get(b, a) > 0, sentence.get(i) + " / " + sentence.get(i + 1));
            }
        }
        for (int i = 0; i < vocab.size(); i++) {
            assertEquals(0.0, m.get(i, i));
        }
    }

    @Test
    @DisplayName("Same seed reproduces the initial partitions across thread counts")
    void reproduciblePartitions() throws Exception {
        Corpus first = load(config());
        Corpus second = load(config());
        new PartitionInitializer(config()).initializeAll(first.documents());
        new PartitionInitializer(config().withThreads(2)).initializeAll(second.documents());

        assertEquals(partitions(first), partitions(second));
    }

    private static List<String> partitions(Corpus corpus) {
        List<String> out = new ArrayList<>();
        for (Document doc : corpus.documents()) {
            out.add(doc.partition().toString());
        }
        return out;
    }
}
