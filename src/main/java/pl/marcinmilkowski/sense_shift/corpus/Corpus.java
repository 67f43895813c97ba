package pl.marcinmilkowski.sense_shift.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_shift.config.AssociationWeighting;
import pl.marcinmilkowski.sense_shift.config.SenseShiftConfig;
import pl.marcinmilkowski.sense_shift.cooccurrence.AssociationMatrix;
import pl.marcinmilkowski.sense_shift.cooccurrence.CooccurrenceCounter;
import pl.marcinmilkowski.sense_shift.cooccurrence.PpmiWeighting;
import pl.marcinmilkowski.sense_shift.tagging.CorpusTokenizer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The reference and focus sentences, their shared vocabulary and the word association matrix.
 *
 * A corpus is the unit of persistence; it carries a save counter that grows with every snapshot.
 */
public final class Corpus {

    private static final Logger log = LoggerFactory.getLogger(Corpus.class);

    private final SenseShiftConfig config;
    private final Vocabulary vocabulary;
    private final List<Document> documents;
    private final AssociationMatrix associations;
    private final AssociationWeighting weighting;
    private int saveCounter;

    /**
     * Assemble a corpus from already built parts.
     *
     * @throws IllegalStateException if a document refers to a word id outside the vocabulary,
     *                               or the matrix does not match the vocabulary size
     */
    public Corpus(SenseShiftConfig config, Vocabulary vocabulary, List<Document> documents,
                  AssociationMatrix associations, AssociationWeighting weighting, int saveCounter) {
        if (associations.size() != vocabulary.size()) {
            throw new IllegalStateException("Association matrix size " + associations.size()
                + " does not match vocabulary size " + vocabulary.size());
        }
        for (Document doc : documents) {
            for (int p = 0; p < doc.length(); p++) {
                int id = doc.wordAt(p);
                if (id < 0 || id >= vocabulary.size()) {
                    throw new IllegalStateException("Document " + doc.index() + " refers to word id " + id
                        + " outside vocabulary of size " + vocabulary.size());
                }
            }
        }
        this.config = config;
        this.vocabulary = vocabulary;
        this.documents = Collections.unmodifiableList(new ArrayList<>(documents));
        this.associations = associations;
        this.weighting = weighting;
        this.saveCounter = saveCounter;
    }

    /**
     * Read the reference corpus and, when given, the focus corpus, then build the association matrix.
     *
     * @param config run configuration (floor, window size, language, weighting)
     * @param tokenizer tokenizer and stopword source
     * @param reference reference corpus file
     * @param focus focus corpus file, or null
     * @throws IOException if a corpus file is missing, unreadable or empty
     */
    public static Corpus load(SenseShiftConfig config, CorpusTokenizer tokenizer, Path reference, Path focus)
            throws IOException {
        VocabularyBuilder builder = new VocabularyBuilder(tokenizer, config.language(), config.floor());
        builder.addCorpus(reference, CorpusSide.REFERENCE);
        if (focus != null) {
            builder.addCorpus(focus, CorpusSide.FOCUS);
        }
        Vocabulary vocabulary = builder.build();
        log.info("Vocabulary built: {} words, {} documents", vocabulary.size(), builder.documents().size());

        AssociationMatrix counts = new CooccurrenceCounter(config.windowSize()).count(builder.sentences(), vocabulary);
        AssociationMatrix associations = counts;
        if (config.associationWeighting() == AssociationWeighting.PPMI) {
            associations = PpmiWeighting.apply(counts, vocabulary);
        }
        return new Corpus(config, vocabulary, builder.documents(), associations, config.associationWeighting(), 0);
    }

    public SenseShiftConfig config() {
        return config;
    }

    public Vocabulary vocabulary() {
        return vocabulary;
    }

    public int vocabularySize() {
        return vocabulary.size();
    }

    public List<Document> documents() {
        return documents;
    }

    /** The matrix handed to the sense sampler. */
    public AssociationMatrix associations() {
        return associations;
    }

    public AssociationWeighting weighting() {
        return weighting;
    }

    /**
     * The filtered sentences as token strings, rebuilt from the documents.
     */
    public List<List<String>> sentences() {
        List<List<String>> sentences = new ArrayList<>(documents.size());
        for (Document doc : documents) {
            List<String> words = new ArrayList<>(doc.length());
            for (int p = 0; p < doc.length(); p++) {
                words.add(vocabulary.word(doc.wordAt(p)));
            }
            sentences.add(words);
        }
        return sentences;
    }

    public int saveCounter() {
        return saveCounter;
    }

    /**
     * Advance the save counter.
     *
     * @return the number of the snapshot about to be written
     */
    public synchronized int nextSaveNumber() {
        return ++saveCounter;
    }

    @Override
    public String toString() {
        return String.format("Corpus[%d words, %d documents, %s, saves=%d]",
            vocabulary.size(), documents.size(), associations, saveCounter);
    }
}
