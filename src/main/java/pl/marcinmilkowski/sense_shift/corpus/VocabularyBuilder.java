package pl.marcinmilkowski.sense_shift.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_shift.tagging.CorpusTokenizer;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads one-sentence-per-line corpus files, filters stopwords and rare words, and assigns word ids.
 *
 * Files are processed in the order they are added. The rarity threshold is applied per file:
 * a token survives when it occurs at least {@code floor + 1} times in that file. Ids follow
 * first appearance among the surviving tokens and are only ever extended, so a second file
 * never renumbers the words of the first.
 */
public class VocabularyBuilder {

    private static final Logger log = LoggerFactory.getLogger(VocabularyBuilder.class);

    private final CorpusTokenizer tokenizer;
    private final String language;
    private final int minCount;

    private final LinkedHashMap<String, Long> wordCounts = new LinkedHashMap<>();
    private final Map<String, Integer> wordToId = new HashMap<>();
    private final List<List<String>> sentences = new ArrayList<>();
    private final List<Document> documents = new ArrayList<>();

    /**
     * @param tokenizer tokenizer and stopword source
     * @param language stopword list to use
     * @param floor words need more than this many occurrences to be kept
     */
    public VocabularyBuilder(CorpusTokenizer tokenizer, String language, int floor) {
        if (floor < 0) {
            throw new IllegalArgumentException("floor must be >= 0, got " + floor);
        }
        this.tokenizer = tokenizer;
        this.language = language;
        this.minCount = floor + 1;
    }

    /**
     * Read a corpus file and turn each surviving sentence into a document.
     *
     * @param file UTF-8 text, one sentence per line
     * @param side which corpus the file belongs to
     * @return the documents created from this file
     * @throws IOException if the file is missing, unreadable or empty
     */
    public List<Document> addCorpus(Path file, CorpusSide side) throws IOException {
        List<String> lines = readLines(file);

        List<List<String>> tokenized = new ArrayList<>(lines.size());
        Map<String, Long> rawCounts = new HashMap<>();
        for (String line : lines) {
            List<String> tokens = tokenizer.tokenize(line);
            tokenized.add(tokens);
            for (String token : tokens) {
                rawCounts.merge(token, 1L, Long::sum);
            }
        }

        Set<String> removal = new HashSet<>(tokenizer.stopwords(language));
        int stopwordCount = removal.size();
        for (Map.Entry<String, Long> e : rawCounts.entrySet()) {
            if (e.getValue() < minCount) {
                removal.add(e.getKey());
            }
        }

        List<List<String>> kept = new ArrayList<>();
        for (List<String> tokens : tokenized) {
            List<String> filtered = new ArrayList<>(tokens.size());
            for (String token : tokens) {
                if (!removal.contains(token)) {
                    filtered.add(token);
                }
            }
            if (!filtered.isEmpty()) {
                kept.add(filtered);
            }
        }

        for (List<String> sentence : kept) {
            for (String token : sentence) {
                Long previous = wordCounts.get(token);
                if (previous == null) {
                    wordToId.put(token, wordCounts.size());
                    wordCounts.put(token, 1L);
                } else {
                    wordCounts.put(token, previous + 1);
                }
            }
        }

        List<Document> created = new ArrayList<>(kept.size());
        for (List<String> sentence : kept) {
            int[] ids = new int[sentence.size()];
            for (int i = 0; i < ids.length; i++) {
                ids[i] = wordToId.get(sentence.get(i));
            }
            Document doc = new Document(documents.size(), ids, side);
            documents.add(doc);
            created.add(doc);
        }
        sentences.addAll(kept);

        log.info("Loaded {} corpus {}: {} lines, {} sentences kept, {} distinct raw tokens, {} removed ({} stopwords)",
            side.label(), file, lines.size(), kept.size(), rawCounts.size(), removal.size() - stopwordCount,
            stopwordCount);
        if (kept.isEmpty()) {
            log.warn("No sentence of {} survived filtering (floor={})", file, minCount - 1);
        }
        return created;
    }

    private static List<String> readLines(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "Corpus file not found");
        }
        if (!Files.isReadable(file)) {
            throw new IOException("Corpus file is not readable: " + file);
        }
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line.trim());
            }
        }
        if (lines.stream().allMatch(String::isEmpty)) {
            throw new IOException("Corpus file is empty: " + file);
        }
        return lines;
    }

    /**
     * Freeze the vocabulary built so far.
     *
     * @throws IllegalArgumentException if no word survived filtering
     */
    public Vocabulary build() {
        if (wordCounts.isEmpty()) {
            throw new IllegalArgumentException("Vocabulary is empty after filtering (floor=" + (minCount - 1) + ")");
        }
        return new Vocabulary(wordCounts);
    }

    /** Filtered sentences of every file added, as token strings. */
    public List<List<String>> sentences() {
        return Collections.unmodifiableList(sentences);
    }

    public List<Document> documents() {
        return Collections.unmodifiableList(documents);
    }
}
