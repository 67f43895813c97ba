package pl.marcinmilkowski.sense_shift.corpus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable word/id mapping with post-filter occurrence counts.
 *
 * Ids are dense in {@code [0, size())} and follow the order in which words were first seen.
 */
public final class Vocabulary {

    private final List<String> idToWord;
    private final Map<String, Integer> wordToId;
    private final Map<String, Long> counts;

    /**
     * @param wordCounts words in id order mapped to their total count
     */
    public Vocabulary(LinkedHashMap<String, Long> wordCounts) {
        List<String> words = new ArrayList<>(wordCounts.size());
        Map<String, Integer> ids = new HashMap<>(wordCounts.size() * 2);
        for (String word : wordCounts.keySet()) {
            ids.put(word, words.size());
            words.add(word);
        }
        this.idToWord = Collections.unmodifiableList(words);
        this.wordToId = Collections.unmodifiableMap(ids);
        this.counts = Collections.unmodifiableMap(new LinkedHashMap<>(wordCounts));
    }

    public int size() {
        return idToWord.size();
    }

    public boolean contains(String word) {
        return wordToId.containsKey(word);
    }

    /**
     * Get the id of a word.
     *
     * @throws IllegalStateException if the word is not in the vocabulary
     */
    public int id(String word) {
        Integer id = wordToId.get(word);
        if (id == null) {
            throw new IllegalStateException("Word not in vocabulary: " + word);
        }
        return id;
    }

    /**
     * Get the word for an id.
     *
     * @throws IllegalStateException if the id is outside {@code [0, size())}
     */
    public String word(int id) {
        if (id < 0 || id >= idToWord.size()) {
            throw new IllegalStateException("Word id " + id + " outside vocabulary of size " + idToWord.size());
        }
        return idToWord.get(id);
    }

    /**
     * Total post-filter count of a word, 0 when unknown.
     */
    public long count(String word) {
        Long c = counts.get(word);
        return c != null ? c : 0L;
    }

    public long count(int id) {
        return count(word(id));
    }

    /** Words in id order. */
    public List<String> words() {
        return idToWord;
    }

    public Map<String, Integer> wordToId() {
        return wordToId;
    }

    /** Word counts in id order. */
    public Map<String, Long> counts() {
        return counts;
    }

    public long totalTokens() {
        long total = 0;
        for (long c : counts.values()) {
            total += c;
        }
        return total;
    }

    @Override
    public String toString() {
        return String.format("Vocabulary[%d words, %d tokens]", size(), totalTokens());
    }
}
