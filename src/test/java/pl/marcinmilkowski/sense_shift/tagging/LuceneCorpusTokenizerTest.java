package pl.marcinmilkowski.sense_shift.tagging;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LuceneCorpusTokenizerTest {

    @Test
    @DisplayName("Punctuation is dropped and case is kept by default")
    void tokenizeKeepsCase() throws IOException {
        LuceneCorpusTokenizer tokenizer = new LuceneCorpusTokenizer();

        assertEquals(List.of("The", "cat", "sat", "on", "the", "mat"),
            tokenizer.tokenize("The cat sat on the mat."));
    }

    @Test
    @DisplayName("Lowercasing tokenizer lowercases every token")
    void tokenizeLowercase() throws IOException {
        LuceneCorpusTokenizer tokenizer = new LuceneCorpusTokenizer(true);

        assertEquals(List.of("the", "cat", "sat"), tokenizer.tokenize("The CAT, Sat!"));
    }

    @Test
    @DisplayName("Blank input gives no tokens")
    void tokenizeBlank() throws IOException {
        LuceneCorpusTokenizer tokenizer = new LuceneCorpusTokenizer();

        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize("   ").isEmpty());
        assertTrue(tokenizer.tokenize("?!").isEmpty());
    }

    @Test
    @DisplayName("English stopword list is loaded from the classpath")
    void englishStopwords() throws IOException {
        Set<String> stopwords = new LuceneCorpusTokenizer().stopwords("english");

        assertEquals(179, stopwords.size());
        assertTrue(stopwords.contains("the"));
        assertTrue(stopwords.contains("wouldn't"));
        assertFalse(stopwords.contains("cat"));
        assertFalse(stopwords.stream().anyMatch(w -> w.startsWith("#")));
    }

    @Test
    @DisplayName("Unknown language fails with a resource-missing error")
    void unknownLanguage() {
        IOException ex = assertThrows(IOException.class, () -> new LuceneCorpusTokenizer().stopwords("klingon"));
        assertTrue(ex.getMessage().contains("stopwords/klingon.txt"));
    }
}
