package pl.marcinmilkowski.sense_shift.tagging;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Splits raw sentences into word tokens and supplies stopword lists.
 */
public interface CorpusTokenizer {

    /**
     * Tokenize a single line of text.
     *
     * @param text one sentence
     * @return the tokens in order, possibly empty
     */
    List<String> tokenize(String text) throws IOException;

    /**
     * Get the stopword list for a language.
     *
     * @param language language name, e.g. "english"
     * @throws IOException if no list is available for the language
     */
    Set<String> stopwords(String language) throws IOException;
}
