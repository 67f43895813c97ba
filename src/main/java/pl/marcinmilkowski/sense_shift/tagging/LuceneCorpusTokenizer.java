package pl.marcinmilkowski.sense_shift.tagging;

import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.WordlistLoader;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tokenizer backed by Lucene's {@link StandardTokenizer} (Unicode word break rules).
 *
 * Stopword lists are read from the classpath as {@code stopwords/<language>.txt},
 * one word per line, {@code #} starting a comment line.
 */
public class LuceneCorpusTokenizer implements CorpusTokenizer {

    private static final Logger log = LoggerFactory.getLogger(LuceneCorpusTokenizer.class);

    private static final String STOPWORDS_RESOURCE = "stopwords/%s.txt";

    private final boolean lowercase;
    private final Map<String, Set<String>> stopwordCache = new ConcurrentHashMap<>();

    public LuceneCorpusTokenizer() {
        this(false);
    }

    /**
     * @param lowercase lowercase every token before it is returned
     */
    public LuceneCorpusTokenizer(boolean lowercase) {
        this.lowercase = lowercase;
    }

    @Override
    public List<String> tokenize(String text) throws IOException {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }

        StandardTokenizer tokenizer = new StandardTokenizer();
        tokenizer.setReader(new StringReader(text));
        TokenStream stream = lowercase ? new LowerCaseFilter(tokenizer) : tokenizer;

        try (stream) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        }
        return tokens;
    }

    @Override
    public Set<String> stopwords(String language) throws IOException {
        String key = language.toLowerCase(Locale.ROOT);
        Set<String> cached = stopwordCache.get(key);
        if (cached != null) {
            return cached;
        }
        Set<String> loaded = loadStopwords(key);
        stopwordCache.put(key, loaded);
        return loaded;
    }

    private Set<String> loadStopwords(String language) throws IOException {
        String resource = String.format(Locale.ROOT, STOPWORDS_RESOURCE, language);
        try (InputStream in = LuceneCorpusTokenizer.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new FileNotFoundException("Stopword list not found on classpath: " + resource);
            }
            Set<String> words = new LinkedHashSet<>();
            for (String line : WordlistLoader.getLines(in, StandardCharsets.UTF_8)) {
                String word = line.trim();
                if (!word.isEmpty()) {
                    words.add(word);
                }
            }
            log.info("Loaded {} stopwords for language '{}'", words.size(), language);
            return Collections.unmodifiableSet(words);
        }
    }
}
