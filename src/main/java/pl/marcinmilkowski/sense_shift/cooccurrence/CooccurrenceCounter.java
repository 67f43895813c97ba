package pl.marcinmilkowski.sense_shift.cooccurrence;

import gnu.trove.map.hash.TLongIntHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_shift.corpus.Vocabulary;

import java.util.List;

/**
 * Counts windowed co-occurrences of word pairs over filtered sentences.
 *
 * For the token at position {@code j} the window is {@code [max(0, j - W/2), min(len - 1, j + W/2))},
 * end exclusive, so the final token of a sentence never acts as context. Every window token that
 * differs from the center token adds one to cell (context, center). The result is not symmetric.
 */
public class CooccurrenceCounter {

    private static final Logger log = LoggerFactory.getLogger(CooccurrenceCounter.class);

    private final int windowSize;

    public CooccurrenceCounter(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got " + windowSize);
        }
        this.windowSize = windowSize;
    }

    /**
     * Build the raw count matrix.
     *
     * @param sentences filtered sentences as token strings
     * @param vocabulary vocabulary providing the ids; tokens outside it are skipped
     */
    public AssociationMatrix count(List<List<String>> sentences, Vocabulary vocabulary) {
        TLongIntHashMap pairs = new TLongIntHashMap(1024);
        int half = windowSize / 2;
        long tokensProcessed = 0;

        for (List<String> sentence : sentences) {
            int len = sentence.size();
            for (int j = 0; j < len; j++) {
                String center = sentence.get(j);
                tokensProcessed++;
                if (!vocabulary.contains(center)) {
                    continue;
                }
                int centerId = vocabulary.id(center);

                int start = Math.max(0, j - half);
                int end = Math.min(len - 1, j + half);
                for (int i = start; i < end; i++) {
                    String context = sentence.get(i);
                    if (context.equals(center) || !vocabulary.contains(context)) {
                        continue;
                    }
                    int contextId = vocabulary.id(context);
                    long key = (((long) contextId) << 32) | (centerId & 0xffffffffL);
                    pairs.adjustOrPutValue(key, 1, 1);
                }
            }
        }

        AssociationMatrix.Builder builder = AssociationMatrix.builder(vocabulary.size());
        for (long key : pairs.keys()) {
            builder.set((int) (key >>> 32), (int) key, pairs.get(key));
        }
        AssociationMatrix matrix = builder.build();

        log.info("Co-occurrence counts: {} sentences, {} tokens, window={}, {} non-zero cells",
            sentences.size(), tokensProcessed, windowSize, matrix.nonZeroCount());
        return matrix;
    }
}
