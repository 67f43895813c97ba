package pl.marcinmilkowski.sense_shift.cooccurrence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_shift.corpus.Vocabulary;

/**
 * Positive pointwise mutual information over a co-occurrence count matrix.
 *
 * For a non-zero cell (i, j) with count f and matrix total T:
 * <pre>
 *   joint = f / T
 *   p_i   = f * count(word_i) / T
 *   p_j   = f * count(word_j) / T
 *   ppmi  = max(0, log2(joint / (p_i * p_j)))
 * </pre>
 * Both marginals carry the pair count f rather than independent unigram probabilities.
 */
public final class PpmiWeighting {

    private static final Logger log = LoggerFactory.getLogger(PpmiWeighting.class);

    private static final double LN_2 = Math.log(2);

    private PpmiWeighting() {
    }

    /**
     * Derive the PPMI matrix. The input matrix is not modified.
     *
     * @param counts raw co-occurrence counts
     * @param vocabulary source of the per-word counts
     * @throws ArithmeticException if a cell's marginal product is zero
     */
    public static AssociationMatrix apply(AssociationMatrix counts, Vocabulary vocabulary) {
        AssociationMatrix.Builder builder = AssociationMatrix.builder(counts.size());
        double total = counts.total();
        int[] clipped = new int[1];

        counts.forEachNonZero((i, j, frequency) -> {
            double value = cell(frequency, total, vocabulary.count(i), vocabulary.count(j), i, j);
            if (value == 0.0) {
                clipped[0]++;
            } else {
                builder.set(i, j, value);
            }
        });

        AssociationMatrix ppmi = builder.build();
        log.info("PPMI computed: {} cells, {} clipped to zero", counts.nonZeroCount(), clipped[0]);
        return ppmi;
    }

    /**
     * PPMI of a single cell.
     *
     * @throws ArithmeticException if {@code p_i * p_j} is not positive
     */
    static double cell(double frequency, double total, long countI, long countJ, int i, int j) {
        double joint = frequency / total;
        double probabilityI = (frequency * countI) / total;
        double probabilityJ = (frequency * countJ) / total;
        double denominator = probabilityI * probabilityJ;
        if (!(denominator > 0)) {
            throw new ArithmeticException(String.format(
                "Zero marginal product for PPMI cell (%d, %d): frequency=%s, count_i=%d, count_j=%d, total=%s",
                i, j, frequency, countI, countJ, total));
        }
        double pmi = Math.log(joint / denominator) / LN_2;
        return Math.max(0, pmi);
    }
}
