package pl.marcinmilkowski.sense_shift.sampling;

import pl.marcinmilkowski.sense_shift.corpus.Document;
import pl.marcinmilkowski.sense_shift.corpus.Partition;

import java.util.Random;

/**
 * Seats the tokens of a document at tables under a Chinese Restaurant Process prior.
 *
 * Tokens are processed in order. The n-th token joins existing table k with probability
 * {@code size(k) / (n + alpha - 1)} and opens a new table with probability
 * {@code alpha / (n + alpha - 1)}.
 */
public class CrpPartitioner {

    private final double alpha;
    private final Random random;

    /**
     * @param alpha concentration parameter, must be positive
     * @param random source of the uniform draws
     */
    public CrpPartitioner(double alpha, Random random) {
        if (!(alpha > 0)) {
            throw new IllegalArgumentException("alpha must be positive, got " + alpha);
        }
        this.alpha = alpha;
        this.random = random;
    }

    /**
     * Build the initial partition of a document.
     *
     * @throws IllegalStateException if the document was already partitioned
     */
    public void initialize(Document document) {
        Partition partition = document.partition();
        if (!partition.isEmpty()) {
            throw new IllegalStateException("Document " + document.index() + " is already partitioned");
        }
        seat(partition, document.length());
    }

    /**
     * Seat positions {@code 0 .. length-1} into an empty partition.
     */
    void seat(Partition partition, int length) {
        int n = 0;
        for (int position = 0; position < length; position++) {
            n++;
            double denominator = n + alpha - 1;
            int tables = partition.clusterCount();

            double[] prior = new double[tables];
            double occupied = 0;
            for (int k = 0; k < tables; k++) {
                prior[k] = partition.clusterSize(k) / denominator;
                occupied += prior[k];
            }

            double r = random.nextDouble();
            if (r > occupied) {
                partition.openCluster(position);
                continue;
            }

            int chosen = -1;
            double cumulative = 0;
            for (int k = 0; k < tables; k++) {
                cumulative += prior[k];
                if (cumulative > r) {
                    chosen = k;
                    break;
                }
            }
            // r equal to the occupied mass matches no table
            if (chosen < 0) {
                partition.openCluster(position);
            } else {
                partition.add(chosen, position);
            }
        }
    }
}
