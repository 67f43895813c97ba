package pl.marcinmilkowski.sense_shift.scoring;

import pl.marcinmilkowski.sense_shift.corpus.CorpusSide;

/**
 * Occurrence counts of one word per sense, split into reference and focus columns.
 *
 * Counts are recorded during a single scoring pass; once {@link #calculate()} has been
 * called the profile no longer accepts updates.
 */
public final class WordSenseProfile {

    private final String word;
    private final int id;
    private final long[][] senses;
    private boolean sealed;

    public WordSenseProfile(String word, int id, int senseCount) {
        if (senseCount < 1) {
            throw new IllegalArgumentException("senseCount must be >= 1, got " + senseCount);
        }
        this.word = word;
        this.id = id;
        this.senses = new long[senseCount][2];
    }

    public String word() {
        return word;
    }

    public int id() {
        return id;
    }

    public int senseCount() {
        return senses.length;
    }

    /**
     * Count one occurrence of the word in a sense.
     *
     * @throws IllegalStateException if the sense id is out of range or the profile was already scored
     */
    public void record(int sense, CorpusSide side) {
        if (sealed) {
            throw new IllegalStateException("Profile of '" + word + "' was already scored");
        }
        if (sense < 0 || sense >= senses.length) {
            throw new IllegalStateException("Sense " + sense + " of '" + word + "' outside [0, "
                + senses.length + ")");
        }
        senses[sense][side.column()]++;
    }

    public long count(int sense, CorpusSide side) {
        return senses[sense][side.column()];
    }

    public long total(CorpusSide side) {
        long total = 0;
        for (long[] row : senses) {
            total += row[side.column()];
        }
        return total;
    }

    public long total() {
        return total(CorpusSide.REFERENCE) + total(CorpusSide.FOCUS);
    }

    /**
     * The word's sense distribution within one corpus.
     *
     * @throws ArithmeticException if the word never occurs in that corpus
     */
    public double[] distribution(CorpusSide side) {
        long total = total(side);
        if (total == 0) {
            throw new ArithmeticException("'" + word + "' has no " + side.label() + " occurrences to normalize");
        }
        double[] dist = new double[senses.length];
        for (int s = 0; s < senses.length; s++) {
            dist[s] = (double) senses[s][side.column()] / total;
        }
        return dist;
    }

    /**
     * Compute the novelty score over the senses the word was observed in.
     *
     * @throws ArithmeticException if the word has no occurrences at all
     */
    public NoveltyScore calculate() {
        sealed = true;
        double best = Double.NEGATIVE_INFINITY;
        int bestSense = -1;
        for (int s = 0; s < senses.length; s++) {
            long reference = senses[s][CorpusSide.REFERENCE.column()];
            long focus = senses[s][CorpusSide.FOCUS.column()];
            long rowTotal = reference + focus;
            if (rowTotal == 0) {
                continue;
            }
            double novelty = (double) focus / rowTotal - (double) reference / rowTotal;
            if (novelty > best) {
                best = novelty;
                bestSense = s;
            }
        }
        if (bestSense < 0) {
            throw new ArithmeticException("'" + word + "' has zero occurrences across all senses");
        }
        return new NoveltyScore(word, best, bestSense);
    }
}
