package pl.marcinmilkowski.sense_shift.scoring;

/**
 * Novelty of a word: the largest focus-minus-reference share over the senses it was seen in.
 *
 * Sorted by score descending.
 */
public record NoveltyScore(
    String word,      // The scored word
    double score,     // Max novelty, in [-1, 1]
    int sense         // Global sense id reaching the max
) implements Comparable<NoveltyScore> {

    @Override
    public int compareTo(NoveltyScore other) {
        int byScore = Double.compare(other.score, this.score);
        return byScore != 0 ? byScore : this.word.compareTo(other.word);
    }

    @Override
    public String toString() {
        return String.format("%s novelty=%.4f sense=%d", word, score, sense);
    }
}
