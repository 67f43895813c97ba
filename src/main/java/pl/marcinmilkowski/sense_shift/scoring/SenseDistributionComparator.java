package pl.marcinmilkowski.sense_shift.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_shift.corpus.CorpusSide;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares a word's sense distribution in the reference corpus with the one in the focus corpus.
 *
 * The measure is the Jensen-Shannon distance with natural logarithms, i.e. the square root of
 * the Jensen-Shannon divergence, in {@code [0, sqrt(ln 2)]}.
 */
public final class SenseDistributionComparator {

    private static final Logger log = LoggerFactory.getLogger(SenseDistributionComparator.class);

    private SenseDistributionComparator() {
    }

    /**
     * Distance between the two sense distributions of each target word.
     * Targets that were never observed on both sides are skipped with a warning.
     */
    public static List<TargetDistance> compare(Map<String, WordSenseProfile> profiles, List<String> targets) {
        List<TargetDistance> out = new ArrayList<>(targets.size());
        for (String target : targets) {
            WordSenseProfile profile = profiles.get(target);
            if (profile == null) {
                log.warn("Target word '{}' was not observed in any partition", target);
                continue;
            }
            if (profile.total(CorpusSide.REFERENCE) == 0 || profile.total(CorpusSide.FOCUS) == 0) {
                log.warn("Target word '{}' occurs in only one corpus; skipped", target);
                continue;
            }
            double distance = jensenShannonDistance(
                profile.distribution(CorpusSide.REFERENCE),
                profile.distribution(CorpusSide.FOCUS));
            out.add(new TargetDistance(target, distance));
        }
        return out;
    }

    /**
     * Jensen-Shannon distance between two distributions. Inputs are normalized first.
     *
     * @throws IllegalArgumentException if the lengths differ
     * @throws ArithmeticException if either input sums to zero
     */
    public static double jensenShannonDistance(double[] p, double[] q) {
        if (p.length != q.length) {
            throw new IllegalArgumentException("Distributions differ in length: " + p.length + " vs " + q.length);
        }
        double[] pn = normalize(p);
        double[] qn = normalize(q);
        double divergence = 0;
        for (int i = 0; i < pn.length; i++) {
            double m = (pn[i] + qn[i]) / 2;
            divergence += term(pn[i], m) + term(qn[i], m);
        }
        return Math.sqrt(Math.max(0, divergence / 2));
    }

    private static double term(double x, double m) {
        return x > 0 ? x * Math.log(x / m) : 0.0;
    }

    private static double[] normalize(double[] v) {
        double sum = 0;
        for (double x : v) {
            sum += x;
        }
        if (!(sum > 0)) {
            throw new ArithmeticException("Cannot normalize a distribution summing to " + sum);
        }
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = v[i] / sum;
        }
        return out;
    }

    /**
     * Distance for one target word.
     */
    public record TargetDistance(String word, double distance) {
        @Override
        public String toString() {
            return String.format("%s jsd=%.4f", word, distance);
        }
    }
}
