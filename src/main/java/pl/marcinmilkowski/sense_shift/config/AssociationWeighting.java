package pl.marcinmilkowski.sense_shift.config;

import java.util.Locale;

/**
 * Which association matrix a corpus keeps for the sense sampler.
 */
public enum AssociationWeighting {
    /** Raw windowed co-occurrence counts. */
    RAW_COUNT,
    /** Positive pointwise mutual information derived from the counts. */
    PPMI;

    public static AssociationWeighting parse(String value) {
        if (value == null || value.isBlank()) {
            return RAW_COUNT;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (AssociationWeighting w : values()) {
            if (w.name().equals(normalized)) {
                return w;
            }
        }
        throw new IllegalArgumentException("Unknown association weighting: " + value);
    }
}
