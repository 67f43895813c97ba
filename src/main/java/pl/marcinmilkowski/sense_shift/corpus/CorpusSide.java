package pl.marcinmilkowski.sense_shift.corpus;

import java.util.Locale;

/**
 * Which of the two compared corpora a document came from.
 */
public enum CorpusSide {
    REFERENCE(0),
    FOCUS(1);

    private final int column;

    CorpusSide(int column) {
        this.column = column;
    }

    /**
     * Column of this side in a per-sense count matrix.
     */
    public int column() {
        return column;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CorpusSide fromLabel(String label) {
        for (CorpusSide side : values()) {
            if (side.label().equalsIgnoreCase(label)) {
                return side;
            }
        }
        throw new IllegalArgumentException("Unknown corpus side: " + label);
    }
}
