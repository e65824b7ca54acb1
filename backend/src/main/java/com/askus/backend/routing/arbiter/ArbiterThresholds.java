package com.askus.backend.routing.arbiter;

/**
 * Tunable thresholds for {@link ConfidenceArbiter}. Construction fails on an
 * inconsistent set so a bad configuration stops the application at start-up.
 */
public record ArbiterThresholds(
        double directScore,
        double directMargin,
        double lowConfScore,
        double lowConfMargin,
        double clarifyMargin
) {
    public static final ArbiterThresholds DEFAULTS = new ArbiterThresholds(0.65, 0.15, 0.50, 0.08, 0.03);

    public ArbiterThresholds {
        requireUnit("directScore", directScore);
        requireUnit("directMargin", directMargin);
        requireUnit("lowConfScore", lowConfScore);
        requireUnit("lowConfMargin", lowConfMargin);
        requireUnit("clarifyMargin", clarifyMargin);

        if (lowConfScore > directScore) {
            throw new IllegalArgumentException("lowConfScore (" + lowConfScore + ") must not exceed directScore (" + directScore + ")");
        }
        if (lowConfMargin > directMargin) {
            throw new IllegalArgumentException("lowConfMargin (" + lowConfMargin + ") must not exceed directMargin (" + directMargin + ")");
        }
        if (clarifyMargin >= lowConfMargin) {
            throw new IllegalArgumentException("clarifyMargin (" + clarifyMargin + ") must be below lowConfMargin (" + lowConfMargin + ")");
        }
    }

    private static void requireUnit(String name, double v) {
        if (Double.isNaN(v) || v < 0.0 || v > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0,1], got " + v);
        }
    }
}
