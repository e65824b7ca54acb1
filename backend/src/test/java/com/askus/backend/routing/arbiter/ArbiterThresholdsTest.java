package com.askus.backend.routing.arbiter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ArbiterThresholdsTest {

    @Test
    void defaults_areValid() {
        assertDoesNotThrow(() -> new ArbiterThresholds(0.65, 0.15, 0.50, 0.08, 0.03));
    }

    @Test
    void outOfUnitRange_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ArbiterThresholds(1.2, 0.15, 0.50, 0.08, 0.03));
        assertThrows(IllegalArgumentException.class, () -> new ArbiterThresholds(0.65, -0.1, 0.50, 0.08, 0.03));
        assertThrows(IllegalArgumentException.class, () -> new ArbiterThresholds(0.65, 0.15, Double.NaN, 0.08, 0.03));
    }

    @Test
    void clarifyMarginNotBelowLowConfMargin_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ArbiterThresholds(0.65, 0.15, 0.50, 0.08, 0.08));
    }

    @Test
    void lowConfScoreAboveDirectScore_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ArbiterThresholds(0.50, 0.15, 0.65, 0.08, 0.03));
    }

    @Test
    void lowConfMarginAboveDirectMargin_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ArbiterThresholds(0.65, 0.05, 0.50, 0.08, 0.03));
    }
}
