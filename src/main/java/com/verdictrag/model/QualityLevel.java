package com.verdictrag.model;

public enum QualityLevel {
    EXCELLENT(0.9),
    GOOD(0.8),
    SATISFACTORY(0.7),
    NEEDS_IMPROVEMENT(0.5),
    INSUFFICIENT(0.0);

    private final double minimum;

    QualityLevel(double minimum) {
        this.minimum = minimum;
    }

    public double getMinimum() {
        return minimum;
    }

    public static QualityLevel of(double compositeScore) {
        for (QualityLevel level : values()) {
            if (compositeScore >= level.minimum) {
                return level;
            }
        }
        return INSUFFICIENT;
    }
}
