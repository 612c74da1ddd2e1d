package com.dynop.wayfinding.scoring;

/**
 * Interpretation band of a score. Lower bounds are inclusive.
 */
public enum WesBand {
    EXCELLENT(90, "Exceptional design exceeding research standards"),
    GOOD(75, "Strong performance with minor improvement opportunities"),
    ACCEPTABLE(60, "Reasonable performance with notable issues"),
    POOR(45, "Significant problems requiring redesign"),
    CRITICAL(0, "Fundamental deficiencies requiring comprehensive overhaul");

    private final double lowerBound;
    private final String description;

    WesBand(double lowerBound, String description) {
        this.lowerBound = lowerBound;
        this.description = description;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @param score Score in [0, 100]
     * @return Highest band whose lower bound the score reaches
     */
    public static WesBand of(double score) {
        for (WesBand band : values()) {
            if (score >= band.lowerBound) {
                return band;
            }
        }
        return CRITICAL;
    }

    /**
     * @return Letter grade from A+ (90 and above) down to F (below 45)
     */
    public static String letterGrade(double score) {
        if (score >= 90) return "A+";
        if (score >= 85) return "A";
        if (score >= 80) return "A-";
        if (score >= 75) return "B+";
        if (score >= 70) return "B";
        if (score >= 65) return "B-";
        if (score >= 60) return "C+";
        if (score >= 55) return "C";
        if (score >= 50) return "C-";
        if (score >= 45) return "D";
        return "F";
    }
}
