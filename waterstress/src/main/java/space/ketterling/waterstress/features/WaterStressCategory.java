package space.ketterling.waterstress.features;

/**
 * Baseline water stress categories on the 0 to 5 score scale.
 */
public enum WaterStressCategory {
    LOW("Low (<10%)"),
    LOW_MEDIUM("Low-Medium (10-20%)"),
    MEDIUM_HIGH("Medium-High (20-40%)"),
    HIGH("High (40-80%)"),
    EXTREMELY_HIGH("Extremely High (>80%)");

    private final String label;

    WaterStressCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Bins [0,1), [1,2), [2,3), [3,4), [4,5]; null for a missing or
     * out-of-range score.
     */
    public static WaterStressCategory fromScore(Double score) {
        if (score == null || score.isNaN() || score < 0.0 || score > 5.0)
            return null;
        int bin = (int) Math.floor(score);
        return values()[Math.min(bin, 4)];
    }
}
