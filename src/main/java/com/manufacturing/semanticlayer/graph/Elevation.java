package com.manufacturing.semanticlayer.graph;

/**
 * Direction of influence a perspective or intent exerts on a concept.
 */
public enum Elevation {
    ELEVATES,
    SUPPRESSES,
    NEUTRAL;

    /**
     * Classifies a direct intent weight: +1 elevates, -1 suppresses, 0 is neutral.
     */
    public static Elevation fromIntentWeight(int weight) {
        if (weight > 0) {
            return ELEVATES;
        }
        return weight < 0 ? SUPPRESSES : NEUTRAL;
    }

    /**
     * Classifies a perspective elevation weight in [0, 1]. A missing weight is a
     * plain definition with no preference.
     */
    public static Elevation fromElevationWeight(Double weight) {
        if (weight == null) {
            return NEUTRAL;
        }
        return weight > 0.0 ? ELEVATES : SUPPRESSES;
    }
}
