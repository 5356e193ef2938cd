package com.manufacturing.semanticlayer.graph;

public enum EdgeType {
    /** Schema relationship between two tables. */
    RELATES_TO,
    /** Intent -> Perspective, weighted by how strongly the intent engages it. */
    OPERATES_WITHIN,
    /** Perspective -> Concept, optionally carrying an elevation weight. */
    USES_DEFINITION,
    /** Field -> Concept. */
    CAN_MEAN,
    ELEVATES,
    SUPPRESSES,
    NEUTRAL;

    public static EdgeType forElevation(Elevation elevation) {
        switch (elevation) {
            case ELEVATES:
                return ELEVATES;
            case SUPPRESSES:
                return SUPPRESSES;
            default:
                return NEUTRAL;
        }
    }
}
