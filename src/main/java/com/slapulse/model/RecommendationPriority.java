package com.slapulse.model;

public enum RecommendationPriority {
    URGENT(0),
    HIGH(1),
    MEDIUM(2),
    LOW(3);

    private final int weight;

    RecommendationPriority(int weight) {
        this.weight = weight;
    }

    /**
     * Sort weight, lower comes first.
     */
    public int getWeight() {
        return weight;
    }
}
