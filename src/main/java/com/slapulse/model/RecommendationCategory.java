package com.slapulse.model;

public enum RecommendationCategory {
    ASSIGNMENT,
    COMMUNICATION,
    PIPELINE,
    FINANCE,
    OPS
}
