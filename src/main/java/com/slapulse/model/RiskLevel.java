package com.slapulse.model;

public enum RiskLevel {
    ON_TRACK,
    WATCH,
    AT_RISK
}
