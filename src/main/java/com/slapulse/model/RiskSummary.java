package com.slapulse.model;

public record RiskSummary(RiskLevel level, String headline, String detail) {
}
