package com.slapulse.model;

import java.time.Instant;

public record Note(Instant createdAt) {
}
