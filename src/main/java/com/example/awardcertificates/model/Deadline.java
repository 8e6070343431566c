package com.example.awardcertificates.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Institution-wide submission cutoff. A call made exactly at the deadline
 * instant is still accepted.
 */
public record Deadline(LocalDateTime timestamp) {

    public Deadline {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public boolean hasPassed(LocalDateTime now) {
        return now.isAfter(timestamp);
    }
}
