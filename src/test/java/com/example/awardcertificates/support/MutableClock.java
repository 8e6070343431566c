package com.example.awardcertificates.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that tests can move explicitly.
 */
public class MutableClock extends Clock {

    private static final ZoneId ZONE = ZoneOffset.UTC;

    private volatile Instant instant;

    public MutableClock(LocalDateTime start) {
        this.instant = start.toInstant(ZoneOffset.UTC);
    }

    public void set(LocalDateTime time) {
        this.instant = time.toInstant(ZoneOffset.UTC);
    }

    public void advance(Duration duration) {
        this.instant = instant.plus(duration);
    }

    @Override
    public ZoneId getZone() {
        return ZONE;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return Clock.fixed(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
