package com.jasmin.outbreakguard.models;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/** Closed time range [from, to] that one detection pass evaluates. */
@Value
public class EvaluationWindow {
    Instant from;
    Instant to;

    public EvaluationWindow(Instant from, Instant to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("window bounds must be provided");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("window end " + to + " is before start " + from);
        }
        this.from = from;
        this.to = to;
    }

    public static EvaluationWindow between(Instant from, Instant to) {
        return new EvaluationWindow(from, to);
    }

    public static EvaluationWindow endingAt(Instant to, Duration length) {
        return new EvaluationWindow(to.minus(length), to);
    }

    public boolean contains(Instant ts) {
        return !ts.isBefore(from) && !ts.isAfter(to);
    }
}
