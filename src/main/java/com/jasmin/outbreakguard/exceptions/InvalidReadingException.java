package com.jasmin.outbreakguard.exceptions;

import lombok.Getter;

import java.util.List;

/** A reading is missing required fields or carries non-finite values. */
@Getter
public class InvalidReadingException extends SurveillanceException {
    private final List<String> problems;

    public InvalidReadingException(List<String> problems) {
        super("invalid reading: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
