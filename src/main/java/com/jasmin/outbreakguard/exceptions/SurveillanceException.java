package com.jasmin.outbreakguard.exceptions;

/** Root of the engine's failures. None of them is fatal to the calling process. */
public class SurveillanceException extends RuntimeException {

    public SurveillanceException(String message) {
        super(message);
    }

    public SurveillanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
