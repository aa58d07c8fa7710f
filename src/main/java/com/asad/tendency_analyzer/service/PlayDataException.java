package com.asad.tendency_analyzer.service;

/**
 * The play feed could not be loaded: missing file, bad CSV, missing column or a
 * non-numeric value where a number is required.
 */
public class PlayDataException extends RuntimeException {

    public PlayDataException(String message) {
        super(message);
    }

    public PlayDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
