package com.cropcopilot.advisor.exception;

/**
 * The generative model answered but no JSON object could be read from it.
 */
public class ModelOutputParseException extends Exception {

    public ModelOutputParseException(String message) {
        super(message);
    }

    public ModelOutputParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
