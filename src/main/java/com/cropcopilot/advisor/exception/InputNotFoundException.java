package com.cropcopilot.advisor.exception;

import lombok.Getter;

/**
 * No input snapshot exists for the (inputId, userId) pair. Fatal for the
 * request; the job is redelivered or dead-lettered by the queue.
 */
@Getter
public class InputNotFoundException extends RuntimeException {

    private final String inputId;

    public InputNotFoundException(String inputId) {
        super("Input snapshot was not found for inputId=" + inputId);
        this.inputId = inputId;
    }
}
