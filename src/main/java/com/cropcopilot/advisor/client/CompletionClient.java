package com.cropcopilot.advisor.client;

/**
 * Generative text completion.
 */
public interface CompletionClient {

    /**
     * @return false when no credentials are configured; callers skip the call
     */
    boolean isConfigured();

    /**
     * Name of the model that answers {@link #complete}.
     */
    String modelName();

    /**
     * Send one system + user prompt pair and return the raw text answer.
     *
     * @throws CompletionException when the service fails, times out or
     *                             returns no text
     */
    String complete(String systemPrompt, String userPrompt);

    class CompletionException extends RuntimeException {

        public CompletionException(String message) {
            super(message);
        }

        public CompletionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
