package com.cropcopilot.advisor.util;

import com.cropcopilot.advisor.model.CallContext;
import com.cropcopilot.advisor.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging utility for all external service calls (Ollama, Gemini, Postgres).
 * Provides consistent, structured request/response logging.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
