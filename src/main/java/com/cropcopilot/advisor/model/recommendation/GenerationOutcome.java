package com.cropcopilot.advisor.model.recommendation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of attempting generative synthesis.
 *
 * <p>Exactly one of three shapes:
 * <ul>
 *   <li>{@link Status#OK} - parsed model output plus the model name</li>
 *   <li>{@link Status#UNAVAILABLE} - service not configured, failed or timed out</li>
 *   <li>{@link Status#INVALID} - service answered but no usable JSON object was found</li>
 * </ul>
 * Only {@code OK} carries a {@link ModelOutput}.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GenerationOutcome {

    public enum Status {
        OK,
        UNAVAILABLE,
        INVALID
    }

    private final Status status;
    private final ModelOutput output;
    private final String model;
    private final String reason;

    public static GenerationOutcome ok(String model, ModelOutput output) {
        if (output == null) {
            throw new IllegalArgumentException("OK outcome requires model output");
        }
        return new GenerationOutcome(Status.OK, output, model, null);
    }

    public static GenerationOutcome unavailable(String reason) {
        return new GenerationOutcome(Status.UNAVAILABLE, null, null, reason);
    }

    public static GenerationOutcome invalid(String model, String reason) {
        return new GenerationOutcome(Status.INVALID, null, model, reason);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
