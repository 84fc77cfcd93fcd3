package com.cropcopilot.advisor.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class RetrievalProperties {

    /**
     * Requested candidate count N; the vector path returns up to 2N.
     */
    @Min(1)
    private int limit = 18;

    /**
     * Top-K ranked candidates assembled into model context.
     */
    @Min(1)
    private int contextCandidates = 6;

    private boolean mmrEnabled = false;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double mmrLambda = 0.6;

    @Min(1)
    private int lexicalTermCap = 10;

    @Min(1)
    private int minLexicalTermLength = 4;
}
