package com.cropcopilot.advisor.model.compliance;

import lombok.Builder;
import lombok.Value;

/**
 * A product in the finalized application plan.
 */
@Value
@Builder
public class PlannedProduct {
    String productId;
    String productName;
    String productType;

    /**
     * Free text such as {@code "15 oz/acre"}; may be null.
     */
    String applicationRate;

    String reason;
}
