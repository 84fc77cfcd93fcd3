package com.cropcopilot.advisor.model.corpus;

import lombok.Value;

/**
 * A headed section of a reference document.
 */
@Value
public class DocumentSection {
    String heading;
    String text;
}
