package com.cropcopilot.advisor.model.corpus;

import lombok.Value;

/**
 * A token-bounded passage cut from one section of a reference document.
 * {@code content} starts with the section heading.
 */
@Value
public class SemanticChunk {
    String section;
    String content;
    int tokenCount;
}
