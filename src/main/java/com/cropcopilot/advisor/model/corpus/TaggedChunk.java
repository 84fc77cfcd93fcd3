package com.cropcopilot.advisor.model.corpus;

import lombok.Value;

import java.util.List;

/**
 * A semantic chunk with its running position in the document and the
 * topic tags detected in its text.
 */
@Value
public class TaggedChunk {
    String section;
    String content;
    int tokenCount;
    int position;
    List<String> tags;
}
