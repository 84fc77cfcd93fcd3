package com.cropcopilot.advisor.model.corpus;

import com.cropcopilot.advisor.model.retrieval.ImageLinkResult;
import lombok.Value;

import java.util.List;

@Value
public class IngestionReport {
    String sourceId;
    int chunkCount;
    int embeddedCount;
    String status;
    List<ImageLinkResult> imageLinks;
}
