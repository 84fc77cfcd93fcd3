package com.cropcopilot.advisor.model.prompt;

import lombok.Value;

@Value
public class RenderedPrompt {
    String systemPrompt;
    String userPrompt;
}
