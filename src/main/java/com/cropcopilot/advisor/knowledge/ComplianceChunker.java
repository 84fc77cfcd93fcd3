package com.cropcopilot.advisor.knowledge;

import com.cropcopilot.advisor.model.corpus.SemanticChunk;
import com.cropcopilot.advisor.model.corpus.TaggedChunk;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Semantic chunking for label and regulatory text, tagging each chunk with
 * the compliance topics it mentions.
 */
@Component
@RequiredArgsConstructor
public class ComplianceChunker {

    public static final String GENERAL_TAG = "general";

    private static final Map<String, Pattern> TAG_PATTERNS = new LinkedHashMap<>();

    static {
        TAG_PATTERNS.put("rei", Pattern.compile("\\brei\\b|re-entry interval|restricted entry"));
        TAG_PATTERNS.put("phi", Pattern.compile("\\bphi\\b|pre-harvest interval|pre harvest"));
        TAG_PATTERNS.put("dose_limit", Pattern.compile("max(imum)?[^\\n]{0,30}(rate|dose)|seasonal maximum"));
        TAG_PATTERNS.put("crop_stage", Pattern.compile("crop stage|growth stage|before bloom|after emergence"));
        TAG_PATTERNS.put("jurisdiction", Pattern.compile("state|jurisdiction|county|federal|label"));
        TAG_PATTERNS.put("restriction", Pattern.compile("except|unless|do not apply|prohibited|restricted"));
    }

    private final SemanticChunker semanticChunker;

    /**
     * @param startPosition position assigned to the first chunk; later chunks count up from it
     */
    public List<TaggedChunk> chunk(String section, String text, int startPosition) {
        List<SemanticChunk> chunks = semanticChunker.chunk(section, text);
        List<TaggedChunk> tagged = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            SemanticChunk chunk = chunks.get(i);
            tagged.add(new TaggedChunk(
                    chunk.getSection(),
                    chunk.getContent(),
                    chunk.getTokenCount(),
                    startPosition + i,
                    detectTags(chunk.getContent())));
        }
        return tagged;
    }

    public static List<String> detectTags(String text) {
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
        List<String> tags = new ArrayList<>();
        TAG_PATTERNS.forEach((tag, pattern) -> {
            if (pattern.matcher(normalized).find()) {
                tags.add(tag);
            }
        });
        if (tags.isEmpty()) {
            tags.add(GENERAL_TAG);
        }
        return List.copyOf(tags);
    }
}
