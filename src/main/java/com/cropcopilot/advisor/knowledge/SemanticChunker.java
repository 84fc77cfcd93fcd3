package com.cropcopilot.advisor.knowledge;

import com.cropcopilot.advisor.model.corpus.SemanticChunk;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits section text into paragraph-bounded chunks within a token budget.
 *
 * <p>Tokens are estimated as {@code ceil(length / 4)}. A chunk is closed only
 * once it holds at least {@code minTokens} and the next paragraph would push
 * it past {@code maxTokens}; the following chunk then starts with the
 * trailing sentences of the closed one (up to {@code overlapTokens}). A single
 * paragraph larger than {@code maxTokens} is kept whole.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class SemanticChunker {

    public static final int DEFAULT_MIN_TOKENS = 180;
    public static final int DEFAULT_MAX_TOKENS = 520;
    public static final int DEFAULT_OVERLAP_TOKENS = 60;

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\n+");
    private static final Pattern SENTENCE = Pattern.compile("[^.!?]+[.!?]?");

    public List<SemanticChunk> chunk(String section, String text) {
        return chunk(section, text, DEFAULT_MIN_TOKENS, DEFAULT_MAX_TOKENS, DEFAULT_OVERLAP_TOKENS);
    }

    public List<SemanticChunk> chunk(String section, String text, int minTokens, int maxTokens, int overlapTokens) {
        if (minTokens > maxTokens) {
            throw new IllegalArgumentException("minTokens must not exceed maxTokens");
        }
        String heading = section == null ? "" : section;
        List<String> paragraphs = new ArrayList<>();
        for (String paragraph : PARAGRAPH_BREAK.split(text == null ? "" : text)) {
            String trimmed = paragraph.trim();
            if (!trimmed.isEmpty()) {
                paragraphs.add(trimmed);
            }
        }

        List<SemanticChunk> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder(heading).append("\n\n");
        int currentTokens = estimateTokens(current);

        for (String paragraph : paragraphs) {
            int paragraphTokens = estimateTokens(paragraph);

            if (currentTokens + paragraphTokens > maxTokens && currentTokens >= minTokens) {
                chunks.add(new SemanticChunk(heading, current.toString().trim(), currentTokens));

                String overlap = extractOverlap(current.toString(), overlapTokens);
                current = new StringBuilder(heading).append("\n\n");
                if (!overlap.isEmpty()) {
                    current.append(overlap).append("\n\n");
                }
                current.append(paragraph);
                currentTokens = estimateTokens(current);
                continue;
            }

            if (!endsWithBlankLine(current)) {
                current.append("\n\n");
            }
            current.append(paragraph);
            currentTokens = estimateTokens(current);
        }

        String tail = current.toString().trim();
        if (!tail.isEmpty() && !paragraphs.isEmpty()) {
            chunks.add(new SemanticChunk(heading, tail, currentTokens));
        }
        return chunks;
    }

    public static int estimateTokens(CharSequence text) {
        return (text.length() + 3) / 4;
    }

    /**
     * Trailing whole sentences of {@code content} whose combined estimate
     * stays within {@code overlapTokens}.
     */
    static String extractOverlap(String content, int overlapTokens) {
        List<String> sentences = new ArrayList<>();
        Matcher matcher = SENTENCE.matcher(content);
        while (matcher.find()) {
            sentences.add(matcher.group());
        }

        StringBuilder overlap = new StringBuilder();
        int running = 0;
        for (int i = sentences.size() - 1; i >= 0; i--) {
            String sentence = sentences.get(i).trim();
            if (sentence.isEmpty()) {
                continue;
            }
            int sentenceTokens = estimateTokens(sentence);
            if (running + sentenceTokens > overlapTokens) {
                break;
            }
            if (overlap.length() > 0) {
                overlap.insert(0, ' ');
            }
            overlap.insert(0, sentence);
            running += sentenceTokens;
        }
        return overlap.toString();
    }

    private static boolean endsWithBlankLine(StringBuilder text) {
        int length = text.length();
        return length >= 2 && text.charAt(length - 1) == '\n' && text.charAt(length - 2) == '\n';
    }
}
