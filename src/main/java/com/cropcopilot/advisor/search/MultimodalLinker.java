package com.cropcopilot.advisor.search;

import com.cropcopilot.advisor.model.retrieval.CandidateMetadata;
import com.cropcopilot.advisor.model.retrieval.ImageLinkResult;
import com.cropcopilot.advisor.model.retrieval.ImageObservation;
import com.cropcopilot.advisor.model.retrieval.RetrievedCandidate;
import com.cropcopilot.advisor.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Links each image observation to the text passage it most plausibly
 * illustrates, by tag overlap (weight 0.7) and document proximity (0.3).
 *
 * <p>A passage with no shared tag is never linked, whatever its position.
 */
@Component
public class MultimodalLinker {

    static final double TAG_WEIGHT = 0.7;
    static final double POSITION_WEIGHT = 0.3;
    static final double POSITION_WINDOW = 10.0;

    public List<ImageLinkResult> link(List<ImageObservation> images, List<RetrievedCandidate> candidates) {
        return images.stream()
                .map(image -> linkOne(image, candidates))
                .collect(Collectors.toList());
    }

    ImageLinkResult linkOne(ImageObservation image, List<RetrievedCandidate> candidates) {
        RetrievedCandidate best = null;
        double bestScore = 0;

        for (RetrievedCandidate candidate : candidates) {
            CandidateMetadata metadata = candidate.getMetadata();
            List<String> candidateTags = metadata == null ? List.of() : metadata.tagsOrEmpty();
            double tagScore = overlapScore(image.getTags(), candidateTags);
            if (tagScore == 0) {
                continue;
            }
            Integer chunkPosition = metadata.getPosition();
            double score = tagScore * TAG_WEIGHT + positionScore(image.getPosition(), chunkPosition) * POSITION_WEIGHT;
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        return ImageLinkResult.builder()
                .imageId(image.getImageId())
                .linkedChunkId(best != null ? best.getChunkId() : null)
                .score(round4(bestScore))
                .build();
    }

    /**
     * Matched tags of {@code a} over the larger tag count, case-insensitive.
     */
    static double overlapScore(List<String> a, List<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        Set<String> lowerB = new HashSet<>(TextNormalizer.lowerAll(b));
        long matched = TextNormalizer.lowerAll(a).stream().filter(lowerB::contains).count();
        return (double) matched / Math.max(a.size(), b.size());
    }

    static double positionScore(Integer imagePosition, Integer chunkPosition) {
        if (imagePosition == null || chunkPosition == null) {
            return 0;
        }
        int delta = Math.abs(imagePosition - chunkPosition);
        return Math.max(0, 1 - delta / POSITION_WINDOW);
    }

    private static double round4(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
