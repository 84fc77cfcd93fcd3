package com.cropcopilot.advisor.knowledge;

import com.cropcopilot.advisor.knowledge.impl.JpaReferenceCorpusStore;
import com.cropcopilot.advisor.model.corpus.DocumentSection;
import com.cropcopilot.advisor.model.corpus.IngestionReport;
import com.cropcopilot.advisor.model.corpus.ReferenceDocument;
import com.cropcopilot.advisor.model.corpus.ReferenceSourceEntity;
import com.cropcopilot.advisor.model.corpus.SourceBoostEntity;
import com.cropcopilot.advisor.model.corpus.TaggedChunk;
import com.cropcopilot.advisor.model.corpus.TextChunkEntity;
import com.cropcopilot.advisor.model.retrieval.CandidateMetadata;
import com.cropcopilot.advisor.model.retrieval.ImageLinkResult;
import com.cropcopilot.advisor.model.retrieval.ImageObservation;
import com.cropcopilot.advisor.model.retrieval.RetrievedCandidate;
import com.cropcopilot.advisor.model.retrieval.SourceType;
import com.cropcopilot.advisor.repository.ReferenceSourceRepository;
import com.cropcopilot.advisor.repository.SourceBoostRepository;
import com.cropcopilot.advisor.repository.TextChunkRepository;
import com.cropcopilot.advisor.search.MultimodalLinker;
import com.cropcopilot.advisor.util.TextNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Adds a reference document to the retrieval corpus.
 *
 * <p>Sections are chunked and tagged, chunks are stored and embedded when the
 * embedding service is up, and document images are linked to the stored
 * chunks. A source whose chunks could not be embedded is still searchable
 * through the lexical path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceIngestionService {

    private final ComplianceChunker chunker;
    private final EmbeddingService embeddingService;
    private final MultimodalLinker imageLinker;
    private final ReferenceSourceRepository sourceRepository;
    private final SourceBoostRepository boostRepository;
    private final TextChunkRepository chunkRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public IngestionReport ingest(ReferenceDocument document) {
        Objects.requireNonNull(document.getSourceId(), "sourceId is required");
        long start = System.currentTimeMillis();
        log.info("📥 Ingesting reference source {} ({} sections)", document.getSourceId(), document.getSections().size());

        ReferenceSourceEntity source = sourceRepository.findById(document.getSourceId())
                .orElseGet(() -> ReferenceSourceEntity.builder().id(document.getSourceId()).build());
        source.setTitle(document.getTitle());
        source.setSourceType((document.getSourceType() == null ? SourceType.OTHER : document.getSourceType()).getValue());
        source.setInstitution(document.getInstitution());
        source.setUrl(document.getUrl());
        source.setStatus(ReferenceSourceEntity.STATUS_PENDING);
        sourceRepository.save(source);
        if (document.getSourceBoost() != null) {
            boostRepository.save(new SourceBoostEntity(document.getSourceId(), document.getSourceBoost(), clock.instant()));
        }

        List<String> imageTags = imageTags(document.getImages());
        List<TaggedChunk> chunks = chunkSections(document.getSections());
        List<RetrievedCandidate> stored = new ArrayList<>(chunks.size());
        List<TextChunkEntity> entities = new ArrayList<>(chunks.size());

        for (TaggedChunk chunk : chunks) {
            CandidateMetadata metadata = CandidateMetadata.builder()
                    .crops(document.getCrops())
                    .topics(chunk.getTags())
                    .tags(chunkTags(chunk, imageTags))
                    .region(document.getRegion())
                    .position(chunk.getPosition())
                    .updatedAt(clock.instant().toString())
                    .build();
            TextChunkEntity entity = TextChunkEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .sourceId(document.getSourceId())
                    .content(chunk.getContent())
                    .metadata(toJson(metadata))
                    .position(chunk.getPosition())
                    .tokenCount(chunk.getTokenCount())
                    .build();
            entities.add(entity);
            stored.add(RetrievedCandidate.builder()
                    .chunkId(entity.getId())
                    .sourceId(entity.getSourceId())
                    .content(entity.getContent())
                    .sourceType(SourceType.fromValue(source.getSourceType()))
                    .sourceTitle(source.getTitle())
                    .metadata(metadata)
                    .build());
        }
        chunkRepository.saveAll(entities);
        chunkRepository.flush();

        int embedded = embed(entities);
        source.setStatus(embedded == entities.size() && !entities.isEmpty()
                ? ReferenceSourceEntity.STATUS_READY
                : ReferenceSourceEntity.STATUS_PROCESSED);
        sourceRepository.save(source);

        List<ImageLinkResult> links = imageLinker.link(document.getImages(), stored);
        log.info("✅ Source {} ingested in {}ms: {} chunks, {} embedded, {}/{} images linked",
                document.getSourceId(), System.currentTimeMillis() - start, entities.size(), embedded,
                links.stream().filter(link -> link.getLinkedChunkId() != null).count(), links.size());

        return new IngestionReport(document.getSourceId(), entities.size(), embedded, source.getStatus(), links);
    }

    private List<TaggedChunk> chunkSections(List<DocumentSection> sections) {
        List<TaggedChunk> chunks = new ArrayList<>();
        for (DocumentSection section : sections) {
            chunks.addAll(chunker.chunk(section.getHeading(), section.getText(), chunks.size()));
        }
        return chunks;
    }

    /**
     * @return number of chunks whose embedding was written
     */
    private int embed(List<TextChunkEntity> entities) {
        if (entities.isEmpty() || !embeddingService.isEnabled()) {
            return 0;
        }
        Optional<List<List<Double>>> vectors = embeddingService.embedAll(
                entities.stream().map(TextChunkEntity::getContent).collect(Collectors.toList()));
        if (vectors.isEmpty() || vectors.get().size() != entities.size()) {
            log.warn("⚠️  Embeddings unavailable for {} chunks, source stays lexical-only", entities.size());
            return 0;
        }
        int written = 0;
        for (int i = 0; i < entities.size(); i++) {
            written += chunkRepository.updateEmbedding(entities.get(i).getId(),
                    JpaReferenceCorpusStore.toVectorLiteral(vectors.get().get(i)));
        }
        return written;
    }

    /**
     * Compliance tags plus every image tag the chunk text mentions, so image
     * captions can be matched against passages.
     */
    static List<String> chunkTags(TaggedChunk chunk, List<String> imageTags) {
        Set<String> tags = new LinkedHashSet<>(chunk.getTags());
        String content = chunk.getContent().toLowerCase(Locale.ROOT);
        for (String tag : imageTags) {
            if (Pattern.compile("\\b" + Pattern.quote(tag) + "\\b").matcher(content).find()) {
                tags.add(tag);
            }
        }
        return List.copyOf(tags);
    }

    private static List<String> imageTags(List<ImageObservation> images) {
        return images.stream()
                .flatMap(image -> TextNormalizer.lowerAll(image.getTags()).stream())
                .map(String::trim)
                .filter(tag -> !tag.isBlank())
                .distinct()
                .collect(Collectors.toList());
    }

    private String toJson(CandidateMetadata metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize chunk metadata", e);
        }
    }
}
