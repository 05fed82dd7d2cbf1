package com.example.AusFin.service;

import com.example.AusFin.config.AdvisorProperties;
import com.example.AusFin.exception.IndexUnavailableException;
import com.example.AusFin.model.IndexHit;
import com.example.AusFin.model.Passage;
import com.example.AusFin.model.PassageFilter;
import com.example.AusFin.model.RetrievalOptions;
import com.example.AusFin.model.RetrievalResult;
import com.example.AusFin.model.ScoredPassage;
import com.example.AusFin.repository.VectorIndex;
import com.example.AusFin.util.Timeouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Retrieval-only service:
 * - embeds the (enhanced) query text
 * - asks the vector index for topK x candidateMultiplier candidates
 * - fetches passages, applies the metadata filter and the minScore cutoff
 * - orders deterministically and truncates to topK
 *
 * No chat/LLM calls happen here. An empty result is a normal outcome;
 * only an unreachable or failing index/embedding backend is an error.
 */
@Service
public class KnowledgeRetriever {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeRetriever.class);

    /**
     * Score desc, then newer publication first (undated last), then passage id.
     */
    static final Comparator<ScoredPassage> RANKING_ORDER = Comparator
            .comparingDouble(ScoredPassage::score).reversed()
            .thenComparing(KnowledgeRetriever::publishedDate, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(ScoredPassage::id);

    private final EmbeddingModel embeddingModel;
    private final VectorIndex vectorIndex;
    private final int candidateMultiplier;
    private final Duration timeout;

    public KnowledgeRetriever(EmbeddingModel embeddingModel, VectorIndex vectorIndex, AdvisorProperties properties) {
        this.embeddingModel = embeddingModel;
        this.vectorIndex = vectorIndex;
        this.candidateMultiplier = Math.max(1, properties.getRetrieval().getCandidateMultiplier());
        this.timeout = properties.getRetrieval().getTimeout();
    }

    public RetrievalResult retrieve(String queryText, RetrievalOptions options) {
        return retrieve(queryText, options.topK(), options.minScore(), options.filter());
    }

    public RetrievalResult retrieve(String queryText, int topK, double minScore, PassageFilter filter) {
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        // Re-validates topK and minScore.
        RetrievalOptions options = new RetrievalOptions(topK, minScore, filter);
        int candidates = options.topK() * candidateMultiplier;

        List<IndexHit> hits = callIndex("search", () -> {
            float[] embedding = embeddingModel.embed(queryText);
            return vectorIndex.search(embedding, candidates);
        });

        if (hits == null || hits.isEmpty()) {
            log.debug("Retrieval: no index hits for query='{}'", queryText);
            return RetrievalResult.empty(queryText);
        }

        List<IndexHit> aboveCutoff = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (IndexHit hit : hits) {
            double score = clamp(hit.score());
            if (hit.passageId() != null && seen.add(hit.passageId()) && score >= options.minScore()) {
                aboveCutoff.add(new IndexHit(hit.passageId(), score));
            }
        }

        List<ScoredPassage> kept = callIndex("fetch", () -> fetchAll(aboveCutoff, options.filter()));
        kept.sort(RANKING_ORDER);
        List<ScoredPassage> top = kept.size() > options.topK() ? kept.subList(0, options.topK()) : kept;

        log.debug("Retrieval: hits={}, aboveCutoff={}, kept={}, returned={} (minScore={})",
                hits.size(), aboveCutoff.size(), kept.size(), top.size(), options.minScore());
        return new RetrievalResult(queryText, top);
    }

    private List<ScoredPassage> fetchAll(List<IndexHit> hits, PassageFilter filter) {
        List<ScoredPassage> passages = new ArrayList<>();
        for (IndexHit hit : hits) {
            Optional<Passage> passage = vectorIndex.fetch(hit.passageId());
            if (passage.isEmpty()) {
                log.warn("Index returned passage {} which could not be fetched; skipping", hit.passageId());
                continue;
            }
            if (filter.accepts(passage.get())) {
                passages.add(new ScoredPassage(passage.get(), hit.score()));
            }
        }
        return passages;
    }

    private <T> T callIndex(String operation, Callable<T> call) {
        try {
            return Timeouts.callWithin(timeout, call);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            log.warn("Knowledge index {} failed: {}", operation, cause.toString());
            throw new IndexUnavailableException("Knowledge index " + operation + " failed: " + cause.getMessage(), cause);
        }
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static LocalDate publishedDate(ScoredPassage passage) {
        return passage.passage().metadata().publishedDate();
    }
}
