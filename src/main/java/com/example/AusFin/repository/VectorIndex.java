package com.example.AusFin.repository;

import com.example.AusFin.model.IndexHit;
import com.example.AusFin.model.Passage;

import java.util.List;
import java.util.Optional;

/**
 * Nearest-neighbour search over passage embeddings. Implementations may throw any
 * runtime exception on outage; the retriever converts it to an index failure.
 */
public interface VectorIndex {

    /**
     * @return at most {@code topK} hits, most similar first; scores are cosine similarities
     */
    List<IndexHit> search(float[] embedding, int topK);

    Optional<Passage> fetch(String passageId);
}
