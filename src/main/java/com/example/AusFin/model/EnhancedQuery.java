package com.example.AusFin.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Output of query enhancement.
 *
 * @param original the question exactly as the user asked it
 * @param text     retrieval-optimised text (equals {@code original} when nothing matched)
 * @param intent   advisory intent tag, GENERAL when unsure
 * @param entities detected amounts, ages, dates and tickers in order of appearance
 */
public record EnhancedQuery(
        String original,
        String text,
        Intent intent,
        List<QueryEntity> entities
) {
    public EnhancedQuery {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public Optional<BigDecimal> firstValue(EntityType type) {
        return entities.stream()
                .filter(e -> e.type() == type && e.value() != null)
                .map(QueryEntity::value)
                .findFirst();
    }
}
