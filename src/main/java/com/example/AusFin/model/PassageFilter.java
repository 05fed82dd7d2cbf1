package com.example.AusFin.model;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Metadata filter applied to index candidates. Empty sets and a null date mean "no constraint".
 *
 * @param documentTypes  allowed document types (case-insensitive)
 * @param authorities    allowed issuing authorities (case-insensitive)
 * @param publishedAfter keep only passages published on or after this date; undated passages are dropped
 */
public record PassageFilter(
        Set<String> documentTypes,
        Set<String> authorities,
        LocalDate publishedAfter
) {
    public static final PassageFilter NONE = new PassageFilter(Set.of(), Set.of(), null);

    public PassageFilter {
        documentTypes = normalise(documentTypes);
        authorities = normalise(authorities);
    }

    public boolean accepts(Passage passage) {
        SourceMetadata meta = passage.metadata();
        if (!documentTypes.isEmpty()
                && (meta.documentType() == null || !documentTypes.contains(meta.documentType().toLowerCase(Locale.ROOT)))) {
            return false;
        }
        if (!authorities.isEmpty()
                && (meta.authority() == null || !authorities.contains(meta.authority().toLowerCase(Locale.ROOT)))) {
            return false;
        }
        if (publishedAfter != null
                && (meta.publishedDate() == null || meta.publishedDate().isBefore(publishedAfter))) {
            return false;
        }
        return true;
    }

    private static Set<String> normalise(Set<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
