package com.example.AusFin.model;

import java.time.LocalDate;

/**
 * @param documentType  e.g. "guide", "regulation", "market-data", "news"
 * @param publishedDate publication date, may be null for undated material
 * @param authority     issuing body, e.g. "ATO", "ASIC", "ABS", "Perth Mint"
 * @param source        origin URL or file name
 */
public record SourceMetadata(
        String documentType,
        LocalDate publishedDate,
        String authority,
        String source
) {
}
