package com.example.AusFin.service;

import com.example.AusFin.model.EnhancedQuery;
import com.example.AusFin.model.EntityType;
import com.example.AusFin.model.Intent;
import com.example.AusFin.model.QueryEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites a question for retrieval:
 * - expands Australian finance abbreviations in place ("SG" becomes "SG (super guarantee)")
 * - tags the advisory intent by keyword scoring
 * - extracts amounts, ages, dates and tickers and appends them as hints
 *
 * Stateless; the lexicon and patterns are fixed at class load.
 */
@Service
public class QueryEnhancer {

    private static final Logger log = LoggerFactory.getLogger(QueryEnhancer.class);

    /**
     * Abbreviation or colloquial term to full term. All-caps keys match case-sensitively
     * so "td" inside ordinary prose is left alone; the rest match case-insensitively.
     */
    private static final Map<String, String> LEXICON = lexicon();

    private static final Map<Intent, List<Pattern>> INTENT_KEYWORDS = intentKeywords();

    private static final Set<String> KNOWN_TICKERS = Set.of(
            "VAS", "VGS", "A200", "IOZ", "NDQ", "IVV", "VAF", "VGB", "VDHG", "DHHF",
            "BHP", "CBA", "RIO", "ANZ", "NAB", "WBC", "CSL", "WES", "MQG", "TLS",
            "NST", "EVN", "NEM", "PMGOLD", "QAU", "GOLD"
    );

    private static final Pattern PREFIXED_AMOUNT = Pattern.compile(
            "(?i)(?:\\$|\\baud\\s?)\\s?(\\d{1,3}(?:,\\d{3})+|\\d+)(\\.\\d+)?\\s*(k|m|thousand|million)?\\b"
    );
    private static final Pattern SUFFIXED_AMOUNT = Pattern.compile(
            "(?i)\\b(\\d{1,3}(?:,\\d{3})+|\\d+)(\\.\\d+)?\\s*(k|m|thousand|million|dollars|aud)\\b"
    );
    private static final Pattern AGE_PHRASE = Pattern.compile(
            "(?i)\\b(?:aged?|i'?m|i am)\\s+(\\d{1,3})\\b(?!\\s*(?:k|m|%|dollars|thousand|million))"
    );
    private static final Pattern AGE_YEARS_OLD = Pattern.compile(
            "(?i)\\b(\\d{1,3})[\\s-]*(?:years?|yrs?|yo)[\\s-]*old\\b|\\b(\\d{1,3})\\s*yo\\b"
    );
    private static final Pattern FINANCIAL_YEAR = Pattern.compile(
            "(?i)\\b(?:FY\\s?)?(20\\d{2})\\s?[-/]\\s?(\\d{2})\\b|\\bFY\\s?(\\d{2})\\b"
    );
    private static final Pattern YEAR = Pattern.compile("\\b(19\\d{2}|20\\d{2})\\b");
    private static final Pattern ASX_TICKER = Pattern.compile("(?i)\\bASX\\s?:\\s?([A-Z0-9]{3,6})\\b");
    private static final Pattern BARE_TICKER = Pattern.compile("\\b([A-Z][A-Z0-9]{2,5})\\b");

    private static final int MAX_AGE = 120;

    public EnhancedQuery enhance(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        String original = rawQuery;

        List<QueryEntity> entities = extractEntities(original);
        Intent intent = detectIntent(original, entities);
        String expanded = expandTerms(original);
        String text = appendEntityHints(expanded, entities);

        log.debug("Enhanced query intent={} entities={} text='{}'", intent, entities.size(), text);
        return new EnhancedQuery(original, text, intent, entities);
    }

    String expandTerms(String query) {
        String result = query;
        for (Map.Entry<String, String> entry : LEXICON.entrySet()) {
            String term = entry.getKey();
            String expansion = entry.getValue();
            if (containsIgnoreCase(query, expansion) || containsIgnoreCase(result, expansion)) {
                continue;
            }
            Pattern pattern = termPattern(term);
            Matcher matcher = pattern.matcher(result);
            if (matcher.find()) {
                result = result.substring(0, matcher.end())
                        + " (" + expansion + ")"
                        + result.substring(matcher.end());
            }
        }
        return result;
    }

    Intent detectIntent(String query, List<QueryEntity> entities) {
        Map<Intent, Integer> scores = new EnumMap<>(Intent.class);
        for (Map.Entry<Intent, List<Pattern>> entry : INTENT_KEYWORDS.entrySet()) {
            int score = 0;
            for (Pattern keyword : entry.getValue()) {
                if (keyword.matcher(query).find()) {
                    score++;
                }
            }
            scores.put(entry.getKey(), score);
        }
        long tickers = entities.stream().filter(e -> e.type() == EntityType.TICKER).count();
        scores.merge(Intent.STOCKS, (int) tickers, Integer::sum);

        Intent best = Intent.GENERAL;
        int bestScore = 0;
        // EnumMap iterates in declaration order, so the first intent wins a tie.
        for (Map.Entry<Intent, Integer> entry : scores.entrySet()) {
            if (entry.getValue() > bestScore) {
                best = entry.getKey();
                bestScore = entry.getValue();
            }
        }
        return best;
    }

    List<QueryEntity> extractEntities(String query) {
        List<Span> spans = new ArrayList<>();

        collect(spans, PREFIXED_AMOUNT, query, m -> amount(m.group(), m.group(1), m.group(2), m.group(3)));
        collect(spans, SUFFIXED_AMOUNT, query, m -> amount(m.group(), m.group(1), m.group(2), m.group(3)));
        collect(spans, AGE_PHRASE, query, m -> age(m.group(), m.group(1)));
        collect(spans, AGE_YEARS_OLD, query, m -> age(m.group(), m.group(1) != null ? m.group(1) : m.group(2)));
        collect(spans, FINANCIAL_YEAR, query, QueryEnhancer::financialYear);
        collect(spans, YEAR, query, m -> new QueryEntity(EntityType.DATE, m.group(), new BigDecimal(m.group(1))));
        collect(spans, ASX_TICKER, query, m -> new QueryEntity(EntityType.TICKER, m.group(1).toUpperCase(Locale.ROOT), null));
        collect(spans, BARE_TICKER, query, m -> KNOWN_TICKERS.contains(m.group(1))
                ? new QueryEntity(EntityType.TICKER, m.group(1), null)
                : null);

        return spans.stream()
                .sorted(Comparator.comparingInt(Span::start))
                .map(Span::entity)
                .toList();
    }

    private String appendEntityHints(String text, List<QueryEntity> entities) {
        if (entities.isEmpty()) {
            return text;
        }
        String hints = entities.stream()
                .map(QueryEnhancer::hint)
                .distinct()
                .collect(Collectors.joining(" "));
        return text + " " + hints;
    }

    private static String hint(QueryEntity entity) {
        return switch (entity.type()) {
            case AMOUNT -> "[amount AUD " + entity.value().toPlainString() + "]";
            case AGE -> "[age " + entity.value().toPlainString() + "]";
            case DATE -> "[year " + entity.value().toPlainString() + "]";
            case TICKER -> "[ticker ASX:" + entity.text() + "]";
        };
    }

    private interface EntityFactory {
        QueryEntity create(Matcher matcher);
    }

    private static void collect(List<Span> spans, Pattern pattern, String query, EntityFactory factory) {
        Matcher matcher = pattern.matcher(query);
        while (matcher.find()) {
            int start = matcher.start();
            int end = matcher.end();
            if (spans.stream().anyMatch(s -> s.overlaps(start, end))) {
                continue;
            }
            QueryEntity entity = factory.create(matcher);
            if (entity != null) {
                spans.add(new Span(start, end, entity));
            }
        }
    }

    private static QueryEntity amount(String text, String digits, String fraction, String unit) {
        BigDecimal value = new BigDecimal(digits.replace(",", "") + (fraction == null ? "" : fraction));
        if (unit != null) {
            switch (unit.toLowerCase(Locale.ROOT)) {
                case "k", "thousand" -> value = value.multiply(BigDecimal.valueOf(1_000));
                case "m", "million" -> value = value.multiply(BigDecimal.valueOf(1_000_000));
                default -> {
                    // "dollars" / "aud" only mark the number as money
                }
            }
        }
        BigDecimal normalised = value.stripTrailingZeros();
        if (normalised.scale() < 0) {
            normalised = normalised.setScale(0);
        }
        return new QueryEntity(EntityType.AMOUNT, text.trim(), normalised);
    }

    private static QueryEntity age(String text, String digits) {
        int years = Integer.parseInt(digits);
        if (years <= 0 || years > MAX_AGE) {
            return null;
        }
        return new QueryEntity(EntityType.AGE, text.trim(), BigDecimal.valueOf(years));
    }

    private static QueryEntity financialYear(Matcher m) {
        if (m.group(1) != null) {
            return new QueryEntity(EntityType.DATE, m.group(), new BigDecimal(m.group(1)));
        }
        // FY25 ends in 2025, so it starts in 2024
        int endYear = 2000 + Integer.parseInt(m.group(3));
        return new QueryEntity(EntityType.DATE, m.group(), BigDecimal.valueOf(endYear - 1));
    }

    private static Pattern termPattern(String term) {
        boolean caseSensitive = term.equals(term.toUpperCase(Locale.ROOT));
        String regex = "(?<![\\w-])" + Pattern.quote(term) + "(?![\\w:-])";
        return caseSensitive ? Pattern.compile(regex) : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static boolean containsIgnoreCase(String text, String fragment) {
        return text.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }

    private static Map<String, String> lexicon() {
        Map<String, String> lexicon = new LinkedHashMap<>();
        lexicon.put("super", "superannuation");
        lexicon.put("SG", "super guarantee");
        lexicon.put("SMSF", "self-managed super fund");
        lexicon.put("TTR", "transition to retirement");
        lexicon.put("FHSS", "First Home Super Saver scheme");
        lexicon.put("CGT", "capital gains tax");
        lexicon.put("ETF", "exchange traded fund");
        lexicon.put("ETFs", "exchange traded funds");
        lexicon.put("ATO", "Australian Taxation Office");
        lexicon.put("ASX", "Australian Securities Exchange");
        lexicon.put("ASIC", "Australian Securities and Investments Commission");
        lexicon.put("ABS", "Australian Bureau of Statistics");
        lexicon.put("RBA", "Reserve Bank of Australia");
        lexicon.put("TD", "term deposit");
        lexicon.put("HISA", "high interest savings account");
        lexicon.put("EF", "emergency fund");
        lexicon.put("emergency fund", "emergency savings buffer cash reserve");
        lexicon.put("gold", "gold bullion precious metals");
        lexicon.put("silver", "silver bullion precious metals");
        return lexicon;
    }

    private static Map<Intent, List<Pattern>> intentKeywords() {
        Map<Intent, List<String>> words = new EnumMap<>(Intent.class);
        words.put(Intent.EMERGENCY_FUND, List.of("emergency fund", "emergency savings", "emergency",
                "rainy day", "cash buffer", "safety net", "EF"));
        words.put(Intent.SUPER, List.of("super", "salary sacrific", "concessional", "retire", "smsf",
                "super guarantee", "contribution"));
        words.put(Intent.ALLOCATION, List.of("allocat", "portfolio", "asset mix", "diversif", "rebalanc",
                "growth assets", "defensive assets", "invest"));
        words.put(Intent.METALS, List.of("gold", "silver", "platinum", "bullion", "precious metal", "perth mint"));
        words.put(Intent.STOCKS, List.of("asx", "share", "stock", "etf", "dividend", "equities", "franking"));

        Map<Intent, List<Pattern>> patterns = new EnumMap<>(Intent.class);
        words.forEach((intent, keywords) -> patterns.put(intent, keywords.stream()
                .map(k -> k.equals(k.toUpperCase(Locale.ROOT))
                        ? Pattern.compile("\\b" + Pattern.quote(k) + "\\b")
                        : Pattern.compile("\\b" + Pattern.quote(k), Pattern.CASE_INSENSITIVE))
                .toList()));
        return patterns;
    }

    private record Span(int start, int end, QueryEntity entity) {
        boolean overlaps(int otherStart, int otherEnd) {
            return otherStart < end && start < otherEnd;
        }
    }
}
