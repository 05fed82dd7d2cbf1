package com.example.AusFin.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses citation markers out of an untrusted completion. Only ids on the allow-list survive;
 * everything else that looks like a passage citation is stripped and reported.
 */
public final class CitationParser {

    private CitationParser() {
    }

    /**
     * Documented marker: [P:id] or [P:id1, id2]. Full-width brackets are accepted too.
     */
    private static final Pattern MARKER = Pattern.compile(
            "[\\[【]\\s*P\\s*:\\s*([^\\[\\]【】]*)[\\]】]",
            Pattern.CASE_INSENSITIVE
    );

    /**
     * "[P:" that never closes, e.g. a truncated completion.
     */
    private static final Pattern DANGLING = Pattern.compile(
            "[\\[【]\\s*P\\s*:\\s*[^\\s\\[\\]【】]*(?![^\\[\\]【】]*[\\]】])",
            Pattern.CASE_INSENSITIVE
    );

    /**
     * Bare [id]; only rewritten when the id is on the allow-list.
     */
    private static final Pattern BARE = Pattern.compile(
            "\\[([A-Za-z0-9][A-Za-z0-9._:\\-]{0,127})\\]"
    );

    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("[ \\t]+([.,;:!?])");
    private static final Pattern REPEATED_SPACES = Pattern.compile("[ \\t]{2,}");

    public static ParsedCompletion parse(String raw, Collection<String> allowedIds) {
        if (raw == null || raw.isBlank()) {
            return new ParsedCompletion("", List.of(), List.of());
        }
        Set<String> allowed = Set.copyOf(allowedIds);
        Set<String> cited = new LinkedHashSet<>();
        List<String> rejected = new ArrayList<>();

        String text = rewriteMarkers(raw, allowed, cited, rejected);
        text = stripDangling(text, rejected);
        text = rewriteBare(text, allowed, cited);

        text = SPACE_BEFORE_PUNCTUATION.matcher(text).replaceAll("$1");
        text = REPEATED_SPACES.matcher(text).replaceAll(" ");
        return new ParsedCompletion(text.trim(), List.copyOf(cited), List.copyOf(rejected));
    }

    private static String rewriteMarkers(String raw, Set<String> allowed, Set<String> cited, List<String> rejected) {
        Matcher matcher = MARKER.matcher(raw);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            List<String> kept = new ArrayList<>();
            for (String part : matcher.group(1).split("[,;]")) {
                String id = stripPrefix(part.trim());
                if (id.isEmpty()) {
                    continue;
                }
                if (allowed.contains(id)) {
                    kept.add(id);
                    cited.add(id);
                } else {
                    rejected.add(id);
                }
            }
            String replacement = kept.stream()
                    .distinct()
                    .map(CitationParser::marker)
                    .collect(Collectors.joining());
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String stripDangling(String text, List<String> rejected) {
        Matcher matcher = DANGLING.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            rejected.add(matcher.group().trim());
            matcher.appendReplacement(sb, "");
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String rewriteBare(String text, Set<String> allowed, Set<String> cited) {
        Matcher matcher = BARE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String id = matcher.group(1);
            if (allowed.contains(id)) {
                cited.add(id);
                matcher.appendReplacement(sb, Matcher.quoteReplacement(marker(id)));
            } else {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group()));
            }
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String stripPrefix(String id) {
        if (id.length() >= 2 && id.regionMatches(true, 0, "P:", 0, 2)) {
            return id.substring(2).trim();
        }
        return id;
    }

    public static String marker(String passageId) {
        return "[P:" + passageId + "]";
    }

    /**
     * @param text     completion with only allow-listed markers, normalised to [P:id]
     * @param citedIds allow-listed ids in first-citation order
     * @param rejected marker contents that were removed
     */
    public record ParsedCompletion(String text, List<String> citedIds, List<String> rejected) {
    }
}
