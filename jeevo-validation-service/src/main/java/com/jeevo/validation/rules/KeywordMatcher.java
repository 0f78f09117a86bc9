package com.jeevo.validation.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive, word-bounded keyword search over free text.
 * Keywords are reported in the order they were configured.
 */
public final class KeywordMatcher {

    private static final String BOUNDARY_BEFORE = "(?<![\\p{L}\\p{N}])";
    private static final String BOUNDARY_AFTER = "(?![\\p{L}\\p{N}])";

    private final List<String> keywords;
    private final List<Pattern> patterns;

    private KeywordMatcher(List<String> keywords, List<Pattern> patterns) {
        this.keywords = keywords;
        this.patterns = patterns;
    }

    public static KeywordMatcher of(List<String> keywords) {
        return of(keywords, List.of());
    }

    /**
     * @param keywords     literal terms, matched on word boundaries
     * @param extraRegexes additional case-insensitive regular expressions, reported by their source text
     */
    public static KeywordMatcher of(List<String> keywords, List<String> extraRegexes) {
        List<String> names = new ArrayList<>();
        List<Pattern> compiled = new ArrayList<>();
        for (String keyword : keywords == null ? List.<String>of() : keywords) {
            String normalized = normalize(keyword).trim();
            if (normalized.isEmpty()) continue;
            names.add(normalized);
            compiled.add(Pattern.compile(BOUNDARY_BEFORE + Pattern.quote(normalized) + BOUNDARY_AFTER));
        }
        for (String regex : extraRegexes == null ? List.<String>of() : extraRegexes) {
            if (regex == null || regex.isBlank()) continue;
            names.add(regex);
            compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        return new KeywordMatcher(List.copyOf(names), List.copyOf(compiled));
    }

    public List<String> findAll(String text) {
        if (text == null || text.isBlank()) return List.of();
        String normalized = normalize(text);
        List<String> found = new ArrayList<>();
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).matcher(normalized).find()) {
                found.add(keywords.get(i));
            }
        }
        return found;
    }

    public boolean matchesAny(String text) {
        if (text == null || text.isBlank()) return false;
        String normalized = normalize(text);
        return patterns.stream().anyMatch(p -> p.matcher(normalized).find());
    }

    public List<String> keywords() {
        return keywords;
    }

    /**
     * True when {@code term} occurs in {@code text} on word boundaries.
     */
    public static boolean containsTerm(String text, String term) {
        if (text == null || term == null) return false;
        String normalizedTerm = normalize(term).trim();
        if (normalizedTerm.isEmpty()) return false;
        return Pattern.compile(BOUNDARY_BEFORE + Pattern.quote(normalizedTerm) + BOUNDARY_AFTER)
                .matcher(normalize(text))
                .find();
    }

    public static String normalize(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT)
                .replace('’', '\'')
                .replace('‘', '\'')
                .replaceAll("\\s+", " ");
    }
}
