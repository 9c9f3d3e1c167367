package com.mouse.tracker.utils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether a request URL belongs to the tracked API.
 * <p>
 * A URL matches when it contains the configured pattern (exact or case-insensitive),
 * or any alternate pattern. Only when no pattern is configured does the generic
 * API heuristic apply.
 */
public final class UrlMatcher {

    public static final List<String> API_HEURISTICS = List.of(
            "api/", "/api", "ajax", ".php", "json", "rest/", "/rest");

    private final String pattern;
    private final List<String> alternates;

    public UrlMatcher(String pattern, List<String> alternates) {
        this.pattern = pattern == null ? "" : pattern.trim();
        this.alternates = alternates == null
                ? List.of()
                : alternates.stream().filter(a -> a != null && !a.isBlank()).map(String::trim).toList();
    }

    public boolean matches(String url) {
        return matchedBy(url).isPresent();
    }

    /**
     * @return the pattern (or heuristic token) responsible for the match, if any
     */
    public Optional<String> matchedBy(String url) {
        if (url == null || url.isEmpty()) {
            return Optional.empty();
        }

        String lower = url.toLowerCase(Locale.ROOT);
        if (!pattern.isEmpty()) {
            if (url.contains(pattern) || lower.contains(pattern.toLowerCase(Locale.ROOT))) {
                return Optional.of(pattern);
            }
        }

        for (String alternate : alternates) {
            if (url.contains(alternate)) {
                return Optional.of(alternate);
            }
        }

        if (pattern.isEmpty()) {
            return API_HEURISTICS.stream().filter(lower::contains).findFirst();
        }
        return Optional.empty();
    }

    public String getPattern() {
        return pattern;
    }

    public List<String> getAlternates() {
        return alternates;
    }
}
