package com.vrecdat.webscrape;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceTitleAggregatorTest {

    @Test
    @DisplayName("Titles are unioned and failed sources left out")
    void testFetchAll() {
        FakeSource source = new FakeSource(Map.of(
            "https://a/1", Optional.of(Set.of("alpha", "beta")),
            "https://a/2", Optional.of(Set.of("beta", "gamma")),
            "https://a/3", Optional.of(Set.of())
        ));

        ReferenceTitles titles = new ReferenceTitleAggregator(source)
            .fetchAll(List.of("https://a/1", "https://a/2", "https://a/1", "https://a/3", "https://a/404"));

        assertEquals(Set.of("alpha", "beta", "gamma"), titles.all());
        assertEquals(List.of("https://a/1", "https://a/2", "https://a/3"), new ArrayList<>(titles.bySource().keySet()));
        assertTrue(titles.bySource().get("https://a/3").isEmpty());
        assertEquals(List.of("https://a/1", "https://a/2", "https://a/3", "https://a/404"), source.requested);
    }

    @Test
    @DisplayName("No URLs gives no titles")
    void testNoUrls() {
        ReferenceTitles titles = new ReferenceTitleAggregator(new FakeSource(Map.of())).fetchAll(List.of());
        assertTrue(titles.all().isEmpty());
        assertTrue(titles.bySource().isEmpty());
    }

    @Test
    @DisplayName("Homebrew and Japan variants are added once and sorted")
    void testExpandUrls() {
        List<String> urls = List.of("https://x/wiki/NES", "https://x/wiki/NES/Homebrew/", "https://x/wiki/SNES/");

        assertEquals(List.of("https://x/wiki/NES", "https://x/wiki/NES/Homebrew", "https://x/wiki/NES/Homebrew/",
                "https://x/wiki/SNES/", "https://x/wiki/SNES/Homebrew"),
            ReferenceTitleAggregator.expandUrls(urls, true, false));

        assertEquals(List.of("https://x/wiki/NES", "https://x/wiki/NES/Homebrew/", "https://x/wiki/NES/Homebrew/Japan",
                "https://x/wiki/NES/Japan", "https://x/wiki/SNES/", "https://x/wiki/SNES/Japan"),
            ReferenceTitleAggregator.expandUrls(urls, false, true));

        assertEquals(List.of("https://x/wiki/B", "https://x/wiki/a"),
            ReferenceTitleAggregator.expandUrls(List.of("https://x/wiki/a", "https://x/wiki/B", "https://x/wiki/a"), false, false));
    }

    static class FakeSource implements TitleSourceInterface {
        final Map<String, Optional<Set<String>>> pages;
        final List<String> requested = new ArrayList<>();

        FakeSource(Map<String, Optional<Set<String>>> pages) {
            this.pages = pages;
        }

        @Override
        public Optional<Set<String>> fetchTitles(String url) {
            requested.add(url);
            return pages.getOrDefault(url, Optional.empty());
        }
    }
}
