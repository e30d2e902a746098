package com.vrecdat.filter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MatchSelectorTest {

    private MatchSelector selector;

    @BeforeEach
    void setUp() {
        selector = new MatchSelector();
    }

    @Test
    @DisplayName("One regional variant is kept and the unrelated entry is dropped")
    void testEndToEndScenario() {
        CatalogIndex index = index("Super Game (USA)", "Super Game (Japan)", "Other Title");
        SelectionResult result = selector.selectBestMatches(index, Set.of("super game"), 90);

        assertEquals(1, result.selection().size());
        assertTrue(result.selection().contains("Super Game (USA)"));
        assertFalse(result.selection().contains("Other Title"));
        assertEquals(Set.of("super game"), result.matchedTitles());
    }

    @Test
    @DisplayName("Titles without a match above the threshold stay unmatched")
    void testNothingMatches() {
        CatalogIndex index = index("Sonic the Hedgehog (USA)", "Streets of Rage (Europe)");
        SelectionResult result = selector.selectBestMatches(index, Set.of("alpha", "beta"), 90);

        assertTrue(result.selection().isEmpty());
        assertTrue(result.matchedTitles().isEmpty());
    }

    @Test
    @DisplayName("Raising the threshold never adds entries")
    void testThresholdMonotonicity() {
        CatalogIndex index = index("Super Game (USA)", "Super Game Deluxe (USA)", "Streets of Rage 2 (USA)",
            "Streets of Rage (Europe)", "Sonic the Hedgehog (USA)", "Other Title");
        Set<String> titles = Set.of("super game", "streets of rage", "sonic", "bare knuckle");

        Set<String> previous = null;
        for (int threshold = 0; threshold <= 100; threshold += 10) {
            Set<String> names = new HashSet<>(selector.selectBestMatches(index, titles, threshold).selection().names());
            if (previous != null) {
                assertTrue(previous.containsAll(names), "Threshold " + threshold + " selected " + names + " outside " + previous);
            }
            previous = names;
        }
    }

    @Test
    @DisplayName("Two titles choosing the same entry keep it once")
    void testDuplicateSelectionsCoalesce() {
        CatalogIndex index = index("Super Game (USA)", "Super Game (Japan)");
        SelectionResult result = selector.selectBestMatches(index, Set.of("super game", "super game usa"), 90);

        assertEquals(1, result.selection().size());
        assertEquals(Set.of("super game", "super game usa"), result.matchedTitles());
    }

    @Test
    @DisplayName("Part 1 brings its other parts, even when listed after them")
    void testMultiPartBundle() {
        CatalogIndex index = index("Epic Quest (USA) (Disc 2)", "Epic Quest (USA) (Disc 1)", "Epic Quest (USA) (Disc 3)",
            "Epic Quest (Europe) (Disc 2)");
        SelectionResult result = selector.selectBestMatches(index, Set.of("epic quest"), 90);

        assertEquals(List.of("Epic Quest (USA) (Disc 1)", "Epic Quest (USA) (Disc 2)", "Epic Quest (USA) (Disc 3)"),
            new ArrayList<>(result.selection().names()));
    }

    @Test
    @DisplayName("Matched and unmatched titles partition the reference titles")
    void testCoverageComplement() {
        CatalogIndex index = index("Super Game (USA)", "Streets of Rage (Europe)");
        Set<String> titles = Set.of("super game", "streets of rage", "alpha");
        SelectionResult result = selector.selectBestMatches(index, titles, 90);

        Set<String> unmatched = new HashSet<>(titles);
        unmatched.removeAll(result.matchedTitles());
        assertTrue(titles.containsAll(result.matchedTitles()));
        assertEquals(Set.of("alpha"), unmatched);
        assertEquals(titles.size(), result.matchedTitles().size() + unmatched.size());
    }

    @Test
    @DisplayName("A failing scorer pair counts as no match, even at threshold 0")
    void testScorerFailureSkipsPair() {
        SimilarityScorer flaky = (a, b) -> a.contains("broken")
            ? ScoreResult.failure("boom")
            : ScoreResult.success(new MatchScore(100, 100));
        MatchSelector withFlakyScorer = new MatchSelector(flaky);
        CatalogIndex index = index("Broken Game", "Working Game");

        SelectionResult result = withFlakyScorer.selectBestMatches(index, Set.of("anything"), 0);

        assertEquals(Set.of("Working Game"), result.selection().names());
    }

    @Test
    @DisplayName("Entries normalizing to nothing are never selected")
    void testEmptyNormalizedNames() {
        CatalogIndex index = index("(USA)", "[BIOS]");
        SelectionResult result = selector.selectBestMatches(index, Set.of("usa"), 0);

        assertTrue(result.selection().isEmpty());
        assertEquals(2, index.size());
        assertTrue(index.indexedEntries().isEmpty());
    }

    @Test
    @DisplayName("Existing selections are extended, not replaced")
    void testExtendsExistingSelection() {
        CatalogIndex index = index("Super Game (USA)", "Other Title");
        SelectionSet.Builder builder = SelectionSet.builder();
        builder.add(index.entries().get(1));

        SelectionResult result = selector.selectBestMatches(index, Set.of("super game"), 90, builder.build());

        assertEquals(Set.of("Super Game (USA)", "Other Title"), result.selection().names());
    }

    @Test
    @DisplayName("Thresholds outside 0-100 are rejected")
    void testThresholdRange() {
        CatalogIndex index = index("Super Game");
        assertThrows(IllegalArgumentException.class, () -> selector.selectBestMatches(index, Set.of("x"), 101));
        assertThrows(IllegalArgumentException.class, () -> selector.selectBestMatches(index, Set.of("x"), -1));
        assertDoesNotThrow(() -> selector.selectBestMatches(index, Set.of("x"), 100));
    }

    static CatalogIndex index(String... names) {
        List<CatalogEntry> entries = new ArrayList<>();
        for (String name : names) entries.add(new CatalogEntry(name, null));
        return CatalogIndex.build(entries);
    }
}
